package org.waabox.refwatch;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.refwatch.git.Commit;
import org.waabox.refwatch.git.CommitReport;
import org.waabox.refwatch.git.GitClient;
import org.waabox.refwatch.git.GitConfig;
import org.waabox.refwatch.git.GitOperationException;
import org.waabox.refwatch.pipeline.ResultChannel;
import org.waabox.refwatch.pipeline.StepContext;
import org.waabox.refwatch.pipeline.StepResult;
import org.waabox.refwatch.pipeline.StepStatus;

/**
 * Pipeline steps that work on a clone of the watched repository: cloning
 * it, listing the commits a change brought in, and tagging a revision.
 *
 * <p>Wrong arguments and failed git operations end the step with a
 * {@link StepStatus#FAILURE} result carrying a message; they are never
 * thrown to the pipeline.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class GitSteps {

  /** Result key of the commits listed by {@link #listChanges}. */
  public static final String COMMITS = "commits";

  /** Class logger. */
  private static final Logger log = LoggerFactory.getLogger(GitSteps.class);

  /** The ref cloned when none is given. */
  private static final String DEFAULT_REF = "master";

  /** The revision tagged when none is given. */
  private static final String DEFAULT_REVISION = "HEAD";

  /** Message for a missing working directory. */
  static final String NO_WORKING_DIRECTORY =
      "No working directory (cwd) defined. Did you clone the repository?";

  /** Message for a working directory that is not a clone. */
  static final String NO_GIT_DIRECTORY = "No .git directory found in working"
      + " directory. Did you clone the repository?";

  /** The version control client, never null. */
  private final GitClient gitClient;

  /** Formats listed commits, never null. */
  private final CommitReport report;

  /**
   * Creates the steps, printing commit times in the system zone.
   *
   * @param theGitClient the version control client, never null
   */
  public GitSteps(final GitClient theGitClient) {
    this(theGitClient, CommitReport.systemDefault());
  }

  /**
   * Creates the steps.
   *
   * @param theGitClient the version control client, never null
   * @param theReport    formats listed commits, never null
   */
  public GitSteps(final GitClient theGitClient, final CommitReport theReport) {
    gitClient = Objects.requireNonNull(theGitClient,
        "gitClient cannot be null");
    report = Objects.requireNonNull(theReport, "report cannot be null");
  }

  /**
   * Clones a repository into a working directory and checks out a ref.
   *
   * @param ctx    the step context, never null
   * @param repo   the repository uri, never null
   * @param ref    the ref to check out, {@code master} if null
   * @param cwd    the directory to clone into, never null
   * @param config the step's own git settings, never null
   * @return the step result, never null
   */
  public StepResult cloneRepository(final StepContext ctx, final String repo,
      final String ref, final Path cwd, final GitConfig config) {
    Objects.requireNonNull(ctx, "ctx cannot be null");
    Objects.requireNonNull(repo, "repo cannot be null");
    Objects.requireNonNull(cwd, "cwd cannot be null");
    Objects.requireNonNull(config, "config cannot be null");

    final ResultChannel out = ctx.resultChannel();
    final String refToCheckout = ref != null ? ref : DEFAULT_REF;

    out.out("Cloning " + repo + "...");
    final Optional<String> checkedOut;
    try {
      checkedOut = gitClient.cloneAndCheckout(repo, refToCheckout, cwd,
          ctx.gitConfig().merge(config));
    } catch (final GitOperationException e) {
      log.warn("Could not clone {} into {}", repo, cwd, e);
      return failure(out, "Failure: Could not clone " + repo + ": "
          + e.getMessage());
    }

    if (checkedOut.isEmpty()) {
      return failure(out, "Failure: Could not find ref " + refToCheckout);
    }
    out.out("Checked out " + checkedOut.get());
    return StepResult.success();
  }

  /**
   * Prints the commits between the old and the new revision of a change,
   * oldest first. Without both revisions, prints the current HEAD commit.
   *
   * @param ctx  the step context, never null
   * @param args the working directory and revisions, never null
   * @return the step result carrying the commits under {@value #COMMITS},
   *         never null
   */
  public StepResult listChanges(final StepContext ctx,
      final ListChangesArgs args) {
    Objects.requireNonNull(ctx, "ctx cannot be null");
    Objects.requireNonNull(args, "args cannot be null");

    final ResultChannel out = ctx.resultChannel();

    final Optional<String> invalidCwd = checkWorkingDirectory(args.cwd());
    if (invalidCwd.isPresent()) {
      return failure(out, invalidCwd.get());
    }

    try {
      if (args.oldRevision() == null || args.revision() == null) {
        out.out("No old or current revision found.");
        out.out("Current HEAD:");
        return outputCommits(out,
            List.of(gitClient.singleCommit(args.cwd(), DEFAULT_REVISION)));
      }
      return outputCommits(out, gitClient.commitsBetween(args.cwd(),
          args.oldRevision(), args.revision()));
    } catch (final GitOperationException e) {
      log.warn("Could not list changes in {}", args.cwd(), e);
      return failure(out, "Failure: Could not list changes: "
          + e.getMessage());
    }
  }

  /**
   * Tags a revision and pushes all branches and tags to a remote.
   *
   * @param ctx      the step context, never null
   * @param cwd      the working directory of a clone, may be null
   * @param repo     the remote to push to, may be null or empty
   * @param revision the revision to tag, {@code HEAD} if null
   * @param tag      the tag name, may be null or empty
   * @param config   the step's own git settings, never null
   * @return the step result, never null
   */
  public StepResult tagVersion(final StepContext ctx, final Path cwd,
      final String repo, final String revision, final String tag,
      final GitConfig config) {
    Objects.requireNonNull(ctx, "ctx cannot be null");
    Objects.requireNonNull(config, "config cannot be null");

    final ResultChannel out = ctx.resultChannel();

    final Optional<String> invalidCwd = checkWorkingDirectory(cwd);
    if (invalidCwd.isPresent()) {
      return failure(out, invalidCwd.get());
    }
    if (tag == null || tag.isEmpty()) {
      return failure(out, "No tag name was given.");
    }
    if (repo == null || repo.isEmpty()) {
      return failure(out, "No remote repository was given.");
    }

    final String revisionToTag = revision != null ? revision : DEFAULT_REVISION;
    try {
      out.out("Tagging " + revisionToTag + " with " + tag + "...");
      gitClient.tag(cwd, revisionToTag, tag);
      out.out("Pushing changes...");
      gitClient.push(cwd, repo, ctx.gitConfig().merge(config));
    } catch (final GitOperationException e) {
      log.warn("Could not tag {} with {} in {}", revisionToTag, tag, cwd, e);
      return failure(out, "Failure: Could not tag " + revisionToTag + ": "
          + e.getMessage());
    }
    return StepResult.success();
  }

  /**
   * Checks that the working directory is set and holds a clone.
   *
   * @param cwd the working directory, may be null
   * @return the failure message, or empty if the directory is usable
   */
  private static Optional<String> checkWorkingDirectory(final Path cwd) {
    if (cwd == null) {
      return Optional.of(NO_WORKING_DIRECTORY);
    }
    if (!Files.exists(cwd.resolve(".git"))) {
      return Optional.of(NO_GIT_DIRECTORY);
    }
    return Optional.empty();
  }

  /**
   * Prints the commits and wraps them in a successful result.
   *
   * @param out     the step output, never null
   * @param commits the commits, oldest first, never null
   * @return the result, never null
   */
  private StepResult outputCommits(final ResultChannel out,
      final List<Commit> commits) {
    for (final Commit commit : commits) {
      out.out(report.line(commit));
    }
    return new StepResult(StepStatus.SUCCESS, Map.of(COMMITS, commits));
  }

  /**
   * Prints the message and wraps it in a failed result.
   *
   * @param out     the step output, never null
   * @param message the failure message, never null
   * @return the result, never null
   */
  private static StepResult failure(final ResultChannel out,
      final String message) {
    out.out(message);
    return StepResult.failure(message);
  }
}
