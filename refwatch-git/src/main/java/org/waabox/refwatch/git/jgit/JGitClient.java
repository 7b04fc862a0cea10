package org.waabox.refwatch.git.jgit;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.TransportCommand;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.errors.RevisionSyntaxException;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.lib.Ref;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.transport.CredentialsProvider;
import org.eclipse.jgit.transport.SshSessionFactory;
import org.eclipse.jgit.transport.UsernamePasswordCredentialsProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.refwatch.RefPredicate;
import org.waabox.refwatch.RevisionSnapshot;
import org.waabox.refwatch.git.Commit;
import org.waabox.refwatch.git.GitClient;
import org.waabox.refwatch.git.GitConfig;
import org.waabox.refwatch.git.GitOperationException;

/**
 * A {@link GitClient} backed by JGit.
 *
 * <p>Every command that talks to a remote (ls-remote, clone, push) gets the
 * timeout, credentials and SSH settings of the {@link GitConfig} it is
 * called with.
 *
 * <p>Thread safety: this class is thread-safe; each call opens and closes
 * its own repository handle.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JGitClient implements GitClient {

  /** Class logger. */
  private static final Logger log = LoggerFactory.getLogger(JGitClient.class);

  /** Whether a process wide SSH session factory was installed. */
  private static final AtomicBoolean GLOBAL_SSH_INSTALLED =
      new AtomicBoolean(false);

  /**
   * Installs a process wide SSH session factory built from the given SSH
   * settings.
   *
   * <p>Once installed, per step SSH settings are rejected with a
   * {@link SshConfigurationClashException} when an SSH transport is
   * engaged.
   *
   * @param ssh the SSH settings, see {@link GitConfig}, never null
   *
   * @deprecated pass the SSH settings in the {@link GitConfig} of the
   *     pipeline or the step instead.
   */
  @Deprecated
  public static void installGlobalSshSessionFactory(
      final Map<String, String> ssh) {
    Objects.requireNonNull(ssh, "ssh cannot be null");
    SshSessionFactory.setInstance(SshSessionFactories.forConfig(ssh));
    GLOBAL_SSH_INSTALLED.set(true);
    log.warn("Installed a global SSH session factory; per step SSH settings"
        + " will be rejected");
  }

  /** {@inheritDoc} */
  @Override
  public RevisionSnapshot currentRevisions(final String remote,
      final RefPredicate refs, final GitConfig config) {
    Objects.requireNonNull(remote, "remote cannot be null");
    Objects.requireNonNull(refs, "refs cannot be null");
    Objects.requireNonNull(config, "config cannot be null");

    final Map<String, Ref> remoteRefs;
    try {
      remoteRefs = configureTransport(Git.lsRemoteRepository(), config)
          .setHeads(true)
          .setTags(true)
          .setRemote(remote)
          .callAsMap();
    } catch (final GitAPIException e) {
      throw new GitOperationException("Could not list refs of " + remote, e);
    }

    final Map<String, String> revisions = new LinkedHashMap<>();
    for (final Map.Entry<String, Ref> entry : remoteRefs.entrySet()) {
      if (refs.matches(entry.getKey())) {
        revisions.put(entry.getKey(), entry.getValue().getObjectId().name());
      }
    }
    log.debug("Current revisions of {} on {}: {}", refs, remote, revisions);
    return RevisionSnapshot.of(revisions);
  }

  /** {@inheritDoc} */
  @Override
  public Optional<String> cloneAndCheckout(final String remote,
      final String ref, final Path cwd, final GitConfig config) {
    Objects.requireNonNull(remote, "remote cannot be null");
    Objects.requireNonNull(ref, "ref cannot be null");
    Objects.requireNonNull(cwd, "cwd cannot be null");
    Objects.requireNonNull(config, "config cannot be null");

    log.info("Cloning {} into {}", remote, cwd);

    try (Git git = configureTransport(Git.cloneRepository(), config)
        .setURI(remote)
        .setDirectory(cwd.toFile())
        .call()) {

      final Optional<String> existing = findRef(git, ref);
      if (existing.isPresent()) {
        log.info("Checking out {}", existing.get());
        git.checkout().setName(existing.get()).call();
      }
      return existing;

    } catch (final GitAPIException | IOException e) {
      throw new GitOperationException("Could not clone " + remote, e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public List<Commit> commitsBetween(final Path cwd, final String from,
      final String to) {
    Objects.requireNonNull(cwd, "cwd cannot be null");
    Objects.requireNonNull(from, "from cannot be null");
    Objects.requireNonNull(to, "to cannot be null");

    try (Git git = Git.open(cwd.toFile())) {
      final List<Commit> commits = new ArrayList<>();
      for (final RevCommit commit : git.log()
          .addRange(resolve(git, from), resolve(git, to))
          .call()) {
        commits.add(toCommit(commit));
      }
      // git log lists newest first.
      Collections.reverse(commits);
      return commits;
    } catch (final GitAPIException | IOException e) {
      throw new GitOperationException("Could not list commits between "
          + from + " and " + to + " in " + cwd, e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public Commit singleCommit(final Path cwd, final String revision) {
    Objects.requireNonNull(cwd, "cwd cannot be null");
    Objects.requireNonNull(revision, "revision cannot be null");

    try (Git git = Git.open(cwd.toFile());
         RevWalk walk = new RevWalk(git.getRepository())) {
      return toCommit(walk.parseCommit(resolve(git, revision)));
    } catch (final IOException e) {
      throw new GitOperationException("Could not read commit " + revision
          + " in " + cwd, e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void tag(final Path cwd, final String revision, final String tag) {
    Objects.requireNonNull(cwd, "cwd cannot be null");
    Objects.requireNonNull(revision, "revision cannot be null");
    Objects.requireNonNull(tag, "tag cannot be null");

    log.info("Tagging {} with {} in {}", revision, tag, cwd);

    try (Git git = Git.open(cwd.toFile());
         RevWalk walk = new RevWalk(git.getRepository())) {
      git.tag()
          .setObjectId(walk.parseCommit(resolve(git, revision)))
          .setName(tag)
          .call();
    } catch (final GitAPIException | IOException e) {
      throw new GitOperationException("Could not tag " + revision + " with "
          + tag + " in " + cwd, e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void push(final Path cwd, final String remote,
      final GitConfig config) {
    Objects.requireNonNull(cwd, "cwd cannot be null");
    Objects.requireNonNull(remote, "remote cannot be null");
    Objects.requireNonNull(config, "config cannot be null");

    log.info("Pushing branches and tags of {} to {}", cwd, remote);

    try (Git git = Git.open(cwd.toFile())) {
      configureTransport(git.push(), config)
          .setPushAll()
          .setPushTags()
          .setRemote(remote)
          .call();
    } catch (final GitAPIException | IOException e) {
      throw new GitOperationException("Could not push " + cwd + " to "
          + remote, e);
    }
  }

  /**
   * Applies timeout, credentials and SSH settings to a transport command.
   *
   * @param <C>     the command type
   * @param command the command, never null
   * @param config  the settings, never null
   * @return the same command, never null
   */
  private static <C extends TransportCommand<C, ?>> C configureTransport(
      final C command, final GitConfig config) {
    final CredentialsProvider credentials = config.username()
        .<CredentialsProvider>map(user -> new UsernamePasswordCredentialsProvider(
            user, config.password().orElse("")))
        .orElseGet(CredentialsProvider::getDefault);

    return command
        .setTimeout((int) config.timeout().toSeconds())
        .setCredentialsProvider(credentials)
        .setTransportConfigCallback(new JGitTransportConfigurer(config.ssh(),
            GLOBAL_SSH_INSTALLED::get));
  }

  /**
   * Finds the ref to check out in a fresh clone, preferring the remote
   * tracking branch.
   *
   * @param git the clone, never null
   * @param ref the requested ref, never null
   * @return the resolvable name, or empty if neither form resolves
   * @throws IOException if the repository cannot be read
   */
  private static Optional<String> findRef(final Git git, final String ref)
      throws IOException {
    for (final String candidate : List.of("origin/" + ref, ref)) {
      try {
        if (git.getRepository().resolve(candidate) != null) {
          return Optional.of(candidate);
        }
      } catch (final RevisionSyntaxException e) {
        throw new GitOperationException("Invalid ref: " + ref, e);
      }
    }
    return Optional.empty();
  }

  /**
   * Resolves a revision expression to an object id.
   *
   * @param git      the repository, never null
   * @param revision the revision, never null
   * @return the object id, never null
   * @throws IOException if the repository cannot be read
   * @throws GitOperationException if the revision is malformed or does
   *     not exist
   */
  private static ObjectId resolve(final Git git, final String revision)
      throws IOException {
    final ObjectId id;
    try {
      id = git.getRepository().resolve(revision);
    } catch (final RevisionSyntaxException e) {
      throw new GitOperationException("Invalid revision: " + revision, e);
    }
    if (id == null) {
      throw new GitOperationException("Unknown revision: " + revision);
    }
    return id;
  }

  /**
   * Converts a JGit commit.
   *
   * @param commit the commit, never null
   * @return the commit, never null
   */
  private static Commit toCommit(final RevCommit commit) {
    final PersonIdent author = commit.getAuthorIdent();
    return new Commit(
        commit.getId().name(),
        commit.getShortMessage(),
        author.getName() + " <" + author.getEmailAddress() + ">",
        Instant.ofEpochSecond(commit.getCommitTime()));
  }
}
