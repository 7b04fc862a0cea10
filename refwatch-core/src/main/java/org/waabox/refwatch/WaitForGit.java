package org.waabox.refwatch;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.refwatch.git.GitClient;
import org.waabox.refwatch.git.GitConfig;
import org.waabox.refwatch.notify.NotificationSubscription;
import org.waabox.refwatch.pipeline.StepContext;
import org.waabox.refwatch.pipeline.StepResult;
import org.waabox.refwatch.pipeline.StepStatus;

/**
 * The pipeline step that waits for a ref of a remote repository to move.
 *
 * <p>A run:
 * <ol>
 *   <li>recovers the last seen snapshot from the step history, or takes a
 *       live one if no previous run persisted any,</li>
 *   <li>subscribes to notifications for the remote,</li>
 *   <li>polls with a {@link RevisionPoller} until a ref moves or the step
 *       is killed,</li>
 *   <li>unsubscribes, whatever the outcome,</li>
 *   <li>persists the final snapshot for the next run.</li>
 * </ol>
 *
 * <p>On a change the result is {@link StepStatus#SUCCESS} with the details
 * {@value #CHANGED_REF}, {@value #CHANGED_REMOTE}, {@value #REVISION},
 * {@value #OLD_REVISION} and {@value #ALL_REVISIONS}. A killed run returns
 * {@link StepStatus#KILLED}.
 *
 * <p>Usage:
 * <pre>{@code
 * WaitForGit waitForGit = new WaitForGit(new JGitClient());
 * StepResult result = waitForGit.waitForGit(ctx,
 *     "git@github.com:example/repo.git",
 *     WaitForGitOptions.builder()
 *         .ref(Pattern.compile("refs/tags/v.*"))
 *         .pollInterval(Duration.ofSeconds(30))
 *         .build());
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class WaitForGit {

  /** Result key of the name of the ref that moved. */
  public static final String CHANGED_REF = "changed-ref";

  /** Result key of the remote the ref moved on. */
  public static final String CHANGED_REMOTE = "changed-remote";

  /** Result key of the new revision of the ref. */
  public static final String REVISION = "revision";

  /** Result key of the previous revision of the ref. */
  public static final String OLD_REVISION = "old-revision";

  /** Result key of the full snapshot the change was found in. */
  public static final String ALL_REVISIONS = "all-revisions";

  /** Class logger. */
  private static final Logger log = LoggerFactory.getLogger(WaitForGit.class);

  /** The version control client, never null. */
  private final GitClient gitClient;

  /**
   * Creates the step.
   *
   * @param theGitClient the version control client, never null
   */
  public WaitForGit(final GitClient theGitClient) {
    gitClient = Objects.requireNonNull(theGitClient,
        "gitClient cannot be null");
  }

  /**
   * Waits for {@code refs/heads/master} of the remote to move, polling
   * every 10 seconds.
   *
   * @param ctx    the step context, never null
   * @param remote the remote repository uri, never null
   * @return the step result, never null
   */
  public StepResult waitForGit(final StepContext ctx, final String remote) {
    return waitForGit(ctx, remote, WaitForGitOptions.defaults());
  }

  /**
   * Waits for a watched ref of the remote to move.
   *
   * @param ctx     the step context, never null
   * @param remote  the remote repository uri, never null
   * @param options the step options, never null
   * @return the step result, never null
   */
  public StepResult waitForGit(final StepContext ctx, final String remote,
      final WaitForGitOptions options) {
    Objects.requireNonNull(ctx, "ctx cannot be null");
    Objects.requireNonNull(remote, "remote cannot be null");
    Objects.requireNonNull(options, "options cannot be null");

    final GitConfig gitConfig = ctx.gitConfig().merge(options.gitConfig());
    final RevisionPoller poller = new RevisionPoller(gitClient, remote,
        options.ref(), gitConfig, options.pollInterval());

    log.info("Waiting for {} on {}, polling every {} ms", options.ref(),
        remote, options.pollInterval().toMillis());

    final RevisionSnapshot initial = LastSeenRevisions.load(ctx)
        .or(() -> poller.fetchCurrentRevisions(ctx.resultChannel()))
        .orElse(null);

    final PollOutcome outcome;
    try (NotificationSubscription notifications =
        ctx.notificationBus().subscribe(remote)) {
      outcome = poller.pollUntilChanged(ctx, initial, notifications);
    }

    final StepResult result = outcome.changeEvent()
        .map(WaitForGit::success)
        .orElseGet(StepResult::killed);

    return LastSeenRevisions.persist(ctx, result, outcome.lastSeen());
  }

  /**
   * Converts a change into the step result.
   *
   * @param change the change, never null
   * @return the result, never null
   */
  private static StepResult success(final ChangeEvent change) {
    return StepResult.success()
        .with(CHANGED_REF, change.changedRef())
        .with(CHANGED_REMOTE, change.remote())
        .with(REVISION, change.revision())
        .with(OLD_REVISION, change.oldRevision())
        .with(ALL_REVISIONS, change.allRevisions());
  }
}
