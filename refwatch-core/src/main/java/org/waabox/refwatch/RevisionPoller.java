package org.waabox.refwatch;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.refwatch.cancel.CancellationBridge;
import org.waabox.refwatch.git.GitClient;
import org.waabox.refwatch.git.GitConfig;
import org.waabox.refwatch.notify.NotificationEvent;
import org.waabox.refwatch.notify.NotificationSubscription;
import org.waabox.refwatch.pipeline.ResultChannel;
import org.waabox.refwatch.pipeline.StepContext;
import org.waabox.refwatch.pipeline.StepStatus;

/**
 * Polls the refs of one remote until one of them moves or the step is
 * killed.
 *
 * <p>Each iteration takes a fresh {@link RevisionSnapshot} and compares it
 * to the last seen one. A difference ends the run with a
 * {@link ChangeEvent}. Otherwise the poller reports
 * {@link StepStatus#WAITING} and sleeps until the first of:
 * <ul>
 *   <li>the kill switch fires, which ends the run,</li>
 *   <li>a notification for the remote arrives,</li>
 *   <li>the poll interval elapses.</li>
 * </ul>
 *
 * <p>A snapshot that cannot be taken (remote unreachable) is reported and
 * skipped; the last seen snapshot is kept. The kill switch is cooperative:
 * it is checked before every fetch and wakes up a waiting poller, but it
 * never interrupts a fetch in flight.
 *
 * <p>Thread safety: a poller holds no mutable state and can be shared, but
 * each run is single threaded.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RevisionPoller {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(RevisionPoller.class);

  /** What ended a wait. */
  private enum Wakeup {
    KILLED, NOTIFIED, TIMER
  }

  /** The version control client, never null. */
  private final GitClient gitClient;

  /** The remote repository uri, never null. */
  private final String remote;

  /** The watched refs, never null. */
  private final RefPredicate refs;

  /** The transport settings, never null. */
  private final GitConfig gitConfig;

  /** The time between two polls, never null. */
  private final Duration pollInterval;

  /**
   * Creates a new poller.
   *
   * @param theGitClient    the version control client, never null
   * @param theRemote       the remote repository uri, never null
   * @param theRefs         the watched refs, never null
   * @param theGitConfig    the transport settings, never null
   * @param thePollInterval the time between two polls, must be positive
   */
  public RevisionPoller(final GitClient theGitClient, final String theRemote,
      final RefPredicate theRefs, final GitConfig theGitConfig,
      final Duration thePollInterval) {
    gitClient = Objects.requireNonNull(theGitClient,
        "gitClient cannot be null");
    remote = Objects.requireNonNull(theRemote, "remote cannot be null");
    refs = Objects.requireNonNull(theRefs, "refs cannot be null");
    gitConfig = Objects.requireNonNull(theGitConfig,
        "gitConfig cannot be null");
    Objects.requireNonNull(thePollInterval, "pollInterval cannot be null");
    if (thePollInterval.isNegative() || thePollInterval.isZero()) {
      throw new IllegalArgumentException(
          "pollInterval must be positive, got: " + thePollInterval);
    }
    pollInterval = thePollInterval;
  }

  /**
   * Takes a snapshot of the watched refs.
   *
   * <p>Failures are logged with their stack trace and summarized on the
   * step output, never thrown.
   *
   * @param out the channel to report a failure on, never null
   * @return the snapshot, or empty if it could not be taken
   */
  public Optional<RevisionSnapshot> fetchCurrentRevisions(
      final ResultChannel out) {
    try {
      return Optional.of(gitClient.currentRevisions(remote, refs, gitConfig));
    } catch (final Exception e) {
      log.warn("Could not get current revision for ref {} on {}",
          refs, remote, e);
      out.out("could not get current revision for ref " + refs + " on "
          + remote + ": " + e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Polls until a watched ref moves or the step is killed.
   *
   * @param ctx           the step context, never null
   * @param lastSeen      the snapshot to compare the first poll against,
   *                      null if none is known
   * @param notifications the notifications for the remote, never null
   * @return how the run ended, never null
   */
  public PollOutcome pollUntilChanged(final StepContext ctx,
      final RevisionSnapshot lastSeen,
      final NotificationSubscription notifications) {
    Objects.requireNonNull(ctx, "ctx cannot be null");
    Objects.requireNonNull(notifications, "notifications cannot be null");

    final ResultChannel out = ctx.resultChannel();
    out.out("Last seen revisions: " + (lastSeen != null ? lastSeen : "None")
        + ". Waiting for new commit...");

    RevisionSnapshot current = lastSeen;

    while (!ctx.cancellation().isKilled()) {
      final Optional<RevisionSnapshot> fetched = fetchCurrentRevisions(out);

      if (fetched.isPresent() && !fetched.get().equals(current)) {
        final Optional<RefChange> change =
            SnapshotDiffer.diff(current, fetched.get());
        if (change.isPresent()) {
          return PollOutcome.changed(found(out, change.get(),
              fetched.get()));
        }
        log.debug("Refs removed from {}, now watching {}", remote,
            fetched.get());
        current = fetched.get();
      }

      out.status(StepStatus.WAITING);

      final Wakeup wakeup = waitForNextPoll(ctx, notifications);
      if (wakeup == Wakeup.KILLED) {
        break;
      }
      if (wakeup == Wakeup.NOTIFIED) {
        out.out("Received notification. Polling out of schedule");
      }
    }

    log.info("Stopped waiting for {} on {}: step killed", refs, remote);
    return PollOutcome.cancelled(current);
  }

  /**
   * Builds the change event and reports it on the step output.
   *
   * @param out      the step output, never null
   * @param change   the changed ref, never null
   * @param snapshot the snapshot the change was found in, never null
   * @return the change event, never null
   */
  private ChangeEvent found(final ResultChannel out, final RefChange change,
      final RevisionSnapshot snapshot) {
    out.out("Found new commit: " + change.revision() + " on "
        + change.changedRef());
    log.info("Ref {} on {} moved from {} to {}", change.changedRef(), remote,
        change.oldRevision(), change.revision());
    return new ChangeEvent(change.changedRef(), change.revision(),
        change.oldRevision(), remote, snapshot);
  }

  /**
   * Blocks until the kill switch fires, a notification arrives or the poll
   * interval elapses, whichever happens first.
   *
   * <p>Each wait opens its own {@link CancellationBridge} and takes a fresh
   * notification future, so nothing stays attached to long lived futures
   * across polls. An interrupt counts as a kill; the interrupt flag is
   * restored.
   *
   * @param ctx           the step context, never null
   * @param notifications the notifications for the remote, never null
   * @return what ended the wait, never null
   */
  private Wakeup waitForNextPoll(final StepContext ctx,
      final NotificationSubscription notifications) {
    try (CancellationBridge killSwitch =
        CancellationBridge.open(ctx.cancellation())) {

      final CompletableFuture<Void> killed = killSwitch.fired();
      final CompletableFuture<NotificationEvent> notified =
          notifications.next();

      try {
        CompletableFuture.anyOf(killed, notified)
            .get(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
      } catch (final TimeoutException e) {
        return Wakeup.TIMER;
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        return Wakeup.KILLED;
      } catch (final ExecutionException e) {
        throw new RefWatchException("Failed waiting for the next poll of "
            + remote, e.getCause());
      } finally {
        notifications.release(notified);
      }

      if (killed.isDone()) {
        return Wakeup.KILLED;
      }
      log.debug("Received notification for {}, polling out of schedule",
          remote);
      return Wakeup.NOTIFIED;
    }
  }
}
