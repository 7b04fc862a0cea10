package org.waabox.refwatch;

import java.util.Objects;
import java.util.Optional;

/**
 * How a {@link RevisionPoller} run ended: with a change, or cancelled.
 *
 * @param change   the change found, null if the run was cancelled
 * @param lastSeen the snapshot to persist for the next run; the change's
 *                 full snapshot, or the last seen snapshot at
 *                 cancellation time, null if no snapshot was ever taken
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record PollOutcome(ChangeEvent change, RevisionSnapshot lastSeen) {

  /**
   * Creates the outcome of a run that found a change.
   *
   * @param change the change, never null
   * @return the outcome, never null
   */
  public static PollOutcome changed(final ChangeEvent change) {
    Objects.requireNonNull(change, "change cannot be null");
    return new PollOutcome(change, change.allRevisions());
  }

  /**
   * Creates the outcome of a cancelled run.
   *
   * @param lastSeen the last seen snapshot, may be null
   * @return the outcome, never null
   */
  public static PollOutcome cancelled(final RevisionSnapshot lastSeen) {
    return new PollOutcome(null, lastSeen);
  }

  /**
   * Returns the change found, if any.
   *
   * @return the change, empty if the run was cancelled
   */
  public Optional<ChangeEvent> changeEvent() {
    return Optional.ofNullable(change);
  }

  /**
   * Returns whether the run was cancelled.
   *
   * @return true if no change was found
   */
  public boolean isCancelled() {
    return change == null;
  }
}
