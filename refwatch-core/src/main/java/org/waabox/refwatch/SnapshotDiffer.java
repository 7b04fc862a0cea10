package org.waabox.refwatch;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Finds the ref that moved between two {@link RevisionSnapshot snapshots}.
 *
 * <p>Only one change is surfaced even if several refs moved at once: the
 * first new or modified entry of the current snapshot in its iteration
 * order. Callers must not depend on which one is chosen.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SnapshotDiffer {

  /** Private constructor to prevent instantiation. */
  private SnapshotDiffer() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Computes the changed ref.
   *
   * @param previous the last seen snapshot, null if none was ever taken, in
   *                 which case every ref of {@code current} counts as new
   * @param current  the freshly taken snapshot, never null
   * @return the changed ref, or empty if {@code current} holds no new or
   *         modified entry (e.g. refs were only deleted)
   */
  public static Optional<RefChange> diff(final RevisionSnapshot previous,
      final RevisionSnapshot current) {
    Objects.requireNonNull(current, "current snapshot cannot be null");

    for (final Map.Entry<String, String> entry
        : current.revisions().entrySet()) {
      final String oldRevision = previous == null
          ? null
          : previous.revisionOf(entry.getKey());
      if (!entry.getValue().equals(oldRevision)) {
        return Optional.of(new RefChange(entry.getKey(), entry.getValue(),
            oldRevision));
      }
    }
    return Optional.empty();
  }
}
