package org.waabox.refwatch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable mapping from ref name to revision id, taken at one instant.
 *
 * <p>A snapshot covers every ref matched by the watched {@link RefPredicate}
 * at the moment it was taken. The absence of a snapshot (a remote that
 * could not be reached) is modelled by the caller as {@code null} or an
 * empty {@link java.util.Optional}; a remote without matching refs yields
 * {@link #empty()}.
 *
 * <p>Iteration order of {@link #revisions()} follows the order in which the
 * entries were supplied.
 *
 * @param revisions the revision id per ref name, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record RevisionSnapshot(Map<String, String> revisions) {

  /** The snapshot of a remote without matching refs. */
  private static final RevisionSnapshot EMPTY = new RevisionSnapshot(Map.of());

  /**
   * Compact constructor that validates and copies the
   * revisions.
   */
  public RevisionSnapshot {
    Objects.requireNonNull(revisions, "revisions cannot be null");
    final Map<String, String> copy = new LinkedHashMap<>(revisions);
    copy.forEach((ref, revision) -> {
      Objects.requireNonNull(ref, "ref name cannot be null");
      Objects.requireNonNull(revision, "revision of " + ref + " cannot be null");
    });
    revisions = Collections.unmodifiableMap(copy);
  }

  /**
   * Returns the snapshot of a remote without matching refs.
   *
   * @return the empty snapshot, never null
   */
  public static RevisionSnapshot empty() {
    return EMPTY;
  }

  /**
   * Creates a snapshot from the given revisions.
   *
   * @param revisions the revision id per ref name, never null
   * @return a new snapshot, never null
   */
  public static RevisionSnapshot of(final Map<String, String> revisions) {
    return new RevisionSnapshot(revisions);
  }

  /**
   * Creates a snapshot holding a single ref.
   *
   * @param ref      the ref name, never null
   * @param revision the revision id, never null
   * @return a new snapshot, never null
   */
  public static RevisionSnapshot of(final String ref, final String revision) {
    return new RevisionSnapshot(Map.of(ref, revision));
  }

  /**
   * Returns the revision id of the given ref.
   *
   * @param ref the ref name, never null
   * @return the revision id, or null if the ref is not part of the snapshot
   */
  public String revisionOf(final String ref) {
    return revisions.get(ref);
  }

  /**
   * Returns whether the snapshot holds no refs at all.
   *
   * @return true if no ref matched when the snapshot was taken
   */
  public boolean isEmpty() {
    return revisions.isEmpty();
  }

  @Override
  public String toString() {
    return revisions.toString();
  }
}
