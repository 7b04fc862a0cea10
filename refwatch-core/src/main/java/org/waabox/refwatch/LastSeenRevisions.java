package org.waabox.refwatch;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.waabox.refwatch.pipeline.StepContext;
import org.waabox.refwatch.pipeline.StepResult;

/**
 * Carries the last seen {@link RevisionSnapshot} from one run of a watcher
 * step to the next.
 *
 * <p>The snapshot is stored under {@value #KEY} in the step result and
 * always written through the step's result channel, so that nothing else
 * in the pipeline overwrites it.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class LastSeenRevisions {

  /** The result key of the persisted snapshot. */
  public static final String KEY = "_git-last-seen-revisions";

  /** Private constructor to prevent instantiation. */
  private LastSeenRevisions() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Reads the snapshot persisted by the most recent previous run.
   *
   * @param ctx the step context, never null
   * @return the snapshot, or empty if no previous run persisted one
   */
  public static Optional<RevisionSnapshot> load(final StepContext ctx) {
    Objects.requireNonNull(ctx, "ctx cannot be null");
    return ctx.history().mostRecentResultWith(KEY)
        .map(result -> result.get(KEY))
        .map(LastSeenRevisions::toSnapshot);
  }

  /**
   * Persists the snapshot for the next run and adds it to the result.
   *
   * @param ctx      the step context, never null
   * @param result   the result of the run, never null
   * @param lastSeen the snapshot to persist, null if none was ever taken,
   *                 in which case nothing is written
   * @return the result carrying the snapshot, never null
   */
  public static StepResult persist(final StepContext ctx,
      final StepResult result, final RevisionSnapshot lastSeen) {
    Objects.requireNonNull(ctx, "ctx cannot be null");
    Objects.requireNonNull(result, "result cannot be null");

    if (lastSeen == null) {
      return result;
    }
    ctx.resultChannel().put(KEY, lastSeen);
    return result.with(KEY, lastSeen);
  }

  /**
   * Converts a persisted value back into a snapshot. Histories that store
   * results in a serialized form hand back a plain map.
   *
   * @param value the persisted value, never null
   * @return the snapshot, never null
   */
  static RevisionSnapshot toSnapshot(final Object value) {
    if (value instanceof RevisionSnapshot snapshot) {
      return snapshot;
    }
    if (value instanceof Map<?, ?> map) {
      final Map<String, String> revisions = new LinkedHashMap<>();
      map.forEach((ref, revision) ->
          revisions.put(String.valueOf(ref), String.valueOf(revision)));
      return RevisionSnapshot.of(revisions);
    }
    throw new RefWatchException("Unexpected value under " + KEY + ": "
        + value.getClass().getName());
  }
}
