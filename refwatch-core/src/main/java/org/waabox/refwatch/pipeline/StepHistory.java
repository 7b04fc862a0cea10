package org.waabox.refwatch.pipeline;

import java.util.Optional;

/**
 * The execution history of a pipeline step.
 *
 * <p>Append-only: every finished run records its result, and a new run
 * looks up values persisted by earlier ones.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface StepHistory {

  /**
   * Finds the result of the most recent run that carries the given key.
   *
   * @param key the detail key, never null
   * @return the result, or empty if no recorded run carries the key
   */
  Optional<StepResult> mostRecentResultWith(String key);

  /**
   * Records the result of a finished run.
   *
   * @param result the result, never null
   */
  void record(StepResult result);
}
