package org.waabox.refwatch.pipeline;

/**
 * The channel through which a running step reports to its host pipeline.
 *
 * <p>Keys starting with an underscore are reserved for values the step
 * persists for its own future runs; hosts accept a single write per run
 * for them.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ResultChannel {

  /**
   * Reports the current status of the running step.
   *
   * @param status the status, never null
   */
  void status(StepStatus status);

  /**
   * Reports a detail of the step result.
   *
   * @param key   the detail key, never null
   * @param value the value, may be null
   */
  void put(String key, Object value);

  /**
   * Appends a line to the step output shown to the user.
   *
   * @param line the line, never null
   */
  void out(String line);
}
