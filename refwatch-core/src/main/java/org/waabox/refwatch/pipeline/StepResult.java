package org.waabox.refwatch.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The result of a pipeline step: a status plus arbitrary details.
 *
 * <p>Details become visible to later runs through the
 * {@link StepHistory}. Values may be null. The details map is an
 * unmodifiable copy.
 *
 * @param status  the step status, never null
 * @param details the additional key/value pairs, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record StepResult(StepStatus status, Map<String, Object> details) {

  /** The detail key holding the human readable output of a step. */
  public static final String OUT = "out";

  /** Compact constructor that validates and copies the details. */
  public StepResult {
    Objects.requireNonNull(status, "status cannot be null");
    Objects.requireNonNull(details, "details cannot be null");
    details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
  }

  /**
   * Creates a successful result without details.
   *
   * @return the result, never null
   */
  public static StepResult success() {
    return new StepResult(StepStatus.SUCCESS, Map.of());
  }

  /**
   * Creates a failed result carrying a human readable message.
   *
   * @param message the message explaining the failure, never null
   * @return the result, never null
   */
  public static StepResult failure(final String message) {
    Objects.requireNonNull(message, "message cannot be null");
    return new StepResult(StepStatus.FAILURE, Map.of(OUT, message));
  }

  /**
   * Creates the result of a step that stopped because it was killed.
   *
   * @return the result, never null
   */
  public static StepResult killed() {
    return new StepResult(StepStatus.KILLED, Map.of());
  }

  /**
   * Returns a copy of this result with one more detail.
   *
   * @param key   the detail key, never null
   * @param value the detail value, may be null
   * @return the new result, never null
   */
  public StepResult with(final String key, final Object value) {
    Objects.requireNonNull(key, "key cannot be null");
    final Map<String, Object> copy = new LinkedHashMap<>(details);
    copy.put(key, value);
    return new StepResult(status, copy);
  }

  /**
   * Returns the value of a detail.
   *
   * @param key the detail key, never null
   * @return the value, null if absent or null
   */
  public Object get(final String key) {
    return details.get(key);
  }

  /**
   * Returns whether a detail is present, even with a null value.
   *
   * @param key the detail key, never null
   * @return true if the key is present
   */
  public boolean has(final String key) {
    return details.containsKey(key);
  }
}
