package org.waabox.refwatch.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link ResultChannel} that keeps everything reported in memory.
 *
 * <p>Rejects a second write of a reserved ({@code _}-prefixed) key.
 *
 * <p>Thread safety: this class is thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CollectingResultChannel implements ResultChannel {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(CollectingResultChannel.class);

  /** Prefix of reserved keys. */
  private static final String RESERVED_PREFIX = "_";

  /** Reported statuses, in order. */
  private final List<StepStatus> statuses = new ArrayList<>();

  /** Reported details. */
  private final Map<String, Object> details = new LinkedHashMap<>();

  /** Output lines, in order. */
  private final List<String> output = new ArrayList<>();

  /** {@inheritDoc} */
  @Override
  public synchronized void status(final StepStatus status) {
    Objects.requireNonNull(status, "status cannot be null");
    statuses.add(status);
  }

  /**
   * {@inheritDoc}
   *
   * @throws IllegalStateException if a reserved key is written twice
   */
  @Override
  public synchronized void put(final String key, final Object value) {
    Objects.requireNonNull(key, "key cannot be null");
    if (key.startsWith(RESERVED_PREFIX) && details.containsKey(key)) {
      throw new IllegalStateException(
          "Reserved key '" + key + "' was already written");
    }
    details.put(key, value);
  }

  /** {@inheritDoc} */
  @Override
  public synchronized void out(final String line) {
    Objects.requireNonNull(line, "line cannot be null");
    log.debug("step output: {}", line);
    output.add(line);
  }

  /**
   * Returns the reported statuses, oldest first.
   *
   * @return a copy of the statuses, never null
   */
  public synchronized List<StepStatus> statuses() {
    return List.copyOf(statuses);
  }

  /**
   * Returns the reported details.
   *
   * @return an unmodifiable copy of the details, never null
   */
  public synchronized Map<String, Object> details() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(details));
  }

  /**
   * Returns the output lines, oldest first.
   *
   * @return a copy of the output, never null
   */
  public synchronized List<String> output() {
    return List.copyOf(output);
  }

  /**
   * Returns the output as a single newline separated text.
   *
   * @return the output text, never null
   */
  public synchronized String outputText() {
    return String.join("\n", output);
  }
}
