package org.waabox.refwatch.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A {@link StepHistory} kept in memory, lost when the process exits.
 *
 * <p>Thread safety: this class is thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class InMemoryStepHistory implements StepHistory {

  /** Recorded results, oldest first. */
  private final List<StepResult> results = new ArrayList<>();

  /** {@inheritDoc} */
  @Override
  public synchronized Optional<StepResult> mostRecentResultWith(
      final String key) {
    Objects.requireNonNull(key, "key cannot be null");
    for (int i = results.size() - 1; i >= 0; i--) {
      final StepResult result = results.get(i);
      if (result.has(key)) {
        return Optional.of(result);
      }
    }
    return Optional.empty();
  }

  /** {@inheritDoc} */
  @Override
  public synchronized void record(final StepResult result) {
    Objects.requireNonNull(result, "result cannot be null");
    results.add(result);
  }
}
