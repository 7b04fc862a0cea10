package org.waabox.refwatch.cancel;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The kill switch of a pipeline step.
 *
 * <p>The signal is owned by whoever invokes the step: it is created before
 * the step starts and flipped from {@code false} to {@code true} at most
 * once. Steps only read it, either directly through {@link #isKilled()} or
 * by registering a {@link CancellationObserver}.
 *
 * <p>Thread safety: this class is thread-safe. Observers are notified on
 * the thread calling {@link #kill()}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CancellationSignal {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(CancellationSignal.class);

  /** Whether the step has been killed. */
  private final AtomicBoolean killed = new AtomicBoolean(false);

  /** The registered observers. */
  private final List<CancellationObserver> observers =
      new CopyOnWriteArrayList<>();

  /**
   * Kills the step, notifying every registered observer of the
   * {@code false -> true} transition. Subsequent calls do nothing.
   */
  public void kill() {
    if (!killed.compareAndSet(false, true)) {
      return;
    }
    for (final CancellationObserver observer : observers) {
      try {
        observer.onChange(false, true);
      } catch (final Exception e) {
        log.error("Cancellation observer threw exception", e);
      }
    }
  }

  /**
   * Returns whether the step has been killed.
   *
   * @return true once {@link #kill()} was called
   */
  public boolean isKilled() {
    return killed.get();
  }

  /**
   * Registers an observer.
   *
   * <p>An observer registered after the kill is not called back; callers
   * interested in the current value check {@link #isKilled()} after
   * registering.
   *
   * @param observer the observer, never null
   */
  public void addObserver(final CancellationObserver observer) {
    Objects.requireNonNull(observer, "observer cannot be null");
    observers.add(observer);
  }

  /**
   * Deregisters an observer. Removing an unknown observer does nothing.
   *
   * @param observer the observer, never null
   */
  public void removeObserver(final CancellationObserver observer) {
    Objects.requireNonNull(observer, "observer cannot be null");
    observers.remove(observer);
  }

  /**
   * Returns the number of registered observers.
   *
   * @return the observer count
   */
  public int observerCount() {
    return observers.size();
  }
}
