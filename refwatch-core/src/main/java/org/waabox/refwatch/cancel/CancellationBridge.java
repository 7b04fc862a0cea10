package org.waabox.refwatch.cancel;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Turns a {@link CancellationSignal} into a one-shot future a waiting
 * thread can select on.
 *
 * <p>The future returned by {@link #fired()} completes exactly once: on the
 * first {@code false -> true} transition of the signal after
 * {@link #open(CancellationSignal)}, or right away if the signal was
 * already killed when the bridge was opened.
 *
 * <p>The bridge must be closed on every exit path, otherwise its observer
 * stays registered on the signal. Closing is idempotent.
 *
 * <p>Usage, one bridge per wait:
 * <pre>{@code
 * try (CancellationBridge bridge = CancellationBridge.open(signal)) {
 *   CompletableFuture.anyOf(bridge.fired(), other).get(timeout, unit);
 * }
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CancellationBridge implements AutoCloseable {

  /** The observed signal, never null. */
  private final CancellationSignal signal;

  /** Completed once the signal is killed. */
  private final CompletableFuture<Void> fired = new CompletableFuture<>();

  /** The view handed to callers, so they cannot complete {@link #fired}. */
  private final CompletableFuture<Void> view = fired.copy();

  /** The observer registered on the signal. */
  private final CancellationObserver observer = (oldValue, newValue) -> {
    if (oldValue != newValue && newValue) {
      fired.complete(null);
    }
  };

  /** Creates a bridge; use {@link #open(CancellationSignal)}.
   *
   * @param theSignal the signal to observe
   */
  private CancellationBridge(final CancellationSignal theSignal) {
    signal = theSignal;
  }

  /**
   * Starts observing the given signal.
   *
   * @param signal the signal, never null
   * @return the open bridge, never null
   */
  public static CancellationBridge open(final CancellationSignal signal) {
    Objects.requireNonNull(signal, "signal cannot be null");

    final CancellationBridge bridge = new CancellationBridge(signal);
    signal.addObserver(bridge.observer);

    // A kill that happened before the observer was registered.
    if (signal.isKilled()) {
      bridge.fired.complete(null);
    }
    return bridge;
  }

  /**
   * Returns a future completed when the signal is killed.
   *
   * <p>Every call returns the same dependent future; completing it does not
   * affect the bridge. Callers that wait repeatedly should open one bridge
   * per wait, since each {@code anyOf} over the future stays attached to it
   * until the bridge fires.
   *
   * @return the future, never null
   */
  public CompletableFuture<Void> fired() {
    return view;
  }

  /**
   * Returns whether the signal was killed while the bridge was open.
   *
   * @return true once the bridge fired
   */
  public boolean hasFired() {
    return fired.isDone();
  }

  /** Deregisters the observer from the signal. */
  @Override
  public void close() {
    signal.removeObserver(observer);
  }
}
