package org.waabox.refwatch.notify;

import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A watcher's private view of a {@link NotificationBus}, restricted to one
 * remote.
 *
 * <p>Matching events are held in a single slot: while an event is waiting
 * to be taken, further ones are coalesced into it, as two pending
 * "check now" requests are worth one. Events for other remotes are dropped.
 *
 * <p>A waiter calls {@link #next()} and selects on the returned future;
 * when it stops waiting without the future having completed, it hands the
 * future back with {@link #release(CompletableFuture)} so that the next
 * event is buffered instead of being delivered to nobody.
 *
 * <p>Thread safety: this class is thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class NotificationSubscription
    implements NotificationListener, AutoCloseable {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(NotificationSubscription.class);

  /** The bus this subscription is registered on, never null. */
  private final NotificationBus bus;

  /** The remote to keep events for, never null. */
  private final String remote;

  /** Guards {@link #buffered} and {@link #pending}. */
  private final Object lock = new Object();

  /** The event waiting to be taken, null if none. */
  private NotificationEvent buffered;

  /** The future handed to the current waiter, null if nobody waits. */
  private CompletableFuture<NotificationEvent> pending;

  /** Whether the subscription has been closed. */
  private volatile boolean closed;

  /** Creates a subscription; use {@link NotificationBus#subscribe(String)}.
   *
   * @param theBus    the bus
   * @param theRemote the remote to keep events for
   */
  NotificationSubscription(final NotificationBus theBus,
      final String theRemote) {
    bus = theBus;
    remote = theRemote;
  }

  /** {@inheritDoc} */
  @Override
  public void onNotification(final NotificationEvent event) {
    if (closed || !remote.equals(event.remote())) {
      return;
    }
    synchronized (lock) {
      if (pending != null) {
        final CompletableFuture<NotificationEvent> waiter = pending;
        pending = null;
        waiter.complete(event);
      } else if (buffered == null) {
        buffered = event;
      } else {
        log.debug("Coalescing notification for remote {}", remote);
      }
    }
  }

  /**
   * Returns a future completed with the next event for the remote.
   *
   * <p>If an event is already buffered the future is complete. Calling
   * this method again before the future completes returns the same
   * future.
   *
   * @return the future, never null
   */
  public CompletableFuture<NotificationEvent> next() {
    synchronized (lock) {
      if (buffered != null) {
        final NotificationEvent event = buffered;
        buffered = null;
        return CompletableFuture.completedFuture(event);
      }
      if (pending == null) {
        pending = new CompletableFuture<>();
      }
      return pending;
    }
  }

  /**
   * Hands back a future obtained from {@link #next()} that the caller no
   * longer waits on. Does nothing if the future already completed.
   *
   * @param future the future returned by {@link #next()}, never null
   */
  public void release(final CompletableFuture<NotificationEvent> future) {
    synchronized (lock) {
      if (pending == future) {
        pending = null;
      }
    }
  }

  /**
   * Returns the remote this subscription keeps events for.
   *
   * @return the remote, never null
   */
  public String remote() {
    return remote;
  }

  /**
   * Returns whether the subscription was closed.
   *
   * @return true once {@link #close()} was called
   */
  public boolean isClosed() {
    return closed;
  }

  /** Detaches the subscription from the bus. Closing twice is harmless. */
  @Override
  public void close() {
    closed = true;
    bus.removeListener(this);
  }
}
