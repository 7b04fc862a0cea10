package org.waabox.refwatch.notify;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The in-process bus shared by every watcher of a pipeline.
 *
 * <p>Events for all remotes flow through the same bus; each watcher
 * narrows it down to its own remote with {@link #subscribe(String)}.
 * Listeners are called on the publishing thread, and a failing listener
 * does not prevent the others from being notified.
 *
 * <p>Thread safety: this class is thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class NotificationBus {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(NotificationBus.class);

  /** Registered listeners. */
  private final List<NotificationListener> listeners =
      new CopyOnWriteArrayList<>();

  /**
   * Publishes an event to every listener.
   *
   * @param event the event, never null
   */
  public void publish(final NotificationEvent event) {
    Objects.requireNonNull(event, "event cannot be null");

    log.debug("Publishing notification for remote {}", event.remote());

    for (final NotificationListener listener : listeners) {
      try {
        listener.onNotification(event);
      } catch (final Exception e) {
        log.error("Listener threw exception for remote '{}'",
            event.remote(), e);
      }
    }
  }

  /**
   * Registers a listener receiving every event, whatever its remote.
   *
   * @param listener the listener, never null
   */
  public void addListener(final NotificationListener listener) {
    Objects.requireNonNull(listener, "listener cannot be null");
    listeners.add(listener);
  }

  /**
   * Deregisters a listener. Removing an unknown listener does nothing.
   *
   * @param listener the listener, never null
   */
  public void removeListener(final NotificationListener listener) {
    Objects.requireNonNull(listener, "listener cannot be null");
    listeners.remove(listener);
  }

  /**
   * Opens a subscription that only keeps events for the given remote.
   *
   * <p>The subscription must be closed when the watcher stops.
   *
   * @param remote the remote repository uri, never null
   * @return the open subscription, never null
   */
  public NotificationSubscription subscribe(final String remote) {
    Objects.requireNonNull(remote, "remote cannot be null");
    final NotificationSubscription subscription =
        new NotificationSubscription(this, remote);
    addListener(subscription);
    return subscription;
  }

  /**
   * Returns the number of registered listeners, subscriptions included.
   *
   * @return the listener count
   */
  public int listenerCount() {
    return listeners.size();
  }
}
