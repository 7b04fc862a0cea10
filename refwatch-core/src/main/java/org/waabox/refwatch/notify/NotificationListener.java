package org.waabox.refwatch.notify;

/**
 * A listener notified of every event published on a
 * {@link NotificationBus}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface NotificationListener {

  /**
   * Called when an event is published.
   *
   * @param event the published event, never null
   */
  void onNotification(NotificationEvent event);
}
