package org.waabox.refwatch.notify;

import java.util.Objects;

/**
 * Requests an immediate re-check of a remote, bypassing the poll timer.
 *
 * @param remote the remote repository uri as configured in the watcher,
 *               never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record NotificationEvent(String remote) {

  /** Compact constructor that validates the remote. */
  public NotificationEvent {
    Objects.requireNonNull(remote, "remote cannot be null");
  }
}
