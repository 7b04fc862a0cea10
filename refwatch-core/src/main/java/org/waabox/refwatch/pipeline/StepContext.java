package org.waabox.refwatch.pipeline;

import org.waabox.refwatch.cancel.CancellationSignal;
import org.waabox.refwatch.git.GitConfig;
import org.waabox.refwatch.notify.NotificationBus;

/**
 * Everything the host pipeline hands to a running step.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface StepContext {

  /**
   * Returns the kill switch of the step, owned by the host.
   *
   * @return the signal, never null
   */
  CancellationSignal cancellation();

  /**
   * Returns the channel to report status, details and output through.
   *
   * @return the channel, never null
   */
  ResultChannel resultChannel();

  /**
   * Returns the history of previous runs of this step.
   *
   * @return the history, never null
   */
  StepHistory history();

  /**
   * Returns the pipeline wide git settings, which steps merge their own
   * settings over.
   *
   * @return the settings, never null
   */
  GitConfig gitConfig();

  /**
   * Returns the notification bus shared by the pipeline.
   *
   * @return the bus, never null
   */
  NotificationBus notificationBus();
}
