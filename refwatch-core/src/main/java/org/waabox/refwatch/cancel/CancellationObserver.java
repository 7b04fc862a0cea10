package org.waabox.refwatch.cancel;

/**
 * Observes the value changes of a {@link CancellationSignal}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface CancellationObserver {

  /**
   * Called after the value of the signal changed.
   *
   * @param oldValue the value before the change
   * @param newValue the value after the change
   */
  void onChange(boolean oldValue, boolean newValue);
}
