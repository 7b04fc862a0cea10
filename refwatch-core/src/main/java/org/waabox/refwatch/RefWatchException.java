package org.waabox.refwatch;

/**
 * Base exception for infrastructure failures of the ref watcher.
 *
 * <p>This is an unchecked exception intended to wrap failures that cannot
 * be meaningfully recovered from at the call site.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class RefWatchException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public RefWatchException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public RefWatchException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
