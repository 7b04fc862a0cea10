package org.waabox.refwatch.git;

import org.waabox.refwatch.RefWatchException;

/**
 * Thrown when a version control operation fails, e.g. because the remote
 * cannot be reached or a revision does not exist.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class GitOperationException extends RefWatchException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public GitOperationException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public GitOperationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
