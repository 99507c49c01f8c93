package org.waabox.pronto;

/**
 * Thrown when a source adapter fails for a reason that may go away on its
 * own: a network error, a timeout or an error status from the remote data
 * service.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class TransientFetchException extends ProntoException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception with the given message.
   *
   * @param message the detail message, never null
   */
  public TransientFetchException(final String message) {
    super(message);
  }

  /**
   * Creates a new exception with the given message and cause.
   *
   * @param message the detail message, never null
   * @param cause   the underlying cause, never null
   */
  public TransientFetchException(final String message,
      final Throwable cause) {
    super(message, cause);
  }
}
