package org.waabox.pronto;

/**
 * Base exception for all Pronto-related errors.
 *
 * <p>This is an unchecked exception. Subclasses tell apart failures the
 * caller can fix ({@link InvalidQueryException}) from failures worth
 * retrying ({@link TransientFetchException}).</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class ProntoException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public ProntoException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public ProntoException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
