package org.waabox.pronto;

/**
 * Thrown when a dataset query cannot be served as requested, for example
 * when it names no pollutant or no category.
 *
 * <p>This failure is never retried and never enters the race between
 * source tiers.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class InvalidQueryException extends ProntoException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception with the given message.
   *
   * @param message the detail message, never null
   */
  public InvalidQueryException(final String message) {
    super(message);
  }
}
