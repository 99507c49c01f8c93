package org.waabox.pronto;

/**
 * Signals that the background upgrade of a namespace to the full dataset
 * failed after partial data was already served.
 *
 * <p>This exception is only logged and handed to telemetry. It never reaches
 * the caller that received the partial data.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class HydrationFailedException extends ProntoException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception for the given namespace.
   *
   * @param namespace the namespace that failed to hydrate, never null
   * @param cause     the underlying cause, never null
   */
  public HydrationFailedException(final String namespace,
      final Throwable cause) {
    super("Hydration failed for namespace: " + namespace, cause);
  }
}
