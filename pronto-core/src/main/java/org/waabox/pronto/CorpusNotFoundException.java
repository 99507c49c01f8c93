package org.waabox.pronto;

/**
 * Thrown when an operation names a namespace with no registered corpus.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class CorpusNotFoundException extends ProntoException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception for the given namespace.
   *
   * @param namespace the unknown namespace, never null
   */
  public CorpusNotFoundException(final String namespace) {
    super("No corpus registered for namespace '" + namespace + "'");
  }
}
