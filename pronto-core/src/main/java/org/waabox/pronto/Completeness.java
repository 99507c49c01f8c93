package org.waabox.pronto;

/**
 * Whether a cached dataset is the complete authoritative corpus.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum Completeness {

  /** A subset or a possibly stale copy: snapshot or hero data. */
  PARTIAL,

  /** The complete authoritative dataset. */
  FULL
}
