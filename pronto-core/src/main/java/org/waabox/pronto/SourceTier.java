package org.waabox.pronto;

import java.util.Locale;

/**
 * The tier a dataset was obtained from.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum SourceTier {

  /** The pre-baked, possibly stale snapshot. */
  SNAPSHOT(Completeness.PARTIAL),

  /** The scoped fetch of exactly the rows a query needs. */
  HERO(Completeness.PARTIAL),

  /** The complete authoritative fetch. */
  FULL(Completeness.FULL),

  /** Served from the cache store of an already hydrated namespace. */
  CACHE(Completeness.FULL);

  /** The completeness of data produced by this tier. */
  private final Completeness completeness;

  SourceTier(final Completeness theCompleteness) {
    completeness = theCompleteness;
  }

  /**
   * Returns the completeness of the data this tier produces.
   *
   * @return the completeness, never null
   */
  public Completeness completeness() {
    return completeness;
  }

  /**
   * Returns the lower-case label used in logs and telemetry.
   *
   * @return the label, never null
   */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
