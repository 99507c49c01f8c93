package org.waabox.pronto.source;

import org.waabox.pronto.data.Dataset;

/**
 * Fetches the authoritative, complete dataset of a corpus.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface FullSource {

  /**
   * Fetches every pollutant, category and row.
   *
   * @return the full dataset, never null
   *
   * @throws org.waabox.pronto.TransientFetchException on a retryable failure
   */
  Dataset fetchFull();
}
