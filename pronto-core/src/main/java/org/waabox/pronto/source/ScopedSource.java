package org.waabox.pronto.source;

import java.util.Optional;

import org.waabox.pronto.DatasetQuery;
import org.waabox.pronto.data.Dataset;

/**
 * Fetches only the rows a query needs.
 *
 * <p>The result is partial: it carries the reference data the source knows
 * about but only the matching rows.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface ScopedSource {

  /**
   * Fetches the data for a query.
   *
   * @param query the normalized, valid query, never null
   *
   * @return the scoped dataset, or empty if the source has nothing
   *
   * @throws org.waabox.pronto.InvalidQueryException if the query selects
   *         nothing the source knows about
   * @throws org.waabox.pronto.TransientFetchException on a retryable failure
   */
  Optional<Dataset> fetchScoped(DatasetQuery query);

  /**
   * Drops any memoized scoped results so the next fetch reaches the
   * backing service.
   */
  default void invalidate() {
  }
}
