package org.waabox.pronto;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

import org.waabox.pronto.data.Category;
import org.waabox.pronto.data.Dataset;
import org.waabox.pronto.data.NfrCode;
import org.waabox.pronto.data.Pollutant;
import org.waabox.pronto.data.TimeseriesRow;

/**
 * A dataset together with what is known about where it came from.
 *
 * @param dataset      the data, never null
 * @param completeness whether the data is the full corpus, never null
 * @param source       the tier that produced the data, never null
 * @param fetchedAt    the instant the data was obtained, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record CacheEntry(Dataset dataset, Completeness completeness,
    SourceTier source, Instant fetchedAt) {

  /** Validates the required fields. */
  public CacheEntry {
    Objects.requireNonNull(dataset, "dataset must not be null");
    Objects.requireNonNull(completeness, "completeness must not be null");
    Objects.requireNonNull(source, "source must not be null");
    Objects.requireNonNull(fetchedAt, "fetchedAt must not be null");
  }

  /**
   * Creates an entry whose completeness follows the given tier.
   *
   * @param dataset   the data, never null
   * @param source    the producing tier, never null
   * @param fetchedAt the fetch instant, never null
   *
   * @return the entry, never null
   */
  public static CacheEntry of(final Dataset dataset, final SourceTier source,
      final Instant fetchedAt) {
    Objects.requireNonNull(source, "source must not be null");
    return new CacheEntry(dataset, source.completeness(), source, fetchedAt);
  }

  /**
   * Whether this entry holds the full dataset.
   *
   * @return true if complete
   */
  public boolean isFull() {
    return completeness == Completeness.FULL;
  }

  /**
   * Returns a copy of this entry marked as served from the cache.
   *
   * @return the copy, never null
   */
  public CacheEntry servedFromCache() {
    return new CacheEntry(dataset, completeness, SourceTier.CACHE, fetchedAt);
  }

  /**
   * Returns the pollutants of the dataset.
   *
   * @return the pollutants, never null
   */
  public List<Pollutant> pollutants() {
    return dataset.pollutants();
  }

  /**
   * Returns the categories of the dataset.
   *
   * @return the categories, never null
   */
  public List<Category> categories() {
    return dataset.categories();
  }

  /**
   * Returns the time-series rows of the dataset.
   *
   * @return the rows, never null
   */
  public List<TimeseriesRow> rows() {
    return dataset.rows();
  }

  /**
   * Returns the NFR code descriptions of the dataset.
   *
   * @return the NFR codes, never null
   */
  public List<NfrCode> nfrCodes() {
    return dataset.nfrCodes();
  }
}
