package org.waabox.pronto.data;

import java.util.Collections;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * One time-series row: the yearly values of a pollutant for a category.
 *
 * <p>Years without a reported value are kept with a null value so that the
 * set of year columns is preserved.
 *
 * @param id          the row identifier
 * @param pollutantId the pollutant this row belongs to
 * @param categoryId  the category this row belongs to
 * @param values      the values keyed by year, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record TimeseriesRow(long id, int pollutantId, int categoryId,
    SortedMap<Integer, Double> values) {

  /** Copies the values into an unmodifiable sorted map. */
  public TimeseriesRow {
    Objects.requireNonNull(values, "values must not be null");
    values = Collections.unmodifiableSortedMap(new TreeMap<>(values));
  }

  /**
   * Returns the value for the given year.
   *
   * @param year the year
   *
   * @return the value, or null if the year is absent or has no value
   */
  public Double valueAt(final int year) {
    return values.get(year);
  }
}
