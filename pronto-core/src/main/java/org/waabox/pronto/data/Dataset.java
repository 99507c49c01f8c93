package org.waabox.pronto.data;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * An immutable set of reference and time-series data: pollutants,
 * categories, rows and the NFR code descriptions.
 *
 * <p>The same type is produced by every source tier. Whether a dataset is
 * complete is not a property of the data itself but of the tier that
 * produced it, see {@link org.waabox.pronto.CacheEntry}.
 *
 * @param pollutants the pollutant records, never null
 * @param categories the category records, never null
 * @param rows       the time-series rows, never null
 * @param nfrCodes   the NFR code descriptions, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Dataset(List<Pollutant> pollutants, List<Category> categories,
    List<TimeseriesRow> rows, List<NfrCode> nfrCodes) {

  /** The empty dataset. */
  private static final Dataset EMPTY = new Dataset(List.of(), List.of(),
      List.of(), List.of());

  /** Copies the lists into unmodifiable lists. */
  public Dataset {
    pollutants = List.copyOf(Objects.requireNonNull(pollutants,
        "pollutants must not be null"));
    categories = List.copyOf(Objects.requireNonNull(categories,
        "categories must not be null"));
    rows = List.copyOf(Objects.requireNonNull(rows, "rows must not be null"));
    nfrCodes = List.copyOf(Objects.requireNonNull(nfrCodes,
        "nfrCodes must not be null"));
  }

  /**
   * Creates a dataset without NFR codes.
   *
   * @param pollutants the pollutant records, never null
   * @param categories the category records, never null
   * @param rows       the time-series rows, never null
   */
  public Dataset(final List<Pollutant> pollutants,
      final List<Category> categories, final List<TimeseriesRow> rows) {
    this(pollutants, categories, rows, List.of());
  }

  /**
   * Returns the empty dataset.
   *
   * @return the empty dataset, never null
   */
  public static Dataset empty() {
    return EMPTY;
  }

  /**
   * Whether this dataset can be rendered.
   *
   * <p>A dataset is usable when it carries at least one pollutant or at
   * least one row.
   *
   * @return true if usable
   */
  public boolean isUsable() {
    return !pollutants.isEmpty() || !rows.isEmpty();
  }

  /**
   * Returns the sorted union of the years found in the rows.
   *
   * @return the years, never null
   */
  public SortedSet<Integer> years() {
    final SortedSet<Integer> years = new TreeSet<>();
    for (final TimeseriesRow row : rows) {
      years.addAll(row.values().keySet());
    }
    return years;
  }

  /**
   * Returns a dataset with the same reference data and only the rows
   * matching the given pollutant and category identifiers.
   *
   * @param pollutantIds the pollutant identifiers to keep, never null
   * @param categoryIds  the category identifiers to keep, never null
   *
   * @return the restricted dataset, never null
   */
  public Dataset restrictTo(final Collection<Integer> pollutantIds,
      final Collection<Integer> categoryIds) {
    Objects.requireNonNull(pollutantIds, "pollutantIds must not be null");
    Objects.requireNonNull(categoryIds, "categoryIds must not be null");
    final Set<Integer> pollutantSet = Set.copyOf(pollutantIds);
    final Set<Integer> categorySet = Set.copyOf(categoryIds);
    final List<TimeseriesRow> kept = rows.stream()
        .filter(row -> pollutantSet.contains(row.pollutantId()))
        .filter(row -> categorySet.contains(row.categoryId()))
        .collect(Collectors.toList());
    return new Dataset(pollutants, categories, kept, nfrCodes);
  }
}
