package org.waabox.pronto;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;

import org.waabox.pronto.data.Category;
import org.waabox.pronto.data.Dataset;
import org.waabox.pronto.data.Pollutant;

/**
 * Name and identifier lookups over the reference data of a dataset.
 *
 * <p>Name lookups ignore case. Unknown identifiers resolve to a readable
 * placeholder so charts can still label a series.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ReferenceLookup {

  /** Pollutant names by identifier. */
  private final Map<Integer, String> pollutantNames = new HashMap<>();

  /** Pollutant identifiers by lower-cased name. */
  private final Map<String, Integer> pollutantIds = new HashMap<>();

  /** Emission units by lower-cased pollutant name. */
  private final Map<String, String> pollutantUnits = new HashMap<>();

  /** Category titles by identifier. */
  private final Map<Integer, String> categoryNames = new HashMap<>();

  /** Category identifiers by lower-cased title. */
  private final Map<String, Integer> categoryIds = new HashMap<>();

  /** The years covered by the rows. */
  private final SortedSet<Integer> years;

  private ReferenceLookup(final Dataset dataset) {
    for (final Pollutant pollutant : dataset.pollutants()) {
      pollutantNames.put(pollutant.id(), pollutant.name());
      final String key = key(pollutant.name());
      pollutantIds.put(key, pollutant.id());
      pollutant.unit().ifPresent(unit -> pollutantUnits.put(key, unit));
    }
    for (final Category category : dataset.categories()) {
      categoryNames.put(category.id(), category.title());
      categoryIds.put(key(category.title()), category.id());
    }
    years = Collections.unmodifiableSortedSet(dataset.years());
  }

  /**
   * Builds the lookups of a dataset.
   *
   * @param dataset the dataset, never null
   *
   * @return the lookups, never null
   */
  public static ReferenceLookup of(final Dataset dataset) {
    return new ReferenceLookup(Objects.requireNonNull(dataset,
        "dataset must not be null"));
  }

  /**
   * Returns the name of a pollutant.
   *
   * @param id the pollutant identifier
   *
   * @return the name, or {@code "Pollutant <id>"} when unknown
   */
  public String pollutantName(final int id) {
    return pollutantNames.getOrDefault(id, "Pollutant " + id);
  }

  /**
   * Resolves a pollutant name, ignoring case.
   *
   * @param name the pollutant name, may be null
   *
   * @return the identifier, or empty when unknown
   */
  public Optional<Integer> pollutantId(final String name) {
    return name == null ? Optional.empty()
        : Optional.ofNullable(pollutantIds.get(key(name)));
  }

  /**
   * Returns the emission unit of a pollutant.
   *
   * @param name the pollutant name, may be null
   *
   * @return the unit, or the empty string when unknown
   */
  public String pollutantUnit(final String name) {
    return name == null ? "" : pollutantUnits.getOrDefault(key(name), "");
  }

  /**
   * Returns the title of a category.
   *
   * @param id the category identifier
   *
   * @return the title, or {@code "Category <id>"} when unknown
   */
  public String categoryName(final int id) {
    return categoryNames.getOrDefault(id, "Category " + id);
  }

  /**
   * Resolves a category title, ignoring case.
   *
   * @param name the category title, may be null
   *
   * @return the identifier, or empty when unknown
   */
  public Optional<Integer> categoryId(final String name) {
    return name == null ? Optional.empty()
        : Optional.ofNullable(categoryIds.get(key(name)));
  }

  /**
   * Returns the years covered by the rows.
   *
   * @return an unmodifiable sorted set, never null
   */
  public SortedSet<Integer> years() {
    return years;
  }

  private static String key(final String name) {
    return name.trim().toLowerCase(Locale.ROOT);
  }
}
