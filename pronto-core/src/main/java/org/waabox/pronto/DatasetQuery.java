package org.waabox.pronto;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * A normalized description of the data a consumer needs.
 *
 * <p>Normalization happens once, when the query is built: identifiers are
 * deduplicated and sorted, names are trimmed, blank names are dropped and
 * names are deduplicated ignoring case. When activity data is requested the
 * activity pollutant name is added to the pollutant names.
 *
 * <p>Two queries are equivalent iff their {@link #cacheKey()} are equal, and
 * {@link #equals(Object)} follows that rule.
 *
 * <p>A query built without selectors is not rejected by the builder: empty
 * selectors may still be filled from a corpus default selection through
 * {@link #withDefaults(DatasetQuery)}. Call {@link #requireValid()} before
 * serving it.
 *
 * <p>Usage example:
 * <pre>{@code
 * DatasetQuery query = DatasetQuery.builder()
 *     .pollutantNames("PM2.5")
 *     .categoryNames("All")
 *     .build();
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DatasetQuery {

  /** The pollutant name under which activity data rows are published. */
  public static final String DEFAULT_ACTIVITY_POLLUTANT = "Activity Data";

  /** The selected pollutant identifiers, never null. */
  private final SortedSet<Integer> pollutantIds;

  /** The selected pollutant names, never null. */
  private final SortedSet<String> pollutantNames;

  /** The selected category identifiers, never null. */
  private final SortedSet<Integer> categoryIds;

  /** The selected category names, never null. */
  private final SortedSet<String> categoryNames;

  /** Whether the activity dimension is requested. */
  private final boolean includeActivity;

  /** The canonical cache key, computed once. */
  private final String cacheKey;

  /**
   * Creates a new query from already normalized sets.
   *
   * @param pollutantIds    the pollutant identifiers, never null
   * @param pollutantNames  the pollutant names, never null
   * @param categoryIds     the category identifiers, never null
   * @param categoryNames   the category names, never null
   * @param includeActivity whether activity data is requested
   */
  private DatasetQuery(final SortedSet<Integer> pollutantIds,
      final SortedSet<String> pollutantNames,
      final SortedSet<Integer> categoryIds,
      final SortedSet<String> categoryNames,
      final boolean includeActivity) {
    this.pollutantIds = Collections.unmodifiableSortedSet(pollutantIds);
    this.pollutantNames = Collections.unmodifiableSortedSet(pollutantNames);
    this.categoryIds = Collections.unmodifiableSortedSet(categoryIds);
    this.categoryNames = Collections.unmodifiableSortedSet(categoryNames);
    this.includeActivity = includeActivity;
    this.cacheKey = buildKey();
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the selected pollutant identifiers.
   *
   * @return an unmodifiable sorted set, never null
   */
  public SortedSet<Integer> pollutantIds() {
    return pollutantIds;
  }

  /**
   * Returns the selected pollutant names, including the activity pollutant
   * when activity data was requested.
   *
   * @return an unmodifiable sorted set, never null
   */
  public SortedSet<String> pollutantNames() {
    return pollutantNames;
  }

  /**
   * Returns the selected category identifiers.
   *
   * @return an unmodifiable sorted set, never null
   */
  public SortedSet<Integer> categoryIds() {
    return categoryIds;
  }

  /**
   * Returns the selected category names.
   *
   * @return an unmodifiable sorted set, never null
   */
  public SortedSet<String> categoryNames() {
    return categoryNames;
  }

  /**
   * Whether the activity dimension was requested.
   *
   * @return true if activity data is included
   */
  public boolean includeActivity() {
    return includeActivity;
  }

  /**
   * Whether this query selects at least one pollutant.
   *
   * @return true if a pollutant selector is present
   */
  public boolean hasPollutantSelector() {
    return !pollutantIds.isEmpty() || !pollutantNames.isEmpty();
  }

  /**
   * Whether this query selects at least one category.
   *
   * @return true if a category selector is present
   */
  public boolean hasCategorySelector() {
    return !categoryIds.isEmpty() || !categoryNames.isEmpty();
  }

  /**
   * Whether this query can be served.
   *
   * @return true if both a pollutant and a category selector are present
   */
  public boolean isValid() {
    return hasPollutantSelector() && hasCategorySelector();
  }

  /**
   * Returns this query if valid.
   *
   * @return this query, never null
   *
   * @throws InvalidQueryException if a pollutant or category selector is
   *                               missing
   */
  public DatasetQuery requireValid() {
    if (!hasPollutantSelector()) {
      throw new InvalidQueryException(
          "Dataset query requires at least one pollutant identifier");
    }
    if (!hasCategorySelector()) {
      throw new InvalidQueryException(
          "Dataset query requires at least one category identifier");
    }
    return this;
  }

  /**
   * Fills the empty selectors of this query from the given defaults.
   *
   * <p>Selectors are filled per dimension: a query naming pollutants but no
   * categories keeps its pollutants and takes the default categories.
   *
   * @param defaults the default selection, may be null
   *
   * @return the resulting query, never null
   */
  public DatasetQuery withDefaults(final DatasetQuery defaults) {
    if (defaults == null || isValid()) {
      return this;
    }
    final boolean takePollutants = !hasPollutantSelector();
    final boolean takeCategories = !hasCategorySelector();
    return new DatasetQuery(
        new TreeSet<>(takePollutants ? defaults.pollutantIds : pollutantIds),
        copyNames(takePollutants ? defaults.pollutantNames : pollutantNames),
        new TreeSet<>(takeCategories ? defaults.categoryIds : categoryIds),
        copyNames(takeCategories ? defaults.categoryNames : categoryNames),
        takePollutants ? defaults.includeActivity : includeActivity);
  }

  /**
   * Returns the canonical key of this query.
   *
   * <p>The key is built from the sorted identifiers and the lower-cased,
   * sorted names.
   *
   * @return the cache key, never null
   */
  public String cacheKey() {
    return cacheKey;
  }

  /** {@inheritDoc} */
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DatasetQuery that)) {
      return false;
    }
    return cacheKey.equals(that.cacheKey);
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return cacheKey.hashCode();
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return "DatasetQuery" + cacheKey;
  }

  private String buildKey() {
    return "{pollutantIds=" + pollutantIds
        + ",pollutantNames=" + lowerCase(pollutantNames)
        + ",categoryIds=" + categoryIds
        + ",categoryNames=" + lowerCase(categoryNames)
        + ",activity=" + includeActivity + "}";
  }

  private static String lowerCase(final SortedSet<String> names) {
    return names.stream()
        .map(name -> name.toLowerCase(Locale.ROOT))
        .collect(Collectors.joining(",", "[", "]"));
  }

  private static SortedSet<String> copyNames(final Collection<String> names) {
    final SortedSet<String> copy = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
    copy.addAll(names);
    return copy;
  }

  /**
   * A builder for {@link DatasetQuery} instances.
   *
   * <p>Null identifiers and null or blank names are ignored.
   */
  public static final class Builder {

    /** The collected pollutant identifiers. */
    private final SortedSet<Integer> pollutantIds = new TreeSet<>();

    /** The collected pollutant names, deduplicated ignoring case. */
    private final SortedSet<String> pollutantNames =
        new TreeSet<>(String.CASE_INSENSITIVE_ORDER);

    /** The collected category identifiers. */
    private final SortedSet<Integer> categoryIds = new TreeSet<>();

    /** The collected category names, deduplicated ignoring case. */
    private final SortedSet<String> categoryNames =
        new TreeSet<>(String.CASE_INSENSITIVE_ORDER);

    /** Whether activity data is requested. */
    private boolean includeActivity;

    /** The pollutant name used for activity data. */
    private String activityPollutant = DEFAULT_ACTIVITY_POLLUTANT;

    /** Creates a new, empty builder. */
    private Builder() {
    }

    /**
     * Adds pollutant identifiers.
     *
     * @param ids the identifiers, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder pollutantIds(final Integer... ids) {
      return pollutantIds(Arrays.asList(ids));
    }

    /**
     * Adds pollutant identifiers.
     *
     * @param ids the identifiers, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder pollutantIds(final Collection<Integer> ids) {
      addIds(pollutantIds, ids);
      return this;
    }

    /**
     * Adds pollutant names.
     *
     * @param names the names, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder pollutantNames(final String... names) {
      return pollutantNames(Arrays.asList(names));
    }

    /**
     * Adds pollutant names.
     *
     * @param names the names, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder pollutantNames(final Collection<String> names) {
      addNames(pollutantNames, names);
      return this;
    }

    /**
     * Adds category identifiers.
     *
     * @param ids the identifiers, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder categoryIds(final Integer... ids) {
      return categoryIds(Arrays.asList(ids));
    }

    /**
     * Adds category identifiers.
     *
     * @param ids the identifiers, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder categoryIds(final Collection<Integer> ids) {
      addIds(categoryIds, ids);
      return this;
    }

    /**
     * Adds category names.
     *
     * @param names the names, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder categoryNames(final String... names) {
      return categoryNames(Arrays.asList(names));
    }

    /**
     * Adds category names.
     *
     * @param names the names, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder categoryNames(final Collection<String> names) {
      addNames(categoryNames, names);
      return this;
    }

    /**
     * Requests the synthetic activity dimension.
     *
     * @param include whether activity data is included
     *
     * @return this builder for chaining, never null
     */
    public Builder includeActivity(final boolean include) {
      this.includeActivity = include;
      return this;
    }

    /**
     * Overrides the pollutant name used for activity data.
     *
     * @param name the activity pollutant name, never blank
     *
     * @return this builder for chaining, never null
     */
    public Builder activityPollutant(final String name) {
      Objects.requireNonNull(name, "name must not be null");
      if (name.isBlank()) {
        throw new IllegalArgumentException(
            "activity pollutant must not be blank");
      }
      this.activityPollutant = name.trim();
      return this;
    }

    /**
     * Builds the normalized query.
     *
     * @return the query, never null
     */
    public DatasetQuery build() {
      final SortedSet<String> names = copyNames(pollutantNames);
      if (includeActivity) {
        names.add(activityPollutant);
      }
      return new DatasetQuery(new TreeSet<>(pollutantIds), names,
          new TreeSet<>(categoryIds), copyNames(categoryNames),
          includeActivity);
    }

    private static void addIds(final SortedSet<Integer> target,
        final Collection<Integer> ids) {
      Objects.requireNonNull(ids, "ids must not be null");
      for (final Integer id : ids) {
        if (id != null) {
          target.add(id);
        }
      }
    }

    private static void addNames(final SortedSet<String> target,
        final Collection<String> names) {
      Objects.requireNonNull(names, "names must not be null");
      for (final String name : names) {
        if (name != null && !name.isBlank()) {
          target.add(name.trim());
        }
      }
    }
  }
}
