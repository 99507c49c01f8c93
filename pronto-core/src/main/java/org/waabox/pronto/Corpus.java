package org.waabox.pronto;

import java.util.Objects;
import java.util.Optional;

import org.waabox.pronto.source.FullSource;
import org.waabox.pronto.source.RemoteDataService;
import org.waabox.pronto.source.ScopedSource;
import org.waabox.pronto.source.SnapshotSource;

/**
 * A named dataset and the sources able to serve it.
 *
 * <p>Each corpus owns one cache namespace. The full source is mandatory;
 * the snapshot and scoped sources are optional cheaper tiers. The default
 * selection fills the empty selectors of incoming queries, and a query that
 * equals the default selection may be served from the snapshot.
 *
 * <p>Usage example:
 * <pre>{@code
 * Corpus corpus = Corpus.named("line")
 *     .service(remoteDataService)
 *     .defaultSelection(DatasetQuery.builder()
 *         .pollutantNames("PM2.5")
 *         .categoryNames("All")
 *         .build())
 *     .build();
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Corpus {

  /** The namespace, never null. */
  private final String namespace;

  /** The snapshot source, may be null. */
  private final SnapshotSource snapshot;

  /** The scoped source, may be null. */
  private final ScopedSource scoped;

  /** The full source, never null. */
  private final FullSource full;

  /** The default selection, may be null. */
  private final DatasetQuery defaultSelection;

  private Corpus(final Builder builder) {
    this.namespace = builder.namespace;
    this.snapshot = builder.snapshot;
    this.scoped = builder.scoped;
    this.full = builder.full;
    this.defaultSelection = builder.defaultSelection;
  }

  /**
   * Starts building a corpus.
   *
   * @param namespace the namespace, never null nor blank
   *
   * @return a new builder, never null
   */
  public static Builder named(final String namespace) {
    return new Builder(namespace);
  }

  /**
   * Returns the namespace.
   *
   * @return the namespace, never null
   */
  public String namespace() {
    return namespace;
  }

  /**
   * Returns the snapshot source.
   *
   * @return the snapshot source, or empty
   */
  public Optional<SnapshotSource> snapshot() {
    return Optional.ofNullable(snapshot);
  }

  /**
   * Returns the scoped source.
   *
   * @return the scoped source, or empty
   */
  public Optional<ScopedSource> scoped() {
    return Optional.ofNullable(scoped);
  }

  /**
   * Returns the full source.
   *
   * @return the full source, never null
   */
  public FullSource full() {
    return full;
  }

  /**
   * Returns the default selection.
   *
   * @return the default selection, or empty
   */
  public Optional<DatasetQuery> defaultSelection() {
    return Optional.ofNullable(defaultSelection);
  }

  /**
   * Fills the query from the default selection and validates it.
   *
   * @param query the incoming query, never null
   *
   * @return the normalized query, never null
   *
   * @throws InvalidQueryException if the result lacks a pollutant or a
   *                               category selector
   */
  public DatasetQuery normalize(final DatasetQuery query) {
    Objects.requireNonNull(query, "query must not be null");
    return query.withDefaults(defaultSelection).requireValid();
  }

  /**
   * Whether the normalized query asks for exactly the default selection.
   *
   * @param query the normalized query, never null
   *
   * @return true if the pre-baked snapshot can answer it
   */
  public boolean usesDefaultSelection(final DatasetQuery query) {
    Objects.requireNonNull(query, "query must not be null");
    return defaultSelection != null && defaultSelection.equals(query);
  }

  /** Drops memoized results of the snapshot and scoped sources. */
  void invalidate() {
    if (snapshot != null) {
      snapshot.invalidate();
    }
    if (scoped != null && scoped != snapshot) {
      scoped.invalidate();
    }
  }

  /** Builder for {@link Corpus}. */
  public static final class Builder {

    /** The namespace. */
    private final String namespace;

    /** The optional snapshot source. */
    private SnapshotSource snapshot;

    /** The optional scoped source. */
    private ScopedSource scoped;

    /** The full source. */
    private FullSource full;

    /** The optional default selection. */
    private DatasetQuery defaultSelection;

    private Builder(final String theNamespace) {
      Objects.requireNonNull(theNamespace, "namespace must not be null");
      if (theNamespace.isBlank()) {
        throw new IllegalArgumentException("namespace must not be blank");
      }
      namespace = theNamespace;
    }

    /**
     * Sets the snapshot source.
     *
     * @param theSnapshot the snapshot source, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder snapshot(final SnapshotSource theSnapshot) {
      snapshot = Objects.requireNonNull(theSnapshot,
          "snapshot must not be null");
      return this;
    }

    /**
     * Sets the scoped source.
     *
     * @param theScoped the scoped source, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder scoped(final ScopedSource theScoped) {
      scoped = Objects.requireNonNull(theScoped, "scoped must not be null");
      return this;
    }

    /**
     * Sets the full source.
     *
     * @param theFull the full source, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder full(final FullSource theFull) {
      full = Objects.requireNonNull(theFull, "full must not be null");
      return this;
    }

    /**
     * Uses one service for every tier.
     *
     * @param theService the service, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder service(final RemoteDataService theService) {
      Objects.requireNonNull(theService, "service must not be null");
      snapshot = theService;
      scoped = theService;
      full = theService;
      return this;
    }

    /**
     * Sets the default selection.
     *
     * @param theSelection the default selection, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws InvalidQueryException if the selection is not valid on its own
     */
    public Builder defaultSelection(final DatasetQuery theSelection) {
      Objects.requireNonNull(theSelection, "defaultSelection must not be null");
      defaultSelection = theSelection.requireValid();
      return this;
    }

    /**
     * Builds the corpus.
     *
     * @return the corpus, never null
     *
     * @throws IllegalStateException if no full source was set
     */
    public Corpus build() {
      if (full == null) {
        throw new IllegalStateException(
            "Corpus '" + namespace + "' requires a full source");
      }
      return new Corpus(this);
    }
  }
}
