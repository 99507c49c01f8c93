package org.waabox.pronto;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.pronto.cache.CacheStore;
import org.waabox.pronto.cache.InMemoryCacheStore;
import org.waabox.pronto.data.Dataset;
import org.waabox.pronto.hydration.HydrationListener;
import org.waabox.pronto.source.ScopedSource;
import org.waabox.pronto.source.SnapshotSource;
import org.waabox.pronto.telemetry.NoopTelemetrySink;
import org.waabox.pronto.telemetry.TelemetrySink;

/**
 * Entry point for progressive dataset loading.
 *
 * <p>Pronto holds one cache namespace per registered {@link Corpus}. A call
 * to {@link #loadData(String, DatasetQuery)} races the cheap tiers of the
 * corpus (the pre-baked snapshot and the scoped "hero" fetch) against the
 * full fetch and serves the first usable result. When the winner is partial
 * the full dataset is loaded in the background, written to the cache, and
 * the namespace listeners are told about it, once.
 *
 * <p>Every fetch is deduplicated per {@code (namespace, tier, query)} and
 * retried with a fixed backoff. Fetch failures are logged and reported to
 * the telemetry sink, throttled per namespace and tier.
 *
 * <p>Usage example:
 * <pre>{@code
 * Pronto pronto = Pronto.builder()
 *     .retryPolicy(RetryPolicy.of(3, Duration.ofMillis(500)))
 *     .build();
 *
 * pronto.register(corpus);
 * pronto.onHydrated("line", event -> chart.render(event.entry()));
 *
 * pronto.loadData("line", query)
 *     .thenAccept(entry -> entry.ifPresent(chart::render));
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Pronto {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(Pronto.class);

  /** The query key used for tiers that do not depend on the query. */
  private static final String ANY_QUERY = "*";

  /** The cache store, possibly shared with other instances. */
  private final CacheStore store;

  /** Runs every source fetch with the configured retry policy. */
  private final RetryExecutor retry;

  /** Throttles failure reports. */
  private final FailureReporter failures;

  /** The telemetry sink. */
  private final TelemetrySink telemetry;

  /** The executor running source fetches. */
  private final ExecutorService executor;

  /** Whether the executor was created by this instance. */
  private final boolean ownsExecutor;

  /** The clock used to timestamp entries. */
  private final Clock clock;

  /** Upgrades namespaces to their full dataset. */
  private final HydrationScheduler hydration;

  /** The in-flight source fetches, keyed by namespace, tier and query. */
  private final SingleFlightRegistry<String, CacheEntry> fetches =
      new SingleFlightRegistry<>();

  /** The in-flight races, keyed by namespace and query. */
  private final SingleFlightRegistry<String, Optional<CacheEntry>> races =
      new SingleFlightRegistry<>();

  /** The registered corpora, keyed by namespace. */
  private final Map<String, Corpus> corporaByNamespace =
      new ConcurrentHashMap<>();

  /** Whether this instance has been stopped. */
  private final AtomicBoolean stopped = new AtomicBoolean(false);

  private Pronto(final CacheStore store, final RetryPolicy retryPolicy,
      final FailureReporter failures, final TelemetrySink telemetry,
      final ExecutorService executor, final boolean ownsExecutor,
      final Clock clock) {
    this.store = store;
    this.retry = new RetryExecutor(retryPolicy,
        error -> !(error instanceof InvalidQueryException));
    this.failures = failures;
    this.telemetry = telemetry;
    this.executor = executor;
    this.ownsExecutor = ownsExecutor;
    this.clock = clock;
    this.hydration = new HydrationScheduler(store, telemetry, failures,
        clock);
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
   * Registers a corpus.
   *
   * @param corpus the corpus, never null
   *
   * @throws IllegalArgumentException if the namespace is already registered
   */
  public void register(final Corpus corpus) {
    Objects.requireNonNull(corpus, "corpus must not be null");
    final Corpus existing = corporaByNamespace.putIfAbsent(
        corpus.namespace(), corpus);
    if (existing != null) {
      throw new IllegalArgumentException("A corpus is already registered "
          + "for namespace '" + corpus.namespace() + "'");
    }
    log.info("Registered corpus '{}' (snapshot: {}, scoped: {})",
        corpus.namespace(), corpus.snapshot().isPresent(),
        corpus.scoped().isPresent());
  }

  /**
   * Returns the registered corpora.
   *
   * @return an unmodifiable collection, never null
   */
  public Collection<Corpus> corpora() {
    return Collections.unmodifiableCollection(corporaByNamespace.values());
  }

  /**
   * Loads data from the only registered corpus.
   *
   * @param query the query, never null
   *
   * @return the entry future, see {@link #loadData(String, DatasetQuery)}
   *
   * @throws IllegalStateException if zero or several corpora are registered
   */
  public CompletableFuture<Optional<CacheEntry>> loadData(
      final DatasetQuery query) {
    if (corporaByNamespace.size() != 1) {
      throw new IllegalStateException("loadData without a namespace needs "
          + "exactly one registered corpus, found "
          + corporaByNamespace.size());
    }
    return loadData(corporaByNamespace.keySet().iterator().next(), query);
  }

  /**
   * Loads the default selection of a corpus.
   *
   * @param namespace the namespace, never null
   *
   * @return the entry future, see {@link #loadData(String, DatasetQuery)}
   */
  public CompletableFuture<Optional<CacheEntry>> loadDefault(
      final String namespace) {
    return loadData(namespace, DatasetQuery.builder().build());
  }

  /**
   * Loads data for a query, serving the first usable tier.
   *
   * <p>When the namespace is hydrated the cached full entry is returned with
   * the {@link SourceTier#CACHE} source. Otherwise the tiers are raced; a
   * full winner hydrates the namespace, a partial winner is cached and a
   * background full load is scheduled.
   *
   * @param namespace the namespace, never null
   * @param query     the query, never null. Empty selectors are filled from
   *                  the corpus default selection.
   *
   * @return a future with the served entry, or empty if no tier produced a
   *         usable dataset. The future does not complete exceptionally for
   *         fetch failures.
   *
   * @throws CorpusNotFoundException if no corpus is registered for the
   *                                 namespace
   * @throws InvalidQueryException   if the query lacks a pollutant or a
   *                                 category selector
   * @throws IllegalStateException   if this instance is stopped
   */
  public CompletableFuture<Optional<CacheEntry>> loadData(
      final String namespace, final DatasetQuery query) {
    Objects.requireNonNull(namespace, "namespace must not be null");
    Objects.requireNonNull(query, "query must not be null");
    requireRunning();
    final Corpus corpus = requireCorpus(namespace);

    if (store.isHydrated(namespace)) {
      final Optional<CacheEntry> cached = store.get(namespace);
      if (cached.isPresent() && cached.get().isFull()) {
        log.debug("Namespace '{}': serving hydrated data from cache",
            namespace);
        return CompletableFuture.completedFuture(
            Optional.of(cached.get().servedFromCache()));
      }
    }

    final DatasetQuery normalized = corpus.normalize(query);
    return races.run(namespace + "|" + normalized.cacheKey(),
        () -> race(corpus, normalized));
  }

  /**
   * Subscribes a listener to the hydration of a namespace.
   *
   * @param namespace the namespace, never null
   * @param listener  the listener, never null
   *
   * @throws CorpusNotFoundException if no corpus is registered for the
   *                                 namespace
   */
  public void onHydrated(final String namespace,
      final HydrationListener listener) {
    requireCorpus(namespace);
    hydration.addListener(namespace, listener);
  }

  /**
   * Unsubscribes a hydration listener.
   *
   * @param namespace the namespace, never null
   * @param listener  the listener, never null
   */
  public void removeHydrationListener(final String namespace,
      final HydrationListener listener) {
    hydration.removeListener(namespace, listener);
  }

  /**
   * Whether the namespace holds its full dataset.
   *
   * @param namespace the namespace, never null
   *
   * @return true if hydrated
   */
  public boolean isHydrated(final String namespace) {
    return store.isHydrated(Objects.requireNonNull(namespace,
        "namespace must not be null"));
  }

  /**
   * Returns the load state of a namespace.
   *
   * @param namespace the namespace, never null
   *
   * @return the state, never null
   */
  public LoadState state(final String namespace) {
    Objects.requireNonNull(namespace, "namespace must not be null");
    if (store.isHydrated(namespace)) {
      return LoadState.HYDRATED;
    }
    if (hydration.isPending(namespace)) {
      return LoadState.HYDRATING;
    }
    if (store.get(namespace).isPresent()) {
      return LoadState.PARTIALLY_SERVED;
    }
    final String prefix = namespace + "|";
    if (races.anyInFlight(key -> key.startsWith(prefix))) {
      return LoadState.RACING;
    }
    return LoadState.EMPTY;
  }

  /**
   * Returns the cached entry of a namespace.
   *
   * @param namespace the namespace, never null
   *
   * @return the cached entry, or empty
   */
  public Optional<CacheEntry> current(final String namespace) {
    return store.get(Objects.requireNonNull(namespace,
        "namespace must not be null"));
  }

  /**
   * Returns the reference lookups of the cached data of a namespace.
   *
   * @param namespace the namespace, never null
   *
   * @return the lookups, empty when nothing is cached, never null
   */
  public ReferenceLookup lookup(final String namespace) {
    return ReferenceLookup.of(current(namespace)
        .map(CacheEntry::dataset)
        .orElse(Dataset.empty()));
  }

  /**
   * Loads the full dataset of a namespace in the background, unless it is
   * hydrated or a full load is already pending.
   *
   * @param namespace the namespace, never null
   * @param reason    why the load is requested, for logs, never null
   *
   * @return the full entry future; it fails with a
   *         {@link HydrationFailedException} if the load fails
   */
  public CompletableFuture<CacheEntry> hydrate(final String namespace,
      final String reason) {
    requireRunning();
    final Corpus corpus = requireCorpus(namespace);
    return hydration.schedule(namespace, reason, () -> fullCandidate(corpus));
  }

  /**
   * Drops the cached data of a namespace and the memoized results of its
   * sources. The next load starts from scratch and hydrates again.
   *
   * @param namespace the namespace, never null
   */
  public void reset(final String namespace) {
    final Corpus corpus = requireCorpus(namespace);
    store.clear(namespace);
    corpus.invalidate();
    log.info("Namespace '{}': reset", namespace);
  }

  /**
   * Stops this instance, shutting down the executor it created.
   *
   * <p>In-flight fetches are not cancelled.
   */
  public void stop() {
    if (!stopped.compareAndSet(false, true)) {
      return;
    }
    if (ownsExecutor) {
      executor.shutdown();
      try {
        if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
          log.warn("Loader threads still running after stop");
        }
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    log.info("Pronto stopped");
  }

  private CompletableFuture<Optional<CacheEntry>> race(final Corpus corpus,
      final DatasetQuery query) {
    final String namespace = corpus.namespace();
    final List<CompletableFuture<CacheEntry>> candidates = new ArrayList<>();

    final Optional<SnapshotSource> snapshot = corpus.snapshot();
    if (snapshot.isPresent() && corpus.usesDefaultSelection(query)) {
      candidates.add(candidate(namespace, SourceTier.SNAPSHOT, ANY_QUERY,
          () -> snapshot.get().fetchSnapshot().orElse(null)));
    }
    final Optional<ScopedSource> scoped = corpus.scoped();
    if (scoped.isPresent()) {
      candidates.add(candidate(namespace, SourceTier.HERO, query.cacheKey(),
          () -> scoped.get().fetchScoped(query).orElse(null)));
    }
    final CompletableFuture<CacheEntry> full = fullCandidate(corpus);
    candidates.add(full);

    log.debug("Namespace '{}': racing {} candidates for {}", namespace,
        candidates.size(), query);

    return RaceCoordinator.firstUsable(candidates,
        entry -> entry.dataset().isUsable())
        .thenApply(winner -> settle(corpus, winner, full));
  }

  /**
   * Stores the race winner.
   *
   * <p>A partial winner hands the race's own full candidate to the
   * hydration scheduler, so a full result that settles after the winner is
   * installed rather than fetched again.
   */
  private Optional<CacheEntry> settle(final Corpus corpus,
      final Optional<CacheEntry> winner,
      final CompletableFuture<CacheEntry> full) {
    final String namespace = corpus.namespace();
    if (winner.isEmpty()) {
      log.warn("Namespace '{}': no source produced a usable dataset",
          namespace);
      return Optional.empty();
    }

    final CacheEntry entry = winner.get();
    if (entry.isFull()) {
      return Optional.of(hydration.install(namespace, entry));
    }

    final boolean written = store.put(namespace, entry);
    log.debug("Namespace '{}': served partial data from the {} tier",
        namespace, entry.source().label());
    hydration.schedule(namespace, "served " + entry.source().label()
        + " data", () -> full);
    return written ? Optional.of(entry) : store.get(namespace);
  }

  private CompletableFuture<CacheEntry> fullCandidate(final Corpus corpus) {
    return candidate(corpus.namespace(), SourceTier.FULL, ANY_QUERY,
        () -> corpus.full().fetchFull());
  }

  private CompletableFuture<CacheEntry> candidate(final String namespace,
      final SourceTier tier, final String queryKey,
      final Supplier<Dataset> fetch) {
    final String key = namespace + "|" + tier.label() + "|" + queryKey;
    return fetches.run(key, () -> CompletableFuture.supplyAsync(
        () -> fetch(namespace, tier, fetch), executor));
  }

  private CacheEntry fetch(final String namespace, final SourceTier tier,
      final Supplier<Dataset> fetch) {
    final long start = System.nanoTime();
    final String operation = "Namespace '" + namespace + "' "
        + tier.label() + " fetch";

    final Dataset dataset = retry.execute(operation, fetch::get,
        (attempt, cause, willRetry) ->
            reportFailure(namespace, tier, attempt, cause, start));

    if (dataset == null) {
      log.debug("{} returned nothing", operation);
      return null;
    }

    final CacheEntry entry = CacheEntry.of(dataset, tier, clock.instant());
    final Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("namespace", namespace);
    fields.put("source", tier.label());
    fields.put("durationMs", elapsedMillis(start));
    fields.put("rows", dataset.rows().size());
    fields.put("fullDataset", entry.isFull());
    record(TelemetrySink.DATASET_LOADED, fields);
    return entry;
  }

  private void reportFailure(final String namespace, final SourceTier tier,
      final int attempt, final Throwable cause, final long start) {
    if (!failures.shouldEmit(namespace + ":" + tier.label())) {
      return;
    }
    final Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("namespace", namespace);
    fields.put("source", tier.label());
    fields.put("message", String.valueOf(cause.getMessage()));
    fields.put("attempt", attempt);
    fields.put("durationMs", elapsedMillis(start));
    record(TelemetrySink.DATASET_LOAD_ERROR, fields);
  }

  private void record(final String eventName,
      final Map<String, Object> fields) {
    try {
      telemetry.record(eventName, fields);
    } catch (final RuntimeException e) {
      log.warn("Telemetry sink failed recording {}: {}", eventName,
          e.getMessage());
    }
  }

  private Corpus requireCorpus(final String namespace) {
    Objects.requireNonNull(namespace, "namespace must not be null");
    final Corpus corpus = corporaByNamespace.get(namespace);
    if (corpus == null) {
      throw new CorpusNotFoundException(namespace);
    }
    return corpus;
  }

  private void requireRunning() {
    if (stopped.get()) {
      throw new IllegalStateException(
          "Cannot load data after stop() has been called");
    }
  }

  private static long elapsedMillis(final long start) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
  }

  /**
   * Builder for {@link Pronto} instances.
   *
   * <p>Defaults:
   * <ul>
   *   <li>cacheStore: a new {@link InMemoryCacheStore}</li>
   *   <li>retryPolicy: {@link RetryPolicy#defaultPolicy()}</li>
   *   <li>failureCooldown: {@link FailureReporter#DEFAULT_COOLDOWN}</li>
   *   <li>telemetry: {@link NoopTelemetrySink}</li>
   *   <li>executor: a cached pool of daemon threads, shut down on
   *   {@link Pronto#stop()}</li>
   *   <li>clock: the UTC system clock</li>
   * </ul>
   */
  public static final class Builder {

    /** The optional cache store. */
    private CacheStore cacheStore;

    /** The optional retry policy. */
    private RetryPolicy retryPolicy;

    /** The optional failure cooldown. */
    private Duration failureCooldown;

    /** The optional telemetry sink. */
    private TelemetrySink telemetry;

    /** The optional executor. */
    private ExecutorService executor;

    /** The optional clock. */
    private Clock clock;

    /** The corpora to register on build. */
    private final List<Corpus> corpora = new ArrayList<>();

    private Builder() {
    }

    /**
     * Sets the cache store. Several instances may share one store.
     *
     * @param theCacheStore the cache store, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder cacheStore(final CacheStore theCacheStore) {
      cacheStore = Objects.requireNonNull(theCacheStore,
          "cacheStore must not be null");
      return this;
    }

    /**
     * Sets the retry policy of source fetches.
     *
     * @param theRetryPolicy the retry policy, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder retryPolicy(final RetryPolicy theRetryPolicy) {
      retryPolicy = Objects.requireNonNull(theRetryPolicy,
          "retryPolicy must not be null");
      return this;
    }

    /**
     * Sets the minimum time between two failure reports of the same
     * namespace and tier.
     *
     * @param theCooldown the cooldown, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder failureCooldown(final Duration theCooldown) {
      failureCooldown = Objects.requireNonNull(theCooldown,
          "failureCooldown must not be null");
      return this;
    }

    /**
     * Sets the telemetry sink.
     *
     * @param theTelemetry the telemetry sink, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder telemetry(final TelemetrySink theTelemetry) {
      telemetry = Objects.requireNonNull(theTelemetry,
          "telemetry must not be null");
      return this;
    }

    /**
     * Sets the executor running source fetches. The caller keeps ownership:
     * {@link Pronto#stop()} does not shut it down.
     *
     * @param theExecutor the executor, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder executor(final ExecutorService theExecutor) {
      executor = Objects.requireNonNull(theExecutor,
          "executor must not be null");
      return this;
    }

    /**
     * Sets the clock used to timestamp entries and failure reports.
     *
     * @param theClock the clock, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder clock(final Clock theClock) {
      clock = Objects.requireNonNull(theClock, "clock must not be null");
      return this;
    }

    /**
     * Adds a corpus to register on build.
     *
     * @param theCorpus the corpus, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder corpus(final Corpus theCorpus) {
      corpora.add(Objects.requireNonNull(theCorpus,
          "corpus must not be null"));
      return this;
    }

    /**
     * Builds the instance.
     *
     * @return a new instance, never null
     */
    public Pronto build() {
      final Clock resolvedClock = clock != null ? clock : Clock.systemUTC();
      final CacheStore resolvedStore = cacheStore != null
          ? cacheStore : new InMemoryCacheStore();
      final RetryPolicy resolvedRetry = retryPolicy != null
          ? retryPolicy : RetryPolicy.defaultPolicy();
      final FailureReporter resolvedFailures = new FailureReporter(
          failureCooldown != null
              ? failureCooldown : FailureReporter.DEFAULT_COOLDOWN,
          resolvedClock);
      final TelemetrySink resolvedTelemetry = telemetry != null
          ? telemetry : NoopTelemetrySink.INSTANCE;
      final boolean ownsExecutor = executor == null;
      final ExecutorService resolvedExecutor = ownsExecutor
          ? newLoaderPool() : executor;

      final Pronto pronto = new Pronto(resolvedStore, resolvedRetry,
          resolvedFailures, resolvedTelemetry, resolvedExecutor,
          ownsExecutor, resolvedClock);
      corpora.forEach(pronto::register);
      return pronto;
    }

    private static ExecutorService newLoaderPool() {
      final AtomicInteger counter = new AtomicInteger();
      return Executors.newCachedThreadPool(r -> {
        final Thread thread = new Thread(r,
            "pronto-loader-" + counter.incrementAndGet());
        thread.setDaemon(true);
        return thread;
      });
    }
  }
}
