package org.waabox.pronto;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.pronto.cache.CacheStore;
import org.waabox.pronto.hydration.HydrationEvent;
import org.waabox.pronto.hydration.HydrationListener;
import org.waabox.pronto.telemetry.TelemetrySink;

/**
 * Upgrades namespaces to their full dataset, once.
 *
 * <p>At most one background full load runs per namespace. When a load
 * succeeds its entry is written to the cache store and, if this is the
 * first time the namespace becomes hydrated, a {@link HydrationEvent} is
 * delivered to the namespace listeners. A failed load is logged and
 * reported; it leaves the partial data in place and a later call may try
 * again.
 *
 * <p>Listeners registered after a namespace was hydrated are not called for
 * that hydration; they are called for the next one, after a reset.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class HydrationScheduler {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      HydrationScheduler.class);

  /** The cache store the full entries are written to, never null. */
  private final CacheStore store;

  /** The telemetry sink, never null. */
  private final TelemetrySink telemetry;

  /** Throttles failure reports, never null. */
  private final FailureReporter failures;

  /** The clock used to timestamp hydrations, never null. */
  private final Clock clock;

  /** The pending full loads, keyed by namespace. */
  private final SingleFlightRegistry<String, CacheEntry> pending =
      new SingleFlightRegistry<>();

  /** Failed or running full loads since the last hydration, by namespace. */
  private final Map<String, AtomicInteger> attempts =
      new ConcurrentHashMap<>();

  /** The listeners, keyed by namespace. */
  private final Map<String, List<HydrationListener>> listeners =
      new ConcurrentHashMap<>();

  /**
   * Creates a new scheduler.
   *
   * @param store     the cache store, never null
   * @param telemetry the telemetry sink, never null
   * @param failures  the failure reporter, never null
   * @param clock     the clock, never null
   */
  public HydrationScheduler(final CacheStore store,
      final TelemetrySink telemetry, final FailureReporter failures,
      final Clock clock) {
    this.store = Objects.requireNonNull(store, "store must not be null");
    this.telemetry = Objects.requireNonNull(telemetry,
        "telemetry must not be null");
    this.failures = Objects.requireNonNull(failures,
        "failures must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  /**
   * Schedules the full load of a namespace, unless one is pending or the
   * namespace is already hydrated.
   *
   * <p>The returned future fails with a {@link HydrationFailedException}
   * when the load fails. Callers that already served partial data may
   * ignore it.
   *
   * @param namespace the namespace, never null
   * @param reason    why the load is requested, for logs, never null
   * @param fullLoad  starts the full load, never null
   *
   * @return the full entry future, never null
   */
  public CompletableFuture<CacheEntry> schedule(final String namespace,
      final String reason,
      final Supplier<CompletableFuture<CacheEntry>> fullLoad) {
    Objects.requireNonNull(namespace, "namespace must not be null");
    Objects.requireNonNull(reason, "reason must not be null");
    Objects.requireNonNull(fullLoad, "fullLoad must not be null");

    if (store.isHydrated(namespace)) {
      final Optional<CacheEntry> cached = store.get(namespace);
      if (cached.isPresent() && cached.get().isFull()) {
        return CompletableFuture.completedFuture(cached.get());
      }
    }

    return pending.run(namespace, () -> {
      final long start = System.nanoTime();
      final int attempt = attempts.computeIfAbsent(namespace,
          key -> new AtomicInteger()).incrementAndGet();
      log.info("Namespace '{}': loading full dataset in the background ({}),"
          + " attempt {}", namespace, reason, attempt);
      return fullLoad.get().handle((entry, error) -> {
        if (error == null && entry == null) {
          return fail(namespace, new TransientFetchException(
              "Full load produced no dataset"), attempt, start);
        }
        if (error != null) {
          return fail(namespace, unwrap(error), attempt, start);
        }
        return install(namespace, entry);
      });
    });
  }

  /**
   * Writes a full entry and marks the namespace hydrated, notifying the
   * listeners if the namespace was not hydrated before.
   *
   * @param namespace the namespace, never null
   * @param entry     the full entry, never null
   *
   * @return the entry, never null
   */
  public CacheEntry install(final String namespace, final CacheEntry entry) {
    Objects.requireNonNull(namespace, "namespace must not be null");
    Objects.requireNonNull(entry, "entry must not be null");
    if (!entry.isFull()) {
      throw new IllegalArgumentException(
          "Only full entries hydrate a namespace, got: " + entry.source());
    }

    store.put(namespace, entry);
    attempts.remove(namespace);
    if (store.markHydrated(namespace)) {
      log.info("Namespace '{}': hydrated with {} rows from the {} tier",
          namespace, entry.rows().size(), entry.source().label());
      final Map<String, Object> fields = new LinkedHashMap<>();
      fields.put("namespace", namespace);
      fields.put("source", entry.source().label());
      fields.put("rows", entry.rows().size());
      record(TelemetrySink.DATASET_HYDRATED, fields);
      notifyListeners(new HydrationEvent(namespace, entry.source(), entry,
          clock.instant()));
    }
    return entry;
  }

  /**
   * Whether a background full load of the namespace is running.
   *
   * @param namespace the namespace, never null
   *
   * @return true if pending
   */
  public boolean isPending(final String namespace) {
    return pending.isInFlight(namespace);
  }

  /**
   * Subscribes a listener to the hydration of a namespace.
   *
   * @param namespace the namespace, never null
   * @param listener  the listener, never null
   */
  public void addListener(final String namespace,
      final HydrationListener listener) {
    Objects.requireNonNull(namespace, "namespace must not be null");
    Objects.requireNonNull(listener, "listener must not be null");
    listeners.computeIfAbsent(namespace, key -> new CopyOnWriteArrayList<>())
        .add(listener);
  }

  /**
   * Unsubscribes a listener.
   *
   * @param namespace the namespace, never null
   * @param listener  the listener, never null
   */
  public void removeListener(final String namespace,
      final HydrationListener listener) {
    Objects.requireNonNull(namespace, "namespace must not be null");
    final List<HydrationListener> registered = listeners.get(namespace);
    if (registered != null) {
      registered.remove(listener);
    }
  }

  private CacheEntry fail(final String namespace, final Throwable cause,
      final int attempt, final long start) {
    log.warn("Namespace '{}': background full load failed, keeping partial "
        + "data: {}", namespace, cause.getMessage());
    if (failures.shouldEmit(namespace + ":hydration")) {
      final Map<String, Object> fields = new LinkedHashMap<>();
      fields.put("namespace", namespace);
      fields.put("source", SourceTier.FULL.label());
      fields.put("message", String.valueOf(cause.getMessage()));
      fields.put("attempt", attempt);
      fields.put("durationMs",
          TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
      record(TelemetrySink.DATASET_LOAD_ERROR, fields);
    }
    throw new CompletionException(
        new HydrationFailedException(namespace, cause));
  }

  private void notifyListeners(final HydrationEvent event) {
    final List<HydrationListener> registered = listeners.get(
        event.namespace());
    if (registered == null) {
      return;
    }
    for (final HydrationListener listener : registered) {
      try {
        listener.onHydrated(event);
      } catch (final RuntimeException e) {
        log.error("Namespace '{}': hydration listener failed",
            event.namespace(), e);
      }
    }
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

  private static Throwable unwrap(final Throwable error) {
    if (error instanceof CompletionException && error.getCause() != null) {
      return error.getCause();
    }
    return error;
  }
}
