package org.waabox.pronto;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Deduplicates concurrent asynchronous work per key.
 *
 * <p>While a task for a key is in flight, every caller of
 * {@link #run(Object, Supplier)} for that key receives the same future. The
 * task is removed from the registry the moment it settles, before its
 * future completes, so a call issued after settlement always starts fresh.
 * Failures are never cached: the next caller after a failed attempt gets a
 * new attempt.
 *
 * <p>This class is thread-safe.
 *
 * @param <K> the key type
 * @param <V> the result type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SingleFlightRegistry<K, V> {

  /** The in-flight tasks, keyed by their logical resource. */
  private final Map<K, CompletableFuture<V>> inFlight =
      new ConcurrentHashMap<>();

  /**
   * Returns the in-flight future for the key, or starts a new task.
   *
   * <p>The producer is invoked at most once per call and only when no task
   * is registered for the key. If the producer throws, the returned future
   * fails with that exception and nothing stays registered.
   *
   * @param key      the resource key, never null
   * @param producer starts the work and returns its future, never null
   *
   * @return the shared future, never null
   */
  public CompletableFuture<V> run(final K key,
      final Supplier<CompletableFuture<V>> producer) {
    Objects.requireNonNull(key, "key must not be null");
    Objects.requireNonNull(producer, "producer must not be null");

    final CompletableFuture<V> shared = new CompletableFuture<>();
    final CompletableFuture<V> existing = inFlight.putIfAbsent(key, shared);
    if (existing != null) {
      return existing;
    }

    final CompletableFuture<V> task;
    try {
      task = Objects.requireNonNull(producer.get(),
          "producer returned a null future");
    } catch (final RuntimeException e) {
      inFlight.remove(key, shared);
      shared.completeExceptionally(e);
      return shared;
    }

    task.whenComplete((value, error) -> {
      inFlight.remove(key, shared);
      if (error != null) {
        shared.completeExceptionally(error);
      } else {
        shared.complete(value);
      }
    });
    return shared;
  }

  /**
   * Whether a task for the key is in flight.
   *
   * @param key the resource key, never null
   *
   * @return true if in flight
   */
  public boolean isInFlight(final K key) {
    return inFlight.containsKey(Objects.requireNonNull(key,
        "key must not be null"));
  }

  /**
   * Whether any in-flight task has a key accepted by the filter.
   *
   * @param filter the key filter, never null
   *
   * @return true if at least one matching task is in flight
   */
  public boolean anyInFlight(final Predicate<? super K> filter) {
    Objects.requireNonNull(filter, "filter must not be null");
    return inFlight.keySet().stream().anyMatch(filter);
  }

  /**
   * Returns the number of tasks in flight.
   *
   * @return the number of tasks, zero or more
   */
  public int inFlightCount() {
    return inFlight.size();
  }
}
