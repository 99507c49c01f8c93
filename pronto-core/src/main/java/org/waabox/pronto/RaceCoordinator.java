package org.waabox.pronto;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settles with the first candidate that produces a usable value.
 *
 * <p>Candidates that fail, produce null or produce a value the predicate
 * rejects are logged and ignored. When every candidate has settled without a
 * usable value the race settles with an empty result. Losing candidates are
 * never cancelled: they keep running so their results can still reach the
 * cache.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RaceCoordinator {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      RaceCoordinator.class);

  private RaceCoordinator() {
  }

  /**
   * Races the candidates.
   *
   * @param candidates the candidate futures, in order of cheapness, never
   *                   null
   * @param usable     accepts the values worth serving, never null
   * @param <T>        the value type
   *
   * @return a future with the winning value, or empty if none was usable,
   *         never null. The future never completes exceptionally.
   */
  public static <T> CompletableFuture<Optional<T>> firstUsable(
      final List<? extends CompletableFuture<? extends T>> candidates,
      final Predicate<? super T> usable) {
    Objects.requireNonNull(candidates, "candidates must not be null");
    Objects.requireNonNull(usable, "usable must not be null");

    final CompletableFuture<Optional<T>> result = new CompletableFuture<>();
    if (candidates.isEmpty()) {
      result.complete(Optional.empty());
      return result;
    }

    final AtomicInteger pending = new AtomicInteger(candidates.size());
    final AtomicBoolean settled = new AtomicBoolean(false);

    for (int i = 0; i < candidates.size(); i++) {
      final int index = i;
      candidates.get(i).whenComplete((value, error) -> {
        boolean accepted = false;
        if (error != null) {
          log.debug("Race candidate {} rejected: {}", index,
              error.getMessage());
        } else if (value == null) {
          log.debug("Race candidate {} produced no value", index);
        } else {
          accepted = usableOrFalse(usable, value, index);
        }

        if (accepted && settled.compareAndSet(false, true)) {
          result.complete(Optional.of(value));
        }
        if (pending.decrementAndGet() == 0
            && settled.compareAndSet(false, true)) {
          log.debug("Race settled without a usable candidate");
          result.complete(Optional.empty());
        }
      });
    }
    return result;
  }

  private static <T> boolean usableOrFalse(final Predicate<? super T> usable,
      final T value, final int index) {
    try {
      final boolean accepted = usable.test(value);
      if (!accepted) {
        log.debug("Race candidate {} produced an unusable value", index);
      }
      return accepted;
    } catch (final RuntimeException e) {
      log.warn("Race candidate {} could not be evaluated: {}", index,
          e.getMessage());
      return false;
    }
  }
}
