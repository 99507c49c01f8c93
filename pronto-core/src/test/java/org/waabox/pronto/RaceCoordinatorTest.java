package org.waabox.pronto;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link RaceCoordinator}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class RaceCoordinatorTest {

  @Test
  void whenRacing_givenEmptyFirstThenPartialThenFull_shouldPickFirstUsable() {
    final CompletableFuture<String> empty = after(10, "");
    final CompletableFuture<String> partial = after(20, "partial");
    final CompletableFuture<String> full = after(50, "full");

    final Optional<String> winner = RaceCoordinator.firstUsable(
        List.of(empty, partial, full), value -> !value.isEmpty()).join();

    assertEquals(Optional.of("partial"), winner);
    assertFalse(full.isCancelled());
    assertEquals("full", full.join());
  }

  @Test
  void whenRacing_givenOnlyUnusableCandidates_shouldSettleEmpty() {
    final CompletableFuture<String> failed = CompletableFuture.failedFuture(
        new TransientFetchException("down"));
    final CompletableFuture<String> nothing =
        CompletableFuture.completedFuture(null);
    final CompletableFuture<String> blank = after(5, "");

    final Optional<String> winner = RaceCoordinator.firstUsable(
        List.of(failed, nothing, blank), value -> !value.isEmpty()).join();

    assertTrue(winner.isEmpty());
  }

  @Test
  void whenRacing_givenNoCandidates_shouldSettleEmpty() {
    final List<CompletableFuture<String>> none = List.of();

    assertTrue(RaceCoordinator.firstUsable(none, value -> true).join()
        .isEmpty());
  }

  @Test
  void whenRacing_givenFastFailureAndSlowSuccess_shouldWaitForSuccess() {
    final CompletableFuture<String> failed = CompletableFuture.failedFuture(
        new TransientFetchException("down"));
    final CompletableFuture<String> slow = after(30, "full");

    final Optional<String> winner = RaceCoordinator.firstUsable(
        List.of(failed, slow), value -> true).join();

    assertEquals(Optional.of("full"), winner);
  }

  private static CompletableFuture<String> after(final long millis,
      final String value) {
    final Executor delayed = CompletableFuture.delayedExecutor(millis,
        TimeUnit.MILLISECONDS);
    return CompletableFuture.supplyAsync(() -> value, delayed);
  }
}
