package org.waabox.pronto;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link RetryExecutor}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class RetryExecutorTest {

  private final RetryPolicy policy = RetryPolicy.of(3, Duration.ofMillis(5));

  @Test
  void whenExecuting_givenTwoFailuresThenSuccess_shouldReturnThirdResult() {
    final AtomicInteger calls = new AtomicInteger();
    final List<Boolean> retries = new ArrayList<>();

    final String result = new RetryExecutor(policy).execute("fetch", () -> {
      if (calls.incrementAndGet() < 3) {
        throw new TransientFetchException("boom " + calls.get());
      }
      return "data";
    }, (attempt, cause, willRetry) -> retries.add(willRetry));

    assertEquals("data", result);
    assertEquals(3, calls.get());
    assertEquals(List.of(true, true), retries);
  }

  @Test
  void whenExecuting_givenPersistentFailure_shouldRethrowLastErrorAfterMaxAttempts() {
    final AtomicInteger calls = new AtomicInteger();
    final List<Integer> attempts = new ArrayList<>();

    final TransientFetchException error = assertThrows(
        TransientFetchException.class,
        () -> new RetryExecutor(policy).execute("fetch", () -> {
          throw new TransientFetchException("attempt "
              + calls.incrementAndGet());
        }, (attempt, cause, willRetry) -> attempts.add(attempt)));

    assertEquals("attempt 3", error.getMessage());
    assertEquals(3, calls.get());
    assertEquals(List.of(1, 2, 3), attempts);
  }

  @Test
  void whenExecuting_givenNonRetryableError_shouldFailOnFirstAttempt() {
    final AtomicInteger calls = new AtomicInteger();
    final RetryExecutor executor = new RetryExecutor(policy,
        error -> !(error instanceof InvalidQueryException));

    final InvalidQueryException invalid = new InvalidQueryException("bad");
    final InvalidQueryException thrown = assertThrows(
        InvalidQueryException.class, () -> executor.execute("fetch", () -> {
          calls.incrementAndGet();
          throw invalid;
        }));

    assertSame(invalid, thrown);
    assertEquals(1, calls.get());
  }

  @Test
  void whenExecuting_givenCheckedException_shouldWrapIt() {
    final IOException io = new IOException("disk");

    final TransientFetchException thrown = assertThrows(
        TransientFetchException.class,
        () -> new RetryExecutor(RetryPolicy.of(1, Duration.ofMillis(1)))
            .execute("read", () -> {
              throw io;
            }));

    assertSame(io, thrown.getCause());
  }

  @Test
  void whenExecuting_givenInterruptedBackoff_shouldAbortAndRestoreFlag() {
    final AtomicInteger calls = new AtomicInteger();
    final RetryExecutor executor = new RetryExecutor(
        RetryPolicy.of(3, Duration.ofSeconds(10)));

    Thread.currentThread().interrupt();
    try {
      assertThrows(TransientFetchException.class, () ->
          executor.execute("fetch", () -> {
            calls.incrementAndGet();
            throw new TransientFetchException("down");
          }));
      assertTrue(Thread.currentThread().isInterrupted());
      assertEquals(1, calls.get());
    } finally {
      Thread.interrupted();
    }
    assertFalse(Thread.currentThread().isInterrupted());
  }
}
