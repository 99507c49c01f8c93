package org.waabox.pronto;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a {@link RetryPolicy} to a blocking producer.
 *
 * <p>Each failed attempt is logged and reported to the optional
 * {@link AttemptListener}. If attempts remain and the failure is retryable,
 * the executor sleeps for the policy backoff and tries again; otherwise the
 * last failure is rethrown. Unchecked exceptions are rethrown as they are,
 * checked ones are wrapped in a {@link TransientFetchException}.
 *
 * <p>The retryable predicate decides which failures are worth another
 * attempt. By default every failure is retryable.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RetryExecutor {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      RetryExecutor.class);

  /** The retry policy, never null. */
  private final RetryPolicy policy;

  /** Tells retryable failures apart from terminal ones, never null. */
  private final Predicate<Throwable> retryable;

  /**
   * Creates an executor that retries every failure.
   *
   * @param policy the retry policy, never null
   */
  public RetryExecutor(final RetryPolicy policy) {
    this(policy, error -> true);
  }

  /**
   * Creates an executor with a retryable predicate.
   *
   * @param policy    the retry policy, never null
   * @param retryable returns true for failures worth another attempt,
   *                  never null
   */
  public RetryExecutor(final RetryPolicy policy,
      final Predicate<Throwable> retryable) {
    this.policy = Objects.requireNonNull(policy, "policy must not be null");
    this.retryable = Objects.requireNonNull(retryable,
        "retryable must not be null");
  }

  /**
   * Returns the policy this executor applies.
   *
   * @return the policy, never null
   */
  public RetryPolicy policy() {
    return policy;
  }

  /**
   * Runs the producer with retries.
   *
   * @param operation a label for logs, never null
   * @param producer  the work to run, never null
   * @param <T>       the result type
   *
   * @return the producer result
   */
  public <T> T execute(final String operation, final Callable<T> producer) {
    return execute(operation, producer, AttemptListener.NONE);
  }

  /**
   * Runs the producer with retries, reporting each failed attempt.
   *
   * @param operation a label for logs, never null
   * @param producer  the work to run, never null
   * @param listener  notified of every failed attempt, never null
   * @param <T>       the result type
   *
   * @return the producer result
   *
   * @throws TransientFetchException if the last failure was a checked
   *                                 exception, or the backoff was
   *                                 interrupted
   */
  public <T> T execute(final String operation, final Callable<T> producer,
      final AttemptListener listener) {
    Objects.requireNonNull(operation, "operation must not be null");
    Objects.requireNonNull(producer, "producer must not be null");
    Objects.requireNonNull(listener, "listener must not be null");

    final int maxAttempts = policy.maxAttempts();

    for (int attempt = 1; ; attempt++) {
      try {
        return producer.call();
      } catch (final Exception e) {
        final boolean terminal = !retryable.test(e);
        final boolean willRetry = !terminal && attempt < maxAttempts;

        if (terminal) {
          log.warn("{}: attempt {}/{} failed with a terminal error: {}",
              operation, attempt, maxAttempts, e.getMessage());
        } else {
          log.warn("{}: attempt {}/{} failed: {}", operation, attempt,
              maxAttempts, e.getMessage());
        }
        listener.onAttemptFailed(attempt, e, willRetry);

        if (!willRetry) {
          if (!terminal) {
            log.error("{}: all {} attempts exhausted", operation,
                maxAttempts);
          }
          throw propagate(operation, e);
        }
        sleepOrAbort(operation, e);
      }
    }
  }

  /**
   * Sleeps for the policy backoff.
   *
   * @param operation the operation label, never null
   * @param cause     the failure that triggered the retry, never null
   *
   * @throws TransientFetchException if interrupted, with the interrupt
   *                                 flag restored
   */
  private void sleepOrAbort(final String operation, final Exception cause) {
    try {
      Thread.sleep(policy.backoff().toMillis());
    } catch (final InterruptedException ie) {
      Thread.currentThread().interrupt();
      final TransientFetchException aborted = new TransientFetchException(
          operation + ": retry interrupted", ie);
      aborted.addSuppressed(cause);
      throw aborted;
    }
  }

  private static RuntimeException propagate(final String operation,
      final Exception e) {
    if (e instanceof RuntimeException runtime) {
      return runtime;
    }
    return new TransientFetchException(operation + " failed", e);
  }

  /**
   * Receives every failed attempt of a retried operation.
   */
  @FunctionalInterface
  public interface AttemptListener {

    /** A listener that ignores every attempt. */
    AttemptListener NONE = (attempt, cause, willRetry) -> { };

    /**
     * Called after an attempt failed.
     *
     * @param attempt   the 1-based attempt number
     * @param cause     the failure, never null
     * @param willRetry whether another attempt follows
     */
    void onAttemptFailed(int attempt, Throwable cause, boolean willRetry);
  }
}
