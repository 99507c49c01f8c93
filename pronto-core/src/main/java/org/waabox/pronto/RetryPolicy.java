package org.waabox.pronto;

import java.time.Duration;
import java.util.Objects;

/**
 * Defines the retry behavior for source fetches.
 *
 * <p>Instances are created through static factory methods. The default
 * policy allows 3 attempts with a fixed 500 millisecond delay between
 * attempts.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RetryPolicy {

  /** The default number of attempts. */
  private static final int DEFAULT_MAX_ATTEMPTS = 3;

  /** The default delay between attempts. */
  private static final Duration DEFAULT_BACKOFF = Duration.ofMillis(500);

  /** The maximum number of attempts, the first one included. */
  private final int maxAttempts;

  /** The duration to wait between attempts. */
  private final Duration backoff;

  /**
   * Creates a new retry policy.
   *
   * @param maxAttempts the maximum number of attempts, must be greater
   *                    than zero
   * @param backoff     the duration to wait between attempts, never null
   */
  private RetryPolicy(final int maxAttempts, final Duration backoff) {
    this.maxAttempts = maxAttempts;
    this.backoff = backoff;
  }

  /**
   * Creates a retry policy with the given parameters.
   *
   * @param maxAttempts the maximum number of attempts, must be greater
   *                    than zero
   * @param backoff     the fixed duration to wait between attempts,
   *                    must be positive
   * @return a new retry policy, never null
   *
   * @throws IllegalArgumentException if maxAttempts is less than or equal
   *                                  to zero, or backoff is not positive
   * @throws NullPointerException if backoff is null
   */
  public static RetryPolicy of(final int maxAttempts, final Duration backoff) {
    if (maxAttempts <= 0) {
      throw new IllegalArgumentException(
          "maxAttempts must be greater than 0, got: " + maxAttempts);
    }
    Objects.requireNonNull(backoff, "backoff must not be null");
    if (backoff.isNegative() || backoff.isZero()) {
      throw new IllegalArgumentException(
          "backoff must be positive, got: " + backoff);
    }
    return new RetryPolicy(maxAttempts, backoff);
  }

  /**
   * Creates a retry policy with the defaults: 3 attempts with a
   * 500 millisecond delay.
   *
   * @return the default retry policy, never null
   */
  public static RetryPolicy defaultPolicy() {
    return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_BACKOFF);
  }

  /**
   * Returns the maximum number of attempts.
   *
   * @return the maximum number of attempts, always greater than zero
   */
  public int maxAttempts() {
    return maxAttempts;
  }

  /**
   * Returns the duration to wait between attempts.
   *
   * @return the backoff duration, never null
   */
  public Duration backoff() {
    return backoff;
  }
}
