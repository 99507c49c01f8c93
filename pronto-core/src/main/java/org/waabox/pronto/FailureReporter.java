package org.waabox.pronto;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Throttles failure reports per scope.
 *
 * <p>A scope is a free-form key, usually {@code namespace:tier}. The reporter
 * lets one report through per cooldown window and scope; a forced report is
 * always let through. The last emission time is only updated when a report
 * is let through.
 *
 * <p>This class is thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FailureReporter {

  /** The default cooldown between reports of the same scope. */
  public static final Duration DEFAULT_COOLDOWN = Duration.ofSeconds(60);

  /** The minimum time between two reports of the same scope. */
  private final Duration cooldown;

  /** The clock used to timestamp reports. */
  private final Clock clock;

  /** The last emission time per scope. */
  private final Map<String, Instant> lastEmittedAt = new ConcurrentHashMap<>();

  /**
   * Creates a reporter with the default cooldown and the system clock.
   */
  public FailureReporter() {
    this(DEFAULT_COOLDOWN, Clock.systemUTC());
  }

  /**
   * Creates a reporter.
   *
   * @param cooldown the cooldown per scope, never null nor negative
   * @param clock    the clock, never null
   */
  public FailureReporter(final Duration cooldown, final Clock clock) {
    Objects.requireNonNull(cooldown, "cooldown must not be null");
    if (cooldown.isNegative()) {
      throw new IllegalArgumentException(
          "cooldown must not be negative, got: " + cooldown);
    }
    this.cooldown = cooldown;
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  /**
   * Whether a failure for the scope should be reported now.
   *
   * @param scopeKey the scope, never null
   *
   * @return true if the report may be emitted
   */
  public boolean shouldEmit(final String scopeKey) {
    return shouldEmit(scopeKey, false);
  }

  /**
   * Whether a failure for the scope should be reported now.
   *
   * @param scopeKey the scope, never null
   * @param force    bypasses the cooldown
   *
   * @return true if the report may be emitted
   */
  public boolean shouldEmit(final String scopeKey, final boolean force) {
    Objects.requireNonNull(scopeKey, "scopeKey must not be null");
    final Instant now = clock.instant();
    final boolean[] emit = new boolean[1];
    lastEmittedAt.compute(scopeKey, (key, last) -> {
      if (force || last == null
          || !now.isBefore(last.plus(cooldown))) {
        emit[0] = true;
        return now;
      }
      return last;
    });
    return emit[0];
  }

  /**
   * Forgets every scope, so the next failure of each one is reported.
   */
  public void reset() {
    lastEmittedAt.clear();
  }
}
