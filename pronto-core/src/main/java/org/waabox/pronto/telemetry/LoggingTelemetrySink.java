package org.waabox.pronto.telemetry;

import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link TelemetrySink} that writes every event to the log.
 *
 * <p>Load errors are logged at warn level, everything else at info.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class LoggingTelemetrySink implements TelemetrySink {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      LoggingTelemetrySink.class);

  /** {@inheritDoc} */
  @Override
  public void record(final String eventName,
      final Map<String, Object> fields) {
    Objects.requireNonNull(eventName, "eventName must not be null");
    Objects.requireNonNull(fields, "fields must not be null");
    if (DATASET_LOAD_ERROR.equals(eventName)) {
      log.warn("{} {}", eventName, fields);
    } else {
      log.info("{} {}", eventName, fields);
    }
  }
}
