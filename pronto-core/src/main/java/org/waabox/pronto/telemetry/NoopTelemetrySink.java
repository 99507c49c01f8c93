package org.waabox.pronto.telemetry;

import java.util.Map;

/**
 * A {@link TelemetrySink} that discards every event.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class NoopTelemetrySink implements TelemetrySink {

  /** The shared instance. */
  public static final NoopTelemetrySink INSTANCE = new NoopTelemetrySink();

  private NoopTelemetrySink() {
  }

  /** {@inheritDoc} */
  @Override
  public void record(final String eventName,
      final Map<String, Object> fields) {
  }
}
