package org.waabox.pronto.telemetry;

import java.util.Map;

/**
 * Receives the telemetry events emitted while loading datasets.
 *
 * <p>Implementations must be thread-safe and must not throw; a sink failure
 * is logged by the caller and otherwise ignored.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface TelemetrySink {

  /** Emitted when a source tier returns a usable dataset. */
  String DATASET_LOADED = "dataset_loaded";

  /** Emitted, throttled, when a source tier fails. */
  String DATASET_LOAD_ERROR = "dataset_load_error";

  /** Emitted once per namespace when the full dataset is installed. */
  String DATASET_HYDRATED = "dataset_hydrated";

  /**
   * Records an event.
   *
   * @param eventName the event name, never null
   * @param fields    the event fields, never null
   */
  void record(String eventName, Map<String, Object> fields);
}
