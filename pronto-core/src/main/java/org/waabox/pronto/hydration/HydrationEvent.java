package org.waabox.pronto.hydration;

import java.time.Instant;
import java.util.Objects;

import org.waabox.pronto.CacheEntry;
import org.waabox.pronto.SourceTier;

/**
 * Signals that a namespace received its full dataset.
 *
 * <p>Emitted at most once per namespace between two resets.
 *
 * @param namespace  the hydrated namespace, never null
 * @param source     the tier that delivered the full dataset, never null
 * @param entry      the installed full entry, never null
 * @param hydratedAt when the namespace was marked hydrated, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record HydrationEvent(String namespace, SourceTier source,
    CacheEntry entry, Instant hydratedAt) {

  /** Validates the components. */
  public HydrationEvent {
    Objects.requireNonNull(namespace, "namespace must not be null");
    Objects.requireNonNull(source, "source must not be null");
    Objects.requireNonNull(entry, "entry must not be null");
    Objects.requireNonNull(hydratedAt, "hydratedAt must not be null");
  }
}
