package org.waabox.pronto.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;

import org.waabox.pronto.CacheEntry;
import org.waabox.pronto.Completeness;
import org.waabox.pronto.SourceTier;
import org.waabox.pronto.data.Dataset;
import org.waabox.pronto.data.Pollutant;

/**
 * Tests for {@link InMemoryCacheStore}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class InMemoryCacheStoreTest {

  private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

  private static final Dataset DATA = new Dataset(
      List.of(Pollutant.of(1, "PM2.5")), List.of(), List.of());

  private final InMemoryCacheStore store = new InMemoryCacheStore();

  @Test
  void whenGetting_givenUnknownNamespace_shouldReturnEmpty() {
    assertTrue(store.get("line").isEmpty());
    assertFalse(store.isHydrated("line"));
  }

  @Test
  void whenPutting_givenPartialThenFull_shouldUpgrade() {
    final CacheEntry partial = CacheEntry.of(DATA, SourceTier.HERO, T0);
    final CacheEntry full = CacheEntry.of(DATA, SourceTier.FULL, T0);

    assertTrue(store.put("line", partial));
    assertTrue(store.put("line", full));

    assertSame(full, store.get("line").orElseThrow());
  }

  @Test
  void whenPutting_givenPartialAfterFull_shouldIgnoreIt() {
    final CacheEntry full = CacheEntry.of(DATA, SourceTier.FULL, T0);
    final CacheEntry partial = CacheEntry.of(DATA, SourceTier.SNAPSHOT,
        T0.plusSeconds(5));

    store.put("line", full);

    assertFalse(store.put("line", partial));
    assertEquals(Completeness.FULL,
        store.get("line").orElseThrow().completeness());
  }

  @Test
  void whenPutting_givenPartialOverPartial_shouldOverwrite() {
    final CacheEntry snapshot = CacheEntry.of(DATA, SourceTier.SNAPSHOT, T0);
    final CacheEntry hero = CacheEntry.of(DATA, SourceTier.HERO, T0);

    store.put("line", snapshot);

    assertTrue(store.put("line", hero));
    assertSame(hero, store.get("line").orElseThrow());
  }

  @Test
  void whenPutting_givenOlderFullOverNewerFull_shouldKeepNewer() {
    final CacheEntry newer = CacheEntry.of(DATA, SourceTier.FULL,
        T0.plusSeconds(10));
    final CacheEntry older = CacheEntry.of(DATA, SourceTier.FULL, T0);

    store.put("line", newer);

    assertFalse(store.put("line", older));
    assertSame(newer, store.get("line").orElseThrow());
  }

  @Test
  void whenMarkingHydrated_shouldReportOnlyTheFirstTransition() {
    assertTrue(store.markHydrated("line"));
    assertFalse(store.markHydrated("line"));
    assertTrue(store.isHydrated("line"));
  }

  @Test
  void whenClearing_shouldDropEntryAndHydration() {
    store.put("line", CacheEntry.of(DATA, SourceTier.FULL, T0));
    store.markHydrated("line");

    store.clear("line");

    assertTrue(store.get("line").isEmpty());
    assertFalse(store.isHydrated("line"));
    assertTrue(store.markHydrated("line"));
  }

  @Test
  void whenUsingNamespaces_shouldKeepThemIsolated() {
    store.put("line", CacheEntry.of(DATA, SourceTier.FULL, T0));
    store.markHydrated("line");

    assertTrue(store.get("bubble").isEmpty());
    assertFalse(store.isHydrated("bubble"));
  }
}
