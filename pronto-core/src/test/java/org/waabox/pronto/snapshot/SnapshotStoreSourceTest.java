package org.waabox.pronto.snapshot;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import org.waabox.pronto.data.Dataset;
import org.waabox.pronto.data.Pollutant;

/**
 * Tests for {@link SnapshotStoreSource}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class SnapshotStoreSourceTest {

  private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

  private static final Dataset DATA = new Dataset(
      List.of(Pollutant.of(1, "PM2.5")), List.of(), List.of());

  private static SerializedSnapshot snapshot() {
    final byte[] data = DatasetCodec.encode(DATA, NOW);
    return new SerializedSnapshot("line", SnapshotExporter.sha256(data), 1L,
        NOW, data);
  }

  @Test
  void whenFetching_givenStoredSnapshot_shouldDecodeAndMemoize() {
    final SnapshotStore store = createMock(SnapshotStore.class);
    expect(store.load("line")).andReturn(Optional.of(snapshot())).once();
    replay(store);

    final SnapshotStoreSource source = new SnapshotStoreSource(store, "line");
    final Dataset first = source.fetchSnapshot().orElseThrow();
    final Dataset second = source.fetchSnapshot().orElseThrow();

    assertEquals(DATA, first);
    assertSame(first, second);
    verify(store);
  }

  @Test
  void whenFetching_givenNoSnapshot_shouldNotMemoizeTheMiss() {
    final SnapshotStore store = createMock(SnapshotStore.class);
    expect(store.load("line")).andReturn(Optional.empty());
    expect(store.load("line")).andReturn(Optional.of(snapshot()));
    replay(store);

    final SnapshotStoreSource source = new SnapshotStoreSource(store, "line");

    assertTrue(source.fetchSnapshot().isEmpty());
    assertEquals(DATA, source.fetchSnapshot().orElseThrow());
    verify(store);
  }

  @Test
  void whenInvalidating_shouldReloadFromStore() {
    final SnapshotStore store = createMock(SnapshotStore.class);
    expect(store.load("line")).andReturn(Optional.of(snapshot())).times(2);
    replay(store);

    final SnapshotStoreSource source = new SnapshotStoreSource(store, "line");
    source.fetchSnapshot();
    source.invalidate();
    source.fetchSnapshot();

    verify(store);
  }
}
