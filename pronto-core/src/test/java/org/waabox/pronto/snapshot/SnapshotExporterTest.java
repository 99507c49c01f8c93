package org.waabox.pronto.snapshot;

import static org.easymock.EasyMock.capture;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.newCapture;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.easymock.Capture;
import org.junit.jupiter.api.Test;

import org.waabox.pronto.DatasetQuery;
import org.waabox.pronto.data.Category;
import org.waabox.pronto.data.Dataset;
import org.waabox.pronto.data.Pollutant;
import org.waabox.pronto.data.TimeseriesRow;

/**
 * Tests for {@link SnapshotExporter}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class SnapshotExporterTest {

  private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

  private static final Dataset FULL = new Dataset(
      List.of(Pollutant.of(1, "PM2.5"), Pollutant.of(2, "NOx")),
      List.of(Category.of(10, "All"), Category.of(11, "Road")),
      List.of(row(1, 1, 10), row(2, 2, 10), row(3, 1, 11)));

  private static TimeseriesRow row(final long id, final int pollutant,
      final int category) {
    return new TimeseriesRow(id, pollutant, category,
        new TreeMap<>(Map.of(2020, 1.0)));
  }

  @Test
  void whenExporting_shouldKeepReferenceDataAndDefaultRowsOnly() {
    final SnapshotStore store = createMock(SnapshotStore.class);
    final Capture<SerializedSnapshot> saved = newCapture();
    store.save(eq("line"), capture(saved));
    expectLastCall().once();
    replay(store);

    final SnapshotExporter exporter = new SnapshotExporter(store,
        Clock.fixed(NOW, ZoneOffset.UTC));
    final SerializedSnapshot snapshot = exporter.export("line", FULL,
        DatasetQuery.builder().pollutantNames("pm2.5", "Unknown")
            .categoryNames("ALL").build());

    verify(store);
    assertEquals(snapshot, saved.getValue());
    assertEquals(NOW.toEpochMilli(), snapshot.version());
    assertEquals(SnapshotExporter.sha256(snapshot.data()), snapshot.hash());

    final Dataset decoded = DatasetCodec.decode(snapshot.data());
    assertEquals(2, decoded.pollutants().size());
    assertEquals(2, decoded.categories().size());
    assertEquals(1, decoded.rows().size());
    assertEquals(1L, decoded.rows().get(0).id());
  }

  @Test
  void whenExporting_givenSelectionWithoutRows_shouldThrow() {
    final SnapshotStore store = createMock(SnapshotStore.class);
    replay(store);

    final SnapshotExporter exporter = new SnapshotExporter(store);

    assertThrows(IllegalArgumentException.class, () ->
        exporter.export("line", FULL, DatasetQuery.builder()
            .pollutantIds(2).categoryIds(11).build()));
    verify(store);
  }
}
