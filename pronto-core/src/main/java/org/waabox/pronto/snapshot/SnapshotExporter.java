package org.waabox.pronto.snapshot;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.pronto.DatasetQuery;
import org.waabox.pronto.ReferenceLookup;
import org.waabox.pronto.data.Dataset;

/**
 * Builds and stores the pre-baked snapshot of a corpus.
 *
 * <p>The snapshot keeps every pollutant and category of the full dataset
 * but only the rows of the default selection. Names in the selection are
 * resolved against the full dataset, ignoring case; names that do not
 * resolve are skipped with a warning.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SnapshotExporter {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      SnapshotExporter.class);

  /** The store snapshots are written to, never null. */
  private final SnapshotStore store;

  /** The clock used to stamp snapshots, never null. */
  private final Clock clock;

  /**
   * Creates an exporter using the UTC system clock.
   *
   * @param store the snapshot store, never null
   */
  public SnapshotExporter(final SnapshotStore store) {
    this(store, Clock.systemUTC());
  }

  /**
   * Creates an exporter.
   *
   * @param store the snapshot store, never null
   * @param clock the clock, never null
   */
  public SnapshotExporter(final SnapshotStore store, final Clock clock) {
    this.store = Objects.requireNonNull(store, "store must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  /**
   * Exports the snapshot of a namespace.
   *
   * @param namespace        the namespace, never null
   * @param full             the full dataset, never null
   * @param defaultSelection the selection whose rows are kept, never null
   *
   * @return the stored snapshot, never null
   *
   * @throws IllegalArgumentException if the selection resolves to no rows
   */
  public SerializedSnapshot export(final String namespace, final Dataset full,
      final DatasetQuery defaultSelection) {
    Objects.requireNonNull(namespace, "namespace must not be null");
    Objects.requireNonNull(full, "full must not be null");
    Objects.requireNonNull(defaultSelection,
        "defaultSelection must not be null");

    final ReferenceLookup lookup = ReferenceLookup.of(full);

    final Set<Integer> pollutantIds = new TreeSet<>(
        defaultSelection.pollutantIds());
    for (final String name : defaultSelection.pollutantNames()) {
      lookup.pollutantId(name).ifPresentOrElse(pollutantIds::add,
          () -> log.warn("Namespace '{}': unknown pollutant '{}' skipped",
              namespace, name));
    }
    final Set<Integer> categoryIds = new TreeSet<>(
        defaultSelection.categoryIds());
    for (final String name : defaultSelection.categoryNames()) {
      lookup.categoryId(name).ifPresentOrElse(categoryIds::add,
          () -> log.warn("Namespace '{}': unknown category '{}' skipped",
              namespace, name));
    }

    final Dataset trimmed = full.restrictTo(pollutantIds, categoryIds);
    if (trimmed.rows().isEmpty()) {
      throw new IllegalArgumentException("Default selection "
          + defaultSelection + " matches no rows in namespace '"
          + namespace + "'");
    }

    final Instant createdAt = clock.instant();
    final byte[] data = DatasetCodec.encode(trimmed, createdAt);
    final SerializedSnapshot snapshot = new SerializedSnapshot(namespace,
        sha256(data), createdAt.toEpochMilli(), createdAt, data);
    store.save(namespace, snapshot);

    log.info("Namespace '{}': exported snapshot with {} pollutants, "
        + "{} categories and {} rows", namespace,
        trimmed.pollutants().size(), trimmed.categories().size(),
        trimmed.rows().size());
    return snapshot;
  }

  /**
   * Computes the SHA-256 hex digest of the given bytes.
   *
   * @param data the bytes, never null
   *
   * @return the lower-case hex digest, never null
   */
  public static String sha256(final byte[] data) {
    try {
      final MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(data));
    } catch (final NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
