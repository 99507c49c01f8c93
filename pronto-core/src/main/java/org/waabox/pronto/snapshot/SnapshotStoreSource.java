package org.waabox.pronto.snapshot;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.pronto.data.Dataset;
import org.waabox.pronto.source.SnapshotSource;

/**
 * A {@link SnapshotSource} backed by a {@link SnapshotStore}.
 *
 * <p>The decoded snapshot is memoized until {@link #invalidate()} is called.
 * A missing snapshot is not memoized, so a snapshot exported later is
 * picked up by the next fetch.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SnapshotStoreSource implements SnapshotSource {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      SnapshotStoreSource.class);

  /** The backing store, never null. */
  private final SnapshotStore store;

  /** The namespace the snapshot is stored under, never null. */
  private final String namespace;

  /** The memoized snapshot, null until loaded. */
  private final AtomicReference<Dataset> memo = new AtomicReference<>();

  /**
   * Creates a new source.
   *
   * @param store     the snapshot store, never null
   * @param namespace the namespace to read, never null
   */
  public SnapshotStoreSource(final SnapshotStore store,
      final String namespace) {
    this.store = Objects.requireNonNull(store, "store must not be null");
    this.namespace = Objects.requireNonNull(namespace,
        "namespace must not be null");
  }

  /** {@inheritDoc} */
  @Override
  public Optional<Dataset> fetchSnapshot() {
    final Dataset cached = memo.get();
    if (cached != null) {
      log.debug("Namespace '{}': using memoized snapshot", namespace);
      return Optional.of(cached);
    }

    final Optional<SerializedSnapshot> snapshot = store.load(namespace);
    if (snapshot.isEmpty()) {
      log.debug("Namespace '{}': no snapshot stored", namespace);
      return Optional.empty();
    }

    final Dataset dataset = DatasetCodec.decode(snapshot.get().data());
    memo.compareAndSet(null, dataset);
    log.info("Namespace '{}': loaded snapshot version {} ({} pollutants, "
        + "{} categories, {} rows)", namespace, snapshot.get().version(),
        dataset.pollutants().size(), dataset.categories().size(),
        dataset.rows().size());
    return Optional.of(memo.get());
  }

  /** {@inheritDoc} */
  @Override
  public void invalidate() {
    memo.set(null);
  }
}
