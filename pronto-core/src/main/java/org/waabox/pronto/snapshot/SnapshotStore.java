package org.waabox.pronto.snapshot;

import java.util.Optional;

/**
 * A persistent store for pre-baked dataset snapshots.
 *
 * <p>A snapshot holds the reference data of a corpus and the rows of its
 * default selection. It is produced offline by the
 * {@link SnapshotExporter} and read at startup through a
 * {@link SnapshotStoreSource}, so the first chart can render before the
 * remote data service answers.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface SnapshotStore {

  /**
   * Saves the snapshot of a namespace, replacing any previous one.
   *
   * @param namespace the namespace, never null
   * @param snapshot  the snapshot to persist, never null
   */
  void save(String namespace, SerializedSnapshot snapshot);

  /**
   * Loads the snapshot of a namespace.
   *
   * @param namespace the namespace, never null
   *
   * @return the snapshot, or empty if none was stored
   */
  Optional<SerializedSnapshot> load(String namespace);
}
