package org.waabox.pronto.source;

import java.util.Optional;

import org.waabox.pronto.data.Dataset;

/**
 * Provides the pre-baked snapshot of a corpus default selection.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface SnapshotSource {

  /**
   * Fetches the snapshot.
   *
   * @return the snapshot, or empty if none is available
   */
  Optional<Dataset> fetchSnapshot();

  /**
   * Drops any memoized snapshot so the next fetch reaches the backing store.
   */
  default void invalidate() {
  }
}
