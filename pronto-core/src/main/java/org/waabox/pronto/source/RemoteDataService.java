package org.waabox.pronto.source;

/**
 * A remote data service able to serve every tier of a corpus.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface RemoteDataService extends SnapshotSource, ScopedSource,
    FullSource {

  /** {@inheritDoc} */
  @Override
  default void invalidate() {
  }
}
