package org.waabox.pronto.snapshot;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * A serialized dataset snapshot and its metadata.
 *
 * <p>The {@code data} array is copied on construction and on access.
 *
 * @param namespace the namespace this snapshot belongs to, never null
 * @param hash      the SHA-256 hex digest of {@code data}, never null
 * @param version   the snapshot version, increasing with each export
 * @param createdAt when the snapshot was created, never null
 * @param data      the JSON encoded dataset, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record SerializedSnapshot(
    String namespace,
    String hash,
    long version,
    Instant createdAt,
    byte[] data
) {

  /** Validates the components and copies the data. */
  public SerializedSnapshot {
    Objects.requireNonNull(namespace, "namespace must not be null");
    Objects.requireNonNull(hash, "hash must not be null");
    Objects.requireNonNull(createdAt, "createdAt must not be null");
    Objects.requireNonNull(data, "data must not be null");
    data = data.clone();
  }

  /**
   * Returns a copy of the serialized data.
   *
   * @return a copy of the data, never null
   */
  @Override
  public byte[] data() {
    return data.clone();
  }

  /** {@inheritDoc} */
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SerializedSnapshot that)) {
      return false;
    }
    return version == that.version
        && Objects.equals(namespace, that.namespace)
        && Objects.equals(hash, that.hash)
        && Objects.equals(createdAt, that.createdAt)
        && Arrays.equals(data, that.data);
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    int result = Objects.hash(namespace, hash, version, createdAt);
    result = 31 * result + Arrays.hashCode(data);
    return result;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return "SerializedSnapshot[namespace=" + namespace + ", hash=" + hash
        + ", version=" + version + ", createdAt=" + createdAt
        + ", size=" + data.length + "]";
  }
}
