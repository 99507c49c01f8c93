package org.waabox.pronto.snapshot.s3;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.pronto.snapshot.DatasetCodec;
import org.waabox.pronto.snapshot.SerializedSnapshot;
import org.waabox.pronto.snapshot.SnapshotExporter;
import org.waabox.pronto.snapshot.SnapshotStore;

import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/**
 * A {@link SnapshotStore} backed by Amazon S3.
 *
 * <p>Each namespace is one JSON object at
 * {@code {prefix}{namespace}/snapshot.json}, with the hash, version and
 * creation time stored as user metadata ({@code x-amz-meta-hash},
 * {@code x-amz-meta-version}, {@code x-amz-meta-created-at}).
 *
 * <p>Objects uploaded without that metadata, for instance by a static
 * asset pipeline, are still readable: the hash is computed from the
 * content, the creation time is the document {@code generatedAt} or the
 * object last-modified time, and the version is that time in epoch millis.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class S3SnapshotStore implements SnapshotStore, AutoCloseable {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      S3SnapshotStore.class);

  /** The object name within each namespace prefix. */
  private static final String DATA_FILE = "snapshot.json";

  /** User metadata key of the content hash. */
  private static final String META_HASH = "hash";

  /** User metadata key of the version. */
  private static final String META_VERSION = "version";

  /** User metadata key of the creation time. */
  private static final String META_CREATED_AT = "created-at";

  /** User metadata key of the namespace. */
  private static final String META_NAMESPACE = "namespace";

  /** The bucket. */
  private final String bucket;

  /** The key prefix. */
  private final String prefix;

  /** The client used for every call. */
  private final S3Client s3Client;

  /** Whether this store built the client and must close it. */
  private final boolean ownsClient;

  /**
   * Creates a new store.
   *
   * @param config the configuration, never null
   */
  public S3SnapshotStore(final S3SnapshotConfig config) {
    Objects.requireNonNull(config, "config must not be null");

    this.bucket = config.bucket();
    this.prefix = config.prefix();

    if (config.s3Client().isPresent()) {
      this.s3Client = config.s3Client().get();
      this.ownsClient = false;
    } else {
      this.s3Client = S3Client.builder().region(config.region()).build();
      this.ownsClient = true;
    }
  }

  /** {@inheritDoc} */
  @Override
  public void save(final String namespace,
      final SerializedSnapshot snapshot) {
    Objects.requireNonNull(namespace, "namespace must not be null");
    Objects.requireNonNull(snapshot, "snapshot must not be null");

    final String key = keyOf(namespace);
    final PutObjectRequest request = PutObjectRequest.builder()
        .bucket(bucket)
        .key(key)
        .contentType("application/json")
        .metadata(Map.of(
            META_HASH, snapshot.hash(),
            META_VERSION, String.valueOf(snapshot.version()),
            META_CREATED_AT, snapshot.createdAt().toString(),
            META_NAMESPACE, namespace))
        .build();

    s3Client.putObject(request, RequestBody.fromBytes(snapshot.data()));

    log.info("Namespace '{}': snapshot version {} uploaded to s3://{}/{}",
        namespace, snapshot.version(), bucket, key);
  }

  /**
   * {@inheritDoc}
   *
   * @throws UncheckedIOException if the object cannot be read
   */
  @Override
  public Optional<SerializedSnapshot> load(final String namespace) {
    Objects.requireNonNull(namespace, "namespace must not be null");

    final String key = keyOf(namespace);
    final GetObjectRequest request = GetObjectRequest.builder()
        .bucket(bucket)
        .key(key)
        .build();

    try (ResponseInputStream<GetObjectResponse> response =
             s3Client.getObject(request)) {

      final byte[] data = response.readAllBytes();
      final GetObjectResponse head = response.response();
      final Map<String, String> metadata = head.metadata();

      final String hash = metadata.containsKey(META_HASH)
          ? metadata.get(META_HASH) : SnapshotExporter.sha256(data);
      final Instant createdAt = createdAt(metadata, data, head);
      final long version = metadata.containsKey(META_VERSION)
          ? Long.parseLong(metadata.get(META_VERSION))
          : createdAt.toEpochMilli();

      log.debug("Namespace '{}': snapshot version {} read from s3://{}/{}",
          namespace, version, bucket, key);
      return Optional.of(new SerializedSnapshot(namespace, hash, version,
          createdAt, data));

    } catch (final NoSuchKeyException e) {
      log.debug("Namespace '{}': no snapshot at s3://{}/{}", namespace,
          bucket, key);
      return Optional.empty();

    } catch (final IOException e) {
      throw new UncheckedIOException(
          "Failed to read snapshot for namespace: " + namespace, e);
    }
  }

  /**
   * Closes the client if this store built it.
   */
  @Override
  public void close() {
    if (ownsClient) {
      s3Client.close();
    }
  }

  private String keyOf(final String namespace) {
    return prefix + namespace + "/" + DATA_FILE;
  }

  private static Instant createdAt(final Map<String, String> metadata,
      final byte[] data, final GetObjectResponse head) {
    if (metadata.containsKey(META_CREATED_AT)) {
      return Instant.parse(metadata.get(META_CREATED_AT));
    }
    final Instant generatedAt = DatasetCodec.generatedAt(data);
    if (generatedAt != null) {
      return generatedAt;
    }
    return head.lastModified() != null ? head.lastModified() : Instant.EPOCH;
  }
}
