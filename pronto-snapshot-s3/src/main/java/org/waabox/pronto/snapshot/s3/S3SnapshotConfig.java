package org.waabox.pronto.snapshot.s3;

import java.util.Objects;
import java.util.Optional;

import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

/**
 * Configuration of the S3 snapshot store.
 *
 * <p>Holds the bucket, the key prefix, the region and an optional
 * pre-built {@link S3Client}. Without a client the store builds one for
 * the region and closes it on {@link S3SnapshotStore#close()}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class S3SnapshotConfig {

  /** The key prefix used when none is set. */
  private static final String DEFAULT_PREFIX = "pronto/";

  /** The bucket, never null. */
  private final String bucket;

  /** The key prefix, never null. Ends with a slash unless empty. */
  private final String prefix;

  /** The region, never null. */
  private final Region region;

  /** The pre-built client, may be null. */
  private final S3Client s3Client;

  private S3SnapshotConfig(final Builder builder) {
    this.bucket = Objects.requireNonNull(builder.bucket,
        "bucket must not be null");
    this.region = Objects.requireNonNull(builder.region,
        "region must not be null");
    this.prefix = normalizePrefix(builder.prefix != null
        ? builder.prefix : DEFAULT_PREFIX);
    this.s3Client = builder.s3Client;
  }

  /**
   * Returns the bucket.
   *
   * @return the bucket, never null
   */
  public String bucket() {
    return bucket;
  }

  /**
   * Returns the key prefix, {@code "pronto/"} unless set.
   *
   * @return the key prefix, never null
   */
  public String prefix() {
    return prefix;
  }

  /**
   * Returns the region.
   *
   * @return the region, never null
   */
  public Region region() {
    return region;
  }

  /**
   * Returns the pre-built client.
   *
   * @return the client, or empty if the store should build its own
   */
  public Optional<S3Client> s3Client() {
    return Optional.ofNullable(s3Client);
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  private static String normalizePrefix(final String prefix) {
    if (prefix.isEmpty() || prefix.endsWith("/")) {
      return prefix;
    }
    return prefix + "/";
  }

  /**
   * Builder for {@link S3SnapshotConfig}. Bucket and region are required.
   */
  public static final class Builder {

    /** The bucket. */
    private String bucket;

    /** The key prefix. */
    private String prefix;

    /** The region. */
    private Region region;

    /** The optional client. */
    private S3Client s3Client;

    private Builder() {
    }

    /**
     * Sets the bucket.
     *
     * @param theBucket the bucket, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder bucket(final String theBucket) {
      bucket = theBucket;
      return this;
    }

    /**
     * Sets the key prefix. A trailing slash is added when missing.
     *
     * @param thePrefix the prefix, null for the default
     *
     * @return this builder for chaining, never null
     */
    public Builder prefix(final String thePrefix) {
      prefix = thePrefix;
      return this;
    }

    /**
     * Sets the region.
     *
     * @param theRegion the region, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder region(final Region theRegion) {
      region = theRegion;
      return this;
    }

    /**
     * Sets a pre-built client. The caller keeps ownership of it.
     *
     * @param theS3Client the client, may be null
     *
     * @return this builder for chaining, never null
     */
    public Builder s3Client(final S3Client theS3Client) {
      s3Client = theS3Client;
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return the configuration, never null
     *
     * @throws NullPointerException if the bucket or the region is missing
     */
    public S3SnapshotConfig build() {
      return new S3SnapshotConfig(this);
    }
  }
}
