package org.waabox.pronto.snapshot.fs;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.pronto.snapshot.DatasetCodec;
import org.waabox.pronto.snapshot.SerializedSnapshot;
import org.waabox.pronto.snapshot.SnapshotExporter;
import org.waabox.pronto.snapshot.SnapshotStore;

/**
 * A {@link SnapshotStore} that keeps the pre-baked snapshots on the local
 * filesystem, typically next to the static assets the charts are served
 * from.
 *
 * <p>Layout:
 * <pre>
 * {baseDir}/
 *   {namespace}/
 *     snapshot.json
 *     snapshot.properties
 * </pre>
 *
 * <p>{@code snapshot.json} holds the encoded dataset, and
 * {@code snapshot.properties} its hash, version and creation time. Both
 * files are written to a temporary file first and then moved into place.
 * A snapshot whose content does not match its recorded hash is reported
 * and treated as missing.
 *
 * <p>A {@code snapshot.json} dropped in place without its properties file,
 * as a static export writes it, is still served: the hash is computed from
 * the content, the creation time is the document {@code generatedAt} or
 * the file modification time, and the version is that time in epoch millis.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FileSystemSnapshotStore implements SnapshotStore {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      FileSystemSnapshotStore.class);

  /** The data file of each namespace directory. */
  static final String DATA_FILE = "snapshot.json";

  /** The metadata file of each namespace directory. */
  static final String META_FILE = "snapshot.properties";

  /** The metadata key of the content hash. */
  private static final String META_HASH = "hash";

  /** The metadata key of the version. */
  private static final String META_VERSION = "version";

  /** The metadata key of the creation time. */
  private static final String META_CREATED_AT = "createdAt";

  /** The directory holding one subdirectory per namespace. */
  private final Path baseDir;

  /**
   * Creates a new store, creating the base directory if needed.
   *
   * @param baseDir the base directory, never null
   *
   * @throws UncheckedIOException if the directory cannot be created
   */
  public FileSystemSnapshotStore(final Path baseDir) {
    Objects.requireNonNull(baseDir, "baseDir must not be null");
    this.baseDir = baseDir.toAbsolutePath().normalize();

    try {
      Files.createDirectories(baseDir);
    } catch (final IOException e) {
      throw new UncheckedIOException(
          "Failed to create snapshot directory: " + baseDir, e);
    }
  }

  /**
   * {@inheritDoc}
   *
   * @throws UncheckedIOException if writing fails
   */
  @Override
  public void save(final String namespace,
      final SerializedSnapshot snapshot) {
    Objects.requireNonNull(snapshot, "snapshot must not be null");
    final Path dir = namespaceDir(namespace);

    try {
      Files.createDirectories(dir);
      writeAtomically(dir.resolve(DATA_FILE), snapshot.data());
      writeAtomically(dir.resolve(META_FILE), metadata(snapshot));
    } catch (final IOException e) {
      throw new UncheckedIOException(
          "Failed to save snapshot for namespace: " + namespace, e);
    }
    log.info("Namespace '{}': snapshot version {} written to {}", namespace,
        snapshot.version(), dir);
  }

  /**
   * {@inheritDoc}
   *
   * @throws UncheckedIOException  if reading fails
   * @throws IllegalStateException if the metadata file is incomplete
   */
  @Override
  public Optional<SerializedSnapshot> load(final String namespace) {
    final Path dir = namespaceDir(namespace);
    final Path dataFile = dir.resolve(DATA_FILE);
    final Path metaFile = dir.resolve(META_FILE);

    if (!Files.exists(dataFile)) {
      return Optional.empty();
    }

    final SerializedSnapshot snapshot;
    try {
      final byte[] data = Files.readAllBytes(dataFile);
      if (!Files.exists(metaFile)) {
        log.debug("Namespace '{}': no {} next to {}, deriving metadata",
            namespace, META_FILE, DATA_FILE);
        return Optional.of(derive(namespace, data, dataFile));
      }
      snapshot = parse(namespace, data,
          Files.readString(metaFile, StandardCharsets.UTF_8));
    } catch (final IOException e) {
      throw new UncheckedIOException(
          "Failed to load snapshot for namespace: " + namespace, e);
    }

    final String actual = SnapshotExporter.sha256(snapshot.data());
    if (!actual.equals(snapshot.hash())) {
      log.warn("Namespace '{}': snapshot hash mismatch (expected {}, got {}),"
          + " ignoring it", namespace, snapshot.hash(), actual);
      return Optional.empty();
    }
    return Optional.of(snapshot);
  }

  private Path namespaceDir(final String namespace) {
    Objects.requireNonNull(namespace, "namespace must not be null");
    final Path dir = baseDir.resolve(namespace).normalize();
    if (namespace.isBlank() || !baseDir.equals(dir.getParent())) {
      throw new IllegalArgumentException("Invalid namespace: " + namespace);
    }
    return dir;
  }

  private static void writeAtomically(final Path target, final byte[] content)
      throws IOException {
    final Path temp = target.resolveSibling(target.getFileName() + ".tmp");
    Files.write(temp, content);
    Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING,
        StandardCopyOption.ATOMIC_MOVE);
  }

  private static byte[] metadata(final SerializedSnapshot snapshot) {
    return (META_HASH + "=" + snapshot.hash() + "\n"
        + META_VERSION + "=" + snapshot.version() + "\n"
        + META_CREATED_AT + "=" + snapshot.createdAt() + "\n")
        .getBytes(StandardCharsets.UTF_8);
  }

  private static SerializedSnapshot derive(final String namespace,
      final byte[] data, final Path dataFile) throws IOException {
    Instant createdAt = DatasetCodec.generatedAt(data);
    if (createdAt == null) {
      createdAt = Files.getLastModifiedTime(dataFile).toInstant();
    }
    return new SerializedSnapshot(namespace, SnapshotExporter.sha256(data),
        createdAt.toEpochMilli(), createdAt, data);
  }

  private static SerializedSnapshot parse(final String namespace,
      final byte[] data, final String metaContent) throws IOException {
    final Properties meta = new Properties();
    meta.load(new StringReader(metaContent));

    final String hash = meta.getProperty(META_HASH);
    final String version = meta.getProperty(META_VERSION);
    final String createdAt = meta.getProperty(META_CREATED_AT);
    if (hash == null || version == null || createdAt == null) {
      throw new IllegalStateException("Incomplete snapshot metadata for "
          + "namespace: " + namespace + ". Missing one of: hash, version, "
          + "createdAt");
    }
    return new SerializedSnapshot(namespace, hash, Long.parseLong(version),
        Instant.parse(createdAt), data);
  }
}
