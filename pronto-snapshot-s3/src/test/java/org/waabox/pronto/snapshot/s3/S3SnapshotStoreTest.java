package org.waabox.pronto.snapshot.s3;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.capture;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.newCapture;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import org.easymock.Capture;
import org.junit.jupiter.api.Test;
import org.waabox.pronto.snapshot.SerializedSnapshot;
import org.waabox.pronto.snapshot.SnapshotExporter;

import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.http.AbortableInputStream;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;

/**
 * Tests for {@link S3SnapshotStore}, with a mocked {@link S3Client}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class S3SnapshotStoreTest {

  private static S3SnapshotConfig config(final S3Client client) {
    return S3SnapshotConfig.builder()
        .bucket("my-bucket")
        .region(Region.US_EAST_1)
        .s3Client(client)
        .build();
  }

  private static ResponseInputStream<GetObjectResponse> stream(
      final GetObjectResponse response, final byte[] data) {
    return new ResponseInputStream<>(response,
        AbortableInputStream.create(new ByteArrayInputStream(data)));
  }

  @Test
  void whenSaving_givenSnapshot_shouldPutObjectWithKeyAndMetadata() {
    final S3Client s3Client = createMock(S3Client.class);

    final byte[] data = "{}".getBytes(StandardCharsets.UTF_8);
    final Instant createdAt = Instant.parse("2026-01-15T10:30:00Z");
    final SerializedSnapshot snapshot = new SerializedSnapshot(
        "emissions", "sha256hash", 42L, createdAt, data);

    final Capture<PutObjectRequest> requestCapture = newCapture();
    final Capture<RequestBody> bodyCapture = newCapture();

    expect(s3Client.putObject(capture(requestCapture), capture(bodyCapture)))
        .andReturn(PutObjectResponse.builder().build());
    replay(s3Client);

    new S3SnapshotStore(config(s3Client)).save("emissions", snapshot);

    verify(s3Client);

    final PutObjectRequest captured = requestCapture.getValue();
    assertEquals("my-bucket", captured.bucket());
    assertEquals("pronto/emissions/snapshot.json", captured.key());
    assertEquals("application/json", captured.contentType());

    final Map<String, String> metadata = captured.metadata();
    assertEquals("sha256hash", metadata.get("hash"));
    assertEquals("42", metadata.get("version"));
    assertEquals("2026-01-15T10:30:00Z", metadata.get("created-at"));
    assertEquals("emissions", metadata.get("namespace"));
  }

  @Test
  void whenLoading_givenObjectWithMetadata_shouldReturnSnapshot() {
    final S3Client s3Client = createMock(S3Client.class);

    final byte[] data = "{}".getBytes(StandardCharsets.UTF_8);
    final GetObjectResponse response = GetObjectResponse.builder()
        .metadata(Map.of(
            "hash", "sha256hash",
            "version", "42",
            "created-at", "2026-01-15T10:30:00Z",
            "namespace", "emissions"))
        .build();

    final Capture<GetObjectRequest> requestCapture = newCapture();
    expect(s3Client.getObject(capture(requestCapture)))
        .andReturn(stream(response, data));
    replay(s3Client);

    final Optional<SerializedSnapshot> loaded =
        new S3SnapshotStore(config(s3Client)).load("emissions");

    verify(s3Client);

    assertEquals("pronto/emissions/snapshot.json",
        requestCapture.getValue().key());
    assertTrue(loaded.isPresent());

    final SerializedSnapshot result = loaded.get();
    assertEquals("emissions", result.namespace());
    assertEquals("sha256hash", result.hash());
    assertEquals(42L, result.version());
    assertEquals(Instant.parse("2026-01-15T10:30:00Z"), result.createdAt());
    assertArrayEquals(data, result.data());
  }

  @Test
  void whenLoading_givenObjectWithoutMetadata_shouldDeriveFromContent() {
    final S3Client s3Client = createMock(S3Client.class);

    final byte[] data = ("{\"generatedAt\":\"2025-03-01T00:00:00Z\","
        + "\"data\":{\"pollutants\":[],\"categories\":[],\"rows\":[]}}")
        .getBytes(StandardCharsets.UTF_8);
    final GetObjectResponse response = GetObjectResponse.builder().build();

    expect(s3Client.getObject(anyObject(GetObjectRequest.class)))
        .andReturn(stream(response, data));
    replay(s3Client);

    final SerializedSnapshot result =
        new S3SnapshotStore(config(s3Client)).load("emissions").orElseThrow();

    verify(s3Client);

    final Instant generatedAt = Instant.parse("2025-03-01T00:00:00Z");
    assertEquals(SnapshotExporter.sha256(data), result.hash());
    assertEquals(generatedAt, result.createdAt());
    assertEquals(generatedAt.toEpochMilli(), result.version());
  }

  @Test
  void whenLoading_givenNoGeneratedAt_shouldUseLastModified() {
    final S3Client s3Client = createMock(S3Client.class);

    final Instant lastModified = Instant.parse("2025-06-01T12:00:00Z");
    final byte[] data = "{\"rows\":[]}".getBytes(StandardCharsets.UTF_8);
    final GetObjectResponse response = GetObjectResponse.builder()
        .lastModified(lastModified)
        .build();

    expect(s3Client.getObject(anyObject(GetObjectRequest.class)))
        .andReturn(stream(response, data));
    replay(s3Client);

    final SerializedSnapshot result =
        new S3SnapshotStore(config(s3Client)).load("emissions").orElseThrow();

    verify(s3Client);
    assertEquals(lastModified, result.createdAt());
  }

  @Test
  void whenLoading_givenNonExistentKey_shouldReturnEmpty() {
    final S3Client s3Client = createMock(S3Client.class);

    expect(s3Client.getObject(anyObject(GetObjectRequest.class)))
        .andThrow(NoSuchKeyException.builder()
            .message("The specified key does not exist.")
            .build());
    replay(s3Client);

    final Optional<SerializedSnapshot> loaded =
        new S3SnapshotStore(config(s3Client)).load("missing");

    verify(s3Client);
    assertTrue(loaded.isEmpty());
  }

  @Test
  void whenClosing_givenProvidedClient_shouldNotCloseIt() {
    final S3Client s3Client = createMock(S3Client.class);
    replay(s3Client);

    new S3SnapshotStore(config(s3Client)).close();

    verify(s3Client);
  }

  @Test
  void whenCreatingConfig_givenDefaults_shouldUseProntoPrefix() {
    final S3SnapshotConfig config = S3SnapshotConfig.builder()
        .bucket("test-bucket")
        .region(Region.US_EAST_1)
        .build();

    assertEquals("pronto/", config.prefix());
    assertTrue(config.s3Client().isEmpty());
  }

  @Test
  void whenSaving_givenPrefixWithoutSlash_shouldAppendSlash() {
    final S3Client s3Client = createMock(S3Client.class);

    final S3SnapshotConfig config = S3SnapshotConfig.builder()
        .bucket("my-bucket")
        .region(Region.EU_WEST_1)
        .prefix("custom")
        .s3Client(s3Client)
        .build();

    final SerializedSnapshot snapshot = new SerializedSnapshot("products",
        "hash1", 1L, Instant.parse("2026-01-15T10:30:00Z"),
        "{}".getBytes(StandardCharsets.UTF_8));

    final Capture<PutObjectRequest> requestCapture = newCapture();
    expect(s3Client.putObject(capture(requestCapture),
        anyObject(RequestBody.class)))
        .andReturn(PutObjectResponse.builder().build());
    replay(s3Client);

    new S3SnapshotStore(config).save("products", snapshot);

    verify(s3Client);
    assertEquals("custom/products/snapshot.json",
        requestCapture.getValue().key());
  }
}
