package com.streamfirst.registry.sync.adapters.storage.s3;

import com.streamfirst.registry.sync.domain.ArtifactLocation;
import com.streamfirst.registry.sync.domain.FailureKind;
import com.streamfirst.registry.sync.domain.StorageException;
import com.streamfirst.registry.sync.ports.ArtifactStorePort;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/**
 * Stores repackaged archives in S3. The archive hash travels as user metadata so that a later stat
 * can tell whether the stored object already has the expected content.
 */
@Slf4j
@RequiredArgsConstructor
public class S3ArtifactStoreAdapter implements ArtifactStorePort {

  /** User metadata key holding the hex SHA-256 of the object */
  static final String SHA256_METADATA = "artifact-sha256";

  private static final String CONTENT_TYPE = "application/gzip";

  private final S3Client s3Client;

  @Override
  public void put(ArtifactLocation location, Path file, String sha256) {
    PutObjectRequest request =
        PutObjectRequest.builder()
            .bucket(location.bucket())
            .key(location.key())
            .contentType(CONTENT_TYPE)
            .metadata(Map.of(SHA256_METADATA, sha256))
            .build();
    try {
      s3Client.putObject(request, RequestBody.fromFile(file));
      log.debug("Uploaded {} to {}", file, location);
    } catch (SdkException e) {
      throw failure("Failed to upload archive to " + location, e);
    }
  }

  @Override
  public Optional<StoredObject> stat(ArtifactLocation location) {
    try {
      HeadObjectResponse head =
          s3Client.headObject(
              HeadObjectRequest.builder().bucket(location.bucket()).key(location.key()).build());
      return Optional.of(
          new StoredObject(
              location,
              head.contentLength() == null ? 0L : head.contentLength(),
              Optional.ofNullable(head.metadata().get(SHA256_METADATA))));
    } catch (NoSuchKeyException e) {
      return Optional.empty();
    } catch (SdkException e) {
      if (S3Failures.classify(e) == FailureKind.NOT_FOUND) {
        // HEAD responses carry no error body, so a missing key surfaces as a bare 404
        return Optional.empty();
      }
      throw failure("Failed to describe " + location, e);
    }
  }

  @Override
  public boolean delete(ArtifactLocation location) {
    if (stat(location).isEmpty()) {
      return false;
    }
    try {
      s3Client.deleteObject(
          DeleteObjectRequest.builder().bucket(location.bucket()).key(location.key()).build());
      log.debug("Deleted {}", location);
      return true;
    } catch (SdkException e) {
      throw failure("Failed to delete " + location, e);
    }
  }

  private static StorageException failure(String message, SdkException e) {
    FailureKind kind = S3Failures.classify(e);
    log.warn("{} ({}): {}", message, kind, e.getMessage());
    return new StorageException(message + ": " + e.getMessage(), kind.isRetryable(), e);
  }
}
