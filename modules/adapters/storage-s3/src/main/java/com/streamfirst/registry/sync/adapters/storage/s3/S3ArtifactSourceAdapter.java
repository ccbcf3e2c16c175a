package com.streamfirst.registry.sync.adapters.storage.s3;

import com.streamfirst.registry.sync.domain.ArtifactLocation;
import com.streamfirst.registry.sync.domain.FailureKind;
import com.streamfirst.registry.sync.domain.RegistryAccessException;
import com.streamfirst.registry.sync.domain.RepackagingException;
import com.streamfirst.registry.sync.domain.SourceModelVersion;
import com.streamfirst.registry.sync.domain.StorageException;
import com.streamfirst.registry.sync.ports.ArtifactSourcePort;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.S3Object;

/**
 * Downloads artifact bundles that the tracking server stored directly in S3, i.e. versions whose
 * artifact URI is an {@code s3://} prefix.
 */
@Slf4j
@RequiredArgsConstructor
public class S3ArtifactSourceAdapter implements ArtifactSourcePort {

  private final S3Client s3Client;

  @Override
  public boolean supports(String artifactUri) {
    return artifactUri != null && artifactUri.startsWith("s3://");
  }

  @Override
  public void download(SourceModelVersion version, Path targetDirectory) {
    ArtifactLocation prefix = ArtifactLocation.parse(version.getArtifactUri());
    String keyPrefix = prefix.key().endsWith("/") ? prefix.key() : prefix.key() + "/";
    int count = 0;
    try {
      ListObjectsV2Request request =
          ListObjectsV2Request.builder().bucket(prefix.bucket()).prefix(keyPrefix).build();
      for (S3Object object : s3Client.listObjectsV2Paginator(request).contents()) {
        if (object.key().endsWith("/")) {
          continue;
        }
        Path target = targetDirectory.resolve(object.key().substring(keyPrefix.length())).normalize();
        if (!target.startsWith(targetDirectory)) {
          throw new RepackagingException("Artifact key escapes the bundle directory: " + object.key());
        }
        Files.createDirectories(target.getParent());
        s3Client.getObject(
            GetObjectRequest.builder().bucket(prefix.bucket()).key(object.key()).build(), target);
        count++;
      }
    } catch (SdkException e) {
      FailureKind kind = S3Failures.classify(e);
      throw new RegistryAccessException(
          kind, "Failed to download artifact of " + version + " from " + prefix + ": " + e.getMessage(), e);
    } catch (IOException e) {
      throw new StorageException("Failed to stage artifact of " + version, e);
    }
    if (count == 0) {
      throw new RepackagingException("No artifact files found under " + version.getArtifactUri());
    }
    log.debug("Downloaded {} files of {} from {}", count, version, prefix);
  }
}
