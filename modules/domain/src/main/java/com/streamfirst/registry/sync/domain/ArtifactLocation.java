package com.streamfirst.registry.sync.domain;

import java.util.Arrays;
import java.util.Objects;

/**
 * Location of an object in durable artifact storage.
 *
 * @param bucket the bucket (or container) name
 * @param key the object key within the bucket, without a leading slash
 */
public record ArtifactLocation(String bucket, String key) {

  /** File name of every repackaged archive. */
  public static final String ARCHIVE_NAME = "model.tar.gz";

  private static final String SCHEME = "s3://";

  public ArtifactLocation {
    Objects.requireNonNull(bucket, "Bucket cannot be null");
    Objects.requireNonNull(key, "Key cannot be null");
    if (bucket.isBlank()) {
      throw new IllegalArgumentException("Bucket cannot be empty");
    }
    key = key.replace('\\', '/');
    if (Arrays.asList(key.split("/")).contains("..")) {
      throw new IllegalArgumentException("Artifact key cannot contain a '..' segment: " + key);
    }
    while (key.startsWith("/")) {
      key = key.substring(1);
    }
    if (key.isEmpty()) {
      throw new IllegalArgumentException("Key cannot be empty");
    }
  }

  /**
   * Returns the deterministic location of the repackaged archive for a run. Repeated repackaging of
   * the same run always lands on the same key, so retries overwrite instead of duplicating.
   */
  public static ArtifactLocation forRun(String bucket, ModelName modelName, RunId runId) {
    return new ArtifactLocation(
        bucket, modelName.packageGroupName() + "/" + runId.value() + "/" + ARCHIVE_NAME);
  }

  /** Parses an {@code s3://bucket/key} URI. */
  public static ArtifactLocation parse(String uri) {
    Objects.requireNonNull(uri, "URI cannot be null");
    if (!uri.startsWith(SCHEME)) {
      throw new IllegalArgumentException("Not an s3 URI: " + uri);
    }
    String rest = uri.substring(SCHEME.length());
    int slash = rest.indexOf('/');
    if (slash <= 0 || slash == rest.length() - 1) {
      throw new IllegalArgumentException("URI must name a bucket and a key: " + uri);
    }
    return new ArtifactLocation(rest.substring(0, slash), rest.substring(slash + 1));
  }

  public String uri() {
    return SCHEME + bucket + "/" + key;
  }

  @Override
  public String toString() {
    return uri();
  }
}
