package com.streamfirst.registry.sync.application.packaging;

import com.streamfirst.registry.sync.domain.ArtifactLocation;
import com.streamfirst.registry.sync.domain.ModelFlavor;
import java.util.Map;

/**
 * A deployment-ready archive in durable storage.
 *
 * @param location where the archive is stored
 * @param sha256 hex encoded SHA-256 of the archive
 * @param sizeBytes archive size
 * @param flavor the flavor the archive is laid out for
 * @param image the serving image
 * @param environment environment variables the serving container needs
 * @param uploaded false when an identical archive was already stored and the upload was skipped
 */
public record RepackagedArtifact(
    ArtifactLocation location,
    String sha256,
    long sizeBytes,
    ModelFlavor flavor,
    ServingImage image,
    Map<String, String> environment,
    boolean uploaded) {

  public RepackagedArtifact {
    environment = Map.copyOf(environment);
  }
}
