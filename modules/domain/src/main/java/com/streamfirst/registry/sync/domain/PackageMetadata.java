package com.streamfirst.registry.sync.domain;

import java.util.LinkedHashMap;
import java.util.Map;

/** Keys of the customer metadata written on every package this service creates. */
public final class PackageMetadata {

  public static final String RUN_ID = "mlflow_run_id";
  public static final String MODEL_NAME = "mlflow_name";
  public static final String VERSION = "mlflow_version";
  public static final String CURRENT_STAGE = "mlflow_current_stage";
  public static final String SOURCE = "mlflow_source";
  public static final String ARTIFACT_SHA256 = "artifact_sha256";
  public static final String FLAVOR = "mlflow_flavor";

  private PackageMetadata() {}

  /** Builds the metadata describing a source version and the archive created for it. */
  public static Map<String, String> describe(
      SourceModelVersion version, String artifactSha256, String flavor) {
    Map<String, String> metadata = new LinkedHashMap<>();
    metadata.put(RUN_ID, version.getRunId().value());
    metadata.put(MODEL_NAME, version.getModelName().value());
    metadata.put(VERSION, Long.toString(version.getVersion()));
    metadata.put(CURRENT_STAGE, version.getStage().label());
    metadata.put(SOURCE, version.getArtifactUri());
    if (artifactSha256 != null && !artifactSha256.isBlank()) {
      metadata.put(ARTIFACT_SHA256, artifactSha256);
    }
    if (flavor != null) {
      metadata.put(FLAVOR, flavor);
    }
    return metadata;
  }

  /** Returns a copy of existing metadata with the stage entry refreshed. */
  public static Map<String, String> withStage(Map<String, String> existing, ModelStage stage) {
    Map<String, String> metadata = new LinkedHashMap<>(existing);
    metadata.put(CURRENT_STAGE, stage.label());
    return metadata;
  }
}
