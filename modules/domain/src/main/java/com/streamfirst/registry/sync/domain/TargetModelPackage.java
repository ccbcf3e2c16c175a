package com.streamfirst.registry.sync.domain;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.With;

/**
 * A package in the target registry's package group. The run ID is copied from the source version at
 * creation time and is the join key back to the source registry.
 */
@Value
@Builder(toBuilder = true)
@EqualsAndHashCode(of = "packageArn")
public class TargetModelPackage {

  /** Opaque handle assigned by the target registry */
  @NonNull String packageArn;

  @NonNull String groupName;

  @NonNull RunId runId;

  @NonNull @With ApprovalStatus approvalStatus;

  /** Source version number recorded at creation */
  long sourceVersion;

  /** Source stage recorded the last time this package was written */
  @NonNull @With ModelStage sourceStage;

  @NonNull ArtifactLocation artifactLocation;

  @NonNull String imageReference;

  String artifactSha256;

  @NonNull Instant createdAt;

  @Singular("metadataEntry")
  @With
  Map<String, String> metadata;

  public Optional<String> getArtifactSha256() {
    return Optional.ofNullable(artifactSha256);
  }

  @Override
  public String toString() {
    return "TargetModelPackage{"
        + "arn="
        + packageArn
        + ", runId="
        + runId
        + ", approval="
        + approvalStatus
        + ", stage="
        + sourceStage
        + ", artifact="
        + artifactLocation
        + '}';
  }
}
