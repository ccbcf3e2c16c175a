package com.streamfirst.registry.sync.domain;

import java.util.Map;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/** Everything the target registry needs to register a new package for a source version. */
@Value
@Builder
public class PackageDraft {
  @NonNull String groupName;
  @NonNull RunId runId;
  @NonNull ApprovalStatus approvalStatus;
  long sourceVersion;
  @NonNull ModelStage sourceStage;
  @NonNull ArtifactLocation artifactLocation;
  @NonNull String artifactSha256;
  @NonNull String imageReference;

  /** Environment variables for the serving container */
  @Singular("environmentVariable")
  Map<String, String> environment;

  @NonNull String description;

  @Singular("metadataEntry")
  Map<String, String> metadata;
}
