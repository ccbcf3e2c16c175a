package com.streamfirst.registry.sync.domain;

import java.util.Map;
import java.util.Optional;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.With;

/**
 * A version of a named model in the source registry. Versions are created upstream and only their
 * stage changes over time; this service never deletes them.
 */
@Value
@Builder(toBuilder = true)
@EqualsAndHashCode(of = {"modelName", "version"})
public class SourceModelVersion {

  /** Tag that pins the serving image, bypassing flavor based selection. */
  public static final String DEPLOY_IMAGE_TAG = "sagemaker_deploy_image";

  /** Tag that overrides the flavor read from the model manifest. */
  public static final String DEPLOY_FLAVOR_TAG = "sagemaker_deploy_flavor";

  @NonNull ModelName modelName;

  /** Version number, assigned by the source registry and increasing per model */
  long version;

  /** The training run this version was registered from */
  @NonNull RunId runId;

  @NonNull @With ModelStage stage;

  /** Where the raw artifact bundle lives, e.g. "runs:/abc/model" or "s3://bucket/path" */
  @NonNull String artifactUri;

  @Singular Map<String, String> tags;

  String description;

  public Optional<String> tag(String name) {
    return Optional.ofNullable(tags.get(name)).filter(v -> !v.isBlank());
  }

  public Optional<String> getDescription() {
    return Optional.ofNullable(description);
  }

  @Override
  public String toString() {
    return "SourceModelVersion{"
        + "model="
        + modelName
        + ", version="
        + version
        + ", runId="
        + runId
        + ", stage="
        + stage
        + '}';
  }
}
