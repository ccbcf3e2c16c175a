package com.streamfirst.registry.sync.adapters.registry.mlflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.streamfirst.registry.sync.domain.ModelName;
import com.streamfirst.registry.sync.domain.ModelStage;
import com.streamfirst.registry.sync.domain.RunId;
import com.streamfirst.registry.sync.domain.SourceModelVersion;
import com.streamfirst.registry.sync.ports.SourceRegistryPort;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Source registry backed by the MLflow model registry REST API. */
@Slf4j
@RequiredArgsConstructor
public class MlflowRestRegistryAdapter implements SourceRegistryPort {

  static final String SEARCH_PATH = "/api/2.0/mlflow/model-versions/search";
  private static final String PAGE_SIZE = "200";

  private final MlflowRestClient client;

  @Override
  public List<SourceModelVersion> listVersions(ModelName modelName) {
    List<SourceModelVersion> versions = new ArrayList<>();
    String pageToken = null;
    do {
      Map<String, String> query = new LinkedHashMap<>();
      query.put("filter", "name='" + modelName.value().replace("'", "\\'") + "'");
      query.put("max_results", PAGE_SIZE);
      query.put("page_token", pageToken);
      JsonNode page = client.getJson(SEARCH_PATH, query);
      for (JsonNode node : page.path("model_versions")) {
        toVersion(modelName, node).ifPresent(versions::add);
      }
      pageToken = page.path("next_page_token").asText(null);
    } while (pageToken != null && !pageToken.isEmpty());

    log.debug("Found {} versions of model {}", versions.size(), modelName);
    return versions;
  }

  private Optional<SourceModelVersion> toVersion(ModelName modelName, JsonNode node) {
    String version = node.path("version").asText("");
    String runId = node.path("run_id").asText("");
    if (runId.isBlank()) {
      log.warn("Skipping version {} of model {}: it has no run ID", version, modelName);
      return Optional.empty();
    }
    ModelStage stage;
    try {
      stage = ModelStage.parse(node.path("current_stage").asText(null));
    } catch (IllegalArgumentException e) {
      log.warn("Skipping version {} of model {}: {}", version, modelName, e.getMessage());
      return Optional.empty();
    }
    long number;
    try {
      number = Long.parseLong(version);
    } catch (NumberFormatException e) {
      log.warn("Skipping version '{}' of model {}: not a number", version, modelName);
      return Optional.empty();
    }
    String source = node.path("source").asText("");
    SourceModelVersion.SourceModelVersionBuilder builder =
        SourceModelVersion.builder()
            .modelName(modelName)
            .version(number)
            .runId(RunId.of(runId))
            .stage(stage)
            .artifactUri(
                source.isBlank() ? "models:/" + modelName.value() + "/" + version : source)
            .description(node.path("description").asText(null));
    for (JsonNode tag : node.path("tags")) {
      builder.tag(tag.path("key").asText(), tag.path("value").asText(""));
    }
    return Optional.of(builder.build());
  }
}
