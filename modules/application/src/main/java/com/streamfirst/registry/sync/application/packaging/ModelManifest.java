package com.streamfirst.registry.sync.application.packaging;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.streamfirst.registry.sync.domain.RepackagingException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * The {@code MLmodel} manifest at the root of every source artifact bundle. Only the parts needed for
 * repackaging are read: the declared flavors, in declaration order, and their framework versions.
 *
 * @param path where the manifest was read from
 * @param flavors declared flavor names, in file order
 * @param mlflowVersion the MLflow version that wrote the model, if recorded
 * @param root the parsed document
 */
public record ModelManifest(Path path, List<String> flavors, Optional<String> mlflowVersion, JsonNode root) {

  public static final String FILE_NAME = "MLmodel";

  private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

  public ModelManifest {
    flavors = List.copyOf(flavors);
  }

  /**
   * Reads the manifest from an artifact bundle directory.
   *
   * @throws RepackagingException if the manifest is missing, unreadable or declares no flavor
   */
  public static ModelManifest read(Path bundleDirectory) {
    Path path = bundleDirectory.resolve(FILE_NAME);
    if (!Files.isRegularFile(path)) {
      throw new RepackagingException("Artifact bundle has no " + FILE_NAME + " manifest");
    }

    JsonNode root;
    try {
      root = YAML.readTree(path.toFile());
    } catch (IOException e) {
      throw new RepackagingException("Cannot parse " + FILE_NAME + " manifest: " + e.getMessage(), e);
    }
    if (root == null || !root.isObject()) {
      throw new RepackagingException(FILE_NAME + " manifest is not a mapping");
    }

    JsonNode flavorsNode = root.path("flavors");
    List<String> flavors = new ArrayList<>();
    for (Iterator<String> it = flavorsNode.fieldNames(); it.hasNext(); ) {
      flavors.add(it.next());
    }
    if (flavors.isEmpty()) {
      throw new RepackagingException(FILE_NAME + " manifest declares no flavors");
    }

    JsonNode version = root.path("mlflow_version");
    return new ModelManifest(
        path, flavors, version.isTextual() ? Optional.of(version.asText()) : Optional.empty(), root);
  }

  public boolean declares(String flavor) {
    return flavors.contains(flavor);
  }

  /**
   * Returns the framework version recorded for a flavor, e.g. {@code sklearn_version}. XGBoost records
   * its version under {@code xgb_version}.
   */
  public Optional<String> frameworkVersion(String flavor) {
    String key = ("xgboost".equals(flavor) ? "xgb" : flavor) + "_version";
    JsonNode node = root.path("flavors").path(flavor).path(key);
    return node.isMissingNode() || node.isNull() ? Optional.empty() : Optional.of(node.asText());
  }
}
