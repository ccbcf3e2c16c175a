package com.streamfirst.registry.sync.domain;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Serving flavor of a model, chosen from the flavors its manifest declares. The flavor decides which
 * container image serves the model and where the model files go inside the archive.
 *
 * @param name the flavor name as written in the manifest (e.g., "sklearn", "tensorflow")
 */
public record ModelFlavor(String name) {

  public static final ModelFlavor PYTHON_FUNCTION = new ModelFlavor("python_function");

  private static final Map<String, String> SOURCE_DATA_PATHS =
      Map.of(
          "tensorflow", "tfmodel",
          "xgboost", ".",
          "python_function", ".",
          "sklearn", ".");

  private static final String DEFAULT_SOURCE_DATA_PATH = "data/model";

  private static final Map<String, String> ARCHIVE_DATA_PATHS =
      Map.of(
          "tensorflow", "model/1",
          "keras", "model/1");

  private static final Set<String> SCRIPT_MODE_FLAVORS = Set.of("sklearn", "xgboost");

  public ModelFlavor {
    Objects.requireNonNull(name, "Flavor name cannot be null");
    name = name.trim().toLowerCase(Locale.ROOT);
    if (name.isEmpty()) {
      throw new IllegalArgumentException("Flavor name cannot be empty");
    }
  }

  public static ModelFlavor of(String name) {
    return new ModelFlavor(name);
  }

  /**
   * Picks the serving flavor from a manifest's flavor list: the first flavor that is not the generic
   * python_function wrapper, or python_function when it is the only one declared.
   */
  public static Optional<ModelFlavor> select(Collection<String> declaredFlavors) {
    Optional<ModelFlavor> specific =
        declaredFlavors.stream()
            .filter(f -> f != null && !f.isBlank())
            .filter(f -> !PYTHON_FUNCTION.name().equalsIgnoreCase(f))
            .findFirst()
            .map(ModelFlavor::of);
    if (specific.isPresent()) {
      return specific;
    }
    return declaredFlavors.stream()
        .filter(f -> f != null && !f.isBlank())
        .findFirst()
        .map(ModelFlavor::of);
  }

  /** Sub-directory of the raw artifact bundle holding the serialized model. */
  public String sourceDataPath() {
    return SOURCE_DATA_PATHS.getOrDefault(name, DEFAULT_SOURCE_DATA_PATH);
  }

  /** Directory inside the archive where the serialized model goes; empty means the archive root. */
  public String archiveDataPath() {
    return ARCHIVE_DATA_PATHS.getOrDefault(name, "");
  }

  /** The framework whose serving image runs this flavor. Keras models run on TensorFlow. */
  public String servingFramework() {
    return "keras".equals(name) ? "tensorflow" : name;
  }

  /** Whether the serving container loads a user inference script from the archive. */
  public boolean usesInferenceScript() {
    return SCRIPT_MODE_FLAVORS.contains(name);
  }

  @Override
  public String toString() {
    return name;
  }
}
