package com.streamfirst.registry.sync.domain;

import java.util.Objects;

/**
 * Name of a model in the source registry. The same name identifies the package group in the target
 * registry, rewritten into the form the target accepts.
 *
 * @param value the source registry model name (e.g., "churn_classifier")
 */
public record ModelName(String value) {
  public ModelName {
    Objects.requireNonNull(value, "Model name cannot be null");
    if (value.trim().isEmpty()) {
      throw new IllegalArgumentException("Model name cannot be empty");
    }
  }

  public static ModelName of(String value) {
    return new ModelName(value);
  }

  /**
   * Returns the package group name used in the target registry. Underscores are not allowed there,
   * so they are replaced with dashes.
   */
  public String packageGroupName() {
    return value.replace('_', '-');
  }

  @Override
  public String toString() {
    return value;
  }
}
