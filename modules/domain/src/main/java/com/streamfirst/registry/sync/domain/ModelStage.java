package com.streamfirst.registry.sync.domain;

import java.util.Locale;

/** Lifecycle stage of a model version in the source registry. */
public enum ModelStage {
  NONE("None"),
  STAGING("Staging"),
  PRODUCTION("Production"),
  ARCHIVED("Archived");

  private final String label;

  ModelStage(String label) {
    this.label = label;
  }

  /** The stage name as the source registry spells it. */
  public String label() {
    return label;
  }

  /** True for the stages that must be mirrored into the target registry. */
  public boolean isDeployable() {
    return this == STAGING || this == PRODUCTION;
  }

  /**
   * Parses a stage name case-insensitively. A null or blank value means the version has no stage.
   *
   * @throws IllegalArgumentException if the name is not a known stage
   */
  public static ModelStage parse(String name) {
    if (name == null || name.isBlank()) {
      return NONE;
    }
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    for (ModelStage stage : values()) {
      if (stage.label.toLowerCase(Locale.ROOT).equals(normalized)) {
        return stage;
      }
    }
    throw new IllegalArgumentException("Unknown model stage: " + name);
  }

  @Override
  public String toString() {
    return label;
  }
}
