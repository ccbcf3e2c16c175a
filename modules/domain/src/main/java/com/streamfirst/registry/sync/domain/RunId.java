package com.streamfirst.registry.sync.domain;

import java.util.Objects;

/**
 * Identifier of the training run that produced a model version. This is the only key used to match
 * source versions with target packages; version numbers are assigned independently by each registry
 * and carry no cross-system meaning.
 *
 * @param value the opaque run identifier
 */
public record RunId(String value) {
  public RunId {
    Objects.requireNonNull(value, "Run ID cannot be null");
    if (value.trim().isEmpty()) {
      throw new IllegalArgumentException("Run ID cannot be empty");
    }
  }

  public static RunId of(String value) {
    return new RunId(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
