package com.streamfirst.registry.sync.adapters;

import com.streamfirst.registry.sync.domain.*;
import com.streamfirst.registry.sync.ports.SourceRegistryPort;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory implementation of SourceRegistryPort for testing and development. Versions are registered
 * and transitioned directly by the caller, the way the MLflow UI or API would.
 */
@Slf4j
public class InMemorySourceRegistryAdapter implements SourceRegistryPort {

  // Model name to version number to version
  private final Map<ModelName, Map<Long, SourceModelVersion>> models = new ConcurrentHashMap<>();
  private final AtomicInteger pendingFailures = new AtomicInteger();
  private volatile FailureKind failureKind = FailureKind.UNAVAILABLE;

  @Override
  public List<SourceModelVersion> listVersions(ModelName modelName) {
    if (pendingFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
      throw new RegistryAccessException(failureKind, "Injected " + failureKind + " failure listing " + modelName);
    }
    Map<Long, SourceModelVersion> versions = models.get(modelName);
    if (versions == null) {
      log.debug("Model {} has no versions", modelName);
      return List.of();
    }
    synchronized (versions) {
      return List.copyOf(versions.values());
    }
  }

  /** Registers a version, replacing any version with the same number. */
  public SourceModelVersion register(SourceModelVersion version) {
    Map<Long, SourceModelVersion> versions =
        models.computeIfAbsent(version.getModelName(), k -> new TreeMap<>());
    synchronized (versions) {
      versions.put(version.getVersion(), version);
    }
    log.debug("Registered {}", version);
    return version;
  }

  /**
   * Moves a version to another stage.
   *
   * @return the version after the transition
   * @throws IllegalArgumentException if the version does not exist
   */
  public SourceModelVersion transition(ModelName modelName, long version, ModelStage stage) {
    Map<Long, SourceModelVersion> versions = models.get(modelName);
    if (versions == null) {
      throw new IllegalArgumentException("Unknown model: " + modelName);
    }
    synchronized (versions) {
      SourceModelVersion current = versions.get(version);
      if (current == null) {
        throw new IllegalArgumentException("Unknown version " + version + " of " + modelName);
      }
      SourceModelVersion moved = current.withStage(stage);
      versions.put(version, moved);
      log.debug("Moved {} from {} to {}", moved, current.getStage(), stage);
      return moved;
    }
  }

  /** Makes the next {@code times} listings fail with the given kind. */
  public void failNext(FailureKind kind, int times) {
    failureKind = kind;
    pendingFailures.set(times);
  }

  /** Clears all models and pending failures. */
  public void clear() {
    models.clear();
    pendingFailures.set(0);
  }
}
