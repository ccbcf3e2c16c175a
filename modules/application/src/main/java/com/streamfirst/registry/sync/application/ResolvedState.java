package com.streamfirst.registry.sync.application;

import com.streamfirst.registry.sync.domain.ModelName;
import com.streamfirst.registry.sync.domain.RunId;
import com.streamfirst.registry.sync.domain.TargetModelPackage;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Snapshot of both registries for one model, keyed by run ID.
 *
 * @param modelName the model
 * @param runs one resolution per run ID seen on either side, in run ID order
 * @param foreignPackages packages in the same group that belong to another model; never planned on
 */
public record ResolvedState(
    ModelName modelName, Map<RunId, RunResolution> runs, List<TargetModelPackage> foreignPackages) {

  public ResolvedState {
    runs = Collections.unmodifiableMap(new LinkedHashMap<>(runs));
    foreignPackages = List.copyOf(foreignPackages);
  }

  public Collection<RunResolution> resolutions() {
    return runs.values();
  }

  /** Run IDs with a deployable source version. */
  public Set<RunId> desiredRunIds() {
    return runs.values().stream()
        .filter(r -> r.desired().isPresent())
        .map(RunResolution::runId)
        .collect(Collectors.toUnmodifiableSet());
  }

  /** Every package of this model currently in the group, duplicates included. */
  public List<TargetModelPackage> actualPackages() {
    return runs.values().stream()
        .flatMap(r -> Stream.concat(r.actual().stream(), r.duplicates().stream()))
        .toList();
  }
}
