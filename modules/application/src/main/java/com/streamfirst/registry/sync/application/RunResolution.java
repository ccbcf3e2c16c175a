package com.streamfirst.registry.sync.application;

import com.streamfirst.registry.sync.domain.ReconciliationPlan.StaleField;
import com.streamfirst.registry.sync.domain.RunId;
import com.streamfirst.registry.sync.domain.SourceModelVersion;
import com.streamfirst.registry.sync.domain.TargetModelPackage;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * How one run ID looks on both sides of the sync.
 *
 * @param runId the join key
 * @param desired the deployable source version for the run, if any
 * @param actual the target package kept for the run, if any
 * @param duplicates further packages for the same run that must go
 * @param match the classification of the pair
 * @param staleFields metadata fields that disagree, for {@link Match#STALE} pairs
 * @param artifactStale whether the package points somewhere other than the run's archive location
 */
public record RunResolution(
    RunId runId,
    Optional<SourceModelVersion> desired,
    Optional<TargetModelPackage> actual,
    List<TargetModelPackage> duplicates,
    Match match,
    Set<StaleField> staleFields,
    boolean artifactStale) {

  public enum Match {
    /** Both sides present and in agreement; nothing to do */
    CONSISTENT,
    /** Both sides present but the package disagrees with the source */
    STALE,
    /** Only the source has a deployable version; a package must be created */
    SOURCE_ONLY,
    /** Only the target has a package; it must be deleted */
    TARGET_ONLY
  }

  public RunResolution {
    Objects.requireNonNull(runId, "Run ID cannot be null");
    Objects.requireNonNull(match, "Match cannot be null");
    duplicates = List.copyOf(duplicates);
    staleFields = Set.copyOf(staleFields);
  }
}
