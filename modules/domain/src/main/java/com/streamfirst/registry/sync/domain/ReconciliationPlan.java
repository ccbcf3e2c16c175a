package com.streamfirst.registry.sync.domain;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The operations needed to bring one model's package group in line with the source registry. The
 * three lists are disjoint by operation: a run ID appears in at most one create and one update, and
 * a package appears in at most one delete. Plans are computed fresh for every pass and never reused.
 */
public record ReconciliationPlan(
    ModelName modelName,
    List<PlannedCreate> creates,
    List<PlannedUpdate> updates,
    List<PlannedDelete> deletes) {

  public ReconciliationPlan {
    Objects.requireNonNull(modelName, "Model name cannot be null");
    creates = List.copyOf(creates);
    updates = List.copyOf(updates);
    deletes = List.copyOf(deletes);
  }

  public static ReconciliationPlan empty(ModelName modelName) {
    return new ReconciliationPlan(modelName, List.of(), List.of(), List.of());
  }

  public boolean isEmpty() {
    return creates.isEmpty() && updates.isEmpty() && deletes.isEmpty();
  }

  public int operationCount() {
    return creates.size() + updates.size() + deletes.size();
  }

  @Override
  public String toString() {
    return String.format(
        "%d packages to create, %d packages to update, %d packages to delete",
        creates.size(), updates.size(), deletes.size());
  }

  /**
   * A source version that needs a new package.
   *
   * @param version the source version to mirror
   * @param replacing the package being superseded because its artifact is stale, if any
   */
  public record PlannedCreate(SourceModelVersion version, Optional<TargetModelPackage> replacing) {
    public PlannedCreate {
      Objects.requireNonNull(version, "Version cannot be null");
      Objects.requireNonNull(replacing, "Replacing cannot be null");
    }

    public RunId runId() {
      return version.getRunId();
    }
  }

  /** Why an existing package no longer matches its source version. */
  public enum StaleField {
    APPROVAL_STATUS,
    SOURCE_STAGE
  }

  /**
   * An existing package whose approval or recorded stage must be refreshed in place.
   *
   * @param target the package to update
   * @param version the current source version for the same run
   * @param staleFields which fields disagree
   */
  public record PlannedUpdate(
      TargetModelPackage target, SourceModelVersion version, Set<StaleField> staleFields) {
    public PlannedUpdate {
      Objects.requireNonNull(target, "Target cannot be null");
      Objects.requireNonNull(version, "Version cannot be null");
      staleFields = staleFields.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(staleFields));
    }

    public RunId runId() {
      return target.getRunId();
    }

    public ApprovalStatus desiredApproval() {
      return ApprovalStatus.forStage(version.getStage());
    }
  }

  /** Why a package is being removed. */
  public enum DeleteReason {
    /** No source version for the run is in a deployable stage any more */
    NOT_DEPLOYABLE,
    /** Another package for the same run is kept */
    DUPLICATE,
    /** A replacement package with a fresh artifact is created in the same pass */
    SUPERSEDED
  }

  /**
   * A package to deregister.
   *
   * @param target the package to delete
   * @param reason why it goes
   */
  public record PlannedDelete(TargetModelPackage target, DeleteReason reason) {
    public PlannedDelete {
      Objects.requireNonNull(target, "Target cannot be null");
      Objects.requireNonNull(reason, "Reason cannot be null");
    }

    public RunId runId() {
      return target.getRunId();
    }

    /** Superseded packages may only go once their replacement is registered. */
    public boolean requiresReplacement() {
      return reason == DeleteReason.SUPERSEDED;
    }
  }
}
