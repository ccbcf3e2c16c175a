package com.streamfirst.registry.sync.application;

import com.streamfirst.registry.sync.domain.ReconciliationPlan;
import com.streamfirst.registry.sync.domain.ReconciliationPlan.DeleteReason;
import com.streamfirst.registry.sync.domain.ReconciliationPlan.PlannedCreate;
import com.streamfirst.registry.sync.domain.ReconciliationPlan.PlannedDelete;
import com.streamfirst.registry.sync.domain.ReconciliationPlan.PlannedUpdate;
import com.streamfirst.registry.sync.domain.TargetModelPackage;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns a resolved state into the create, update and delete operations that make the target group
 * agree with the source registry.
 *
 * <p>Packages whose artifact location is stale are replaced, not mutated: the plan creates a new
 * package for the run and deletes the superseded one, which the engine only does once the
 * replacement is registered.
 */
@Slf4j
public class ReconciliationPlanner {

  public ReconciliationPlan plan(ResolvedState state) {
    List<PlannedCreate> creates = new ArrayList<>();
    List<PlannedUpdate> updates = new ArrayList<>();
    List<PlannedDelete> deletes = new ArrayList<>();

    for (RunResolution run : state.resolutions()) {
      switch (run.match()) {
        case CONSISTENT -> {}
        case SOURCE_ONLY -> creates.add(new PlannedCreate(run.desired().orElseThrow(), Optional.empty()));
        case TARGET_ONLY -> run.actual()
            .ifPresent(p -> deletes.add(new PlannedDelete(p, DeleteReason.NOT_DEPLOYABLE)));
        case STALE -> {
          TargetModelPackage actual = run.actual().orElseThrow();
          if (run.artifactStale()) {
            creates.add(new PlannedCreate(run.desired().orElseThrow(), Optional.of(actual)));
            deletes.add(new PlannedDelete(actual, DeleteReason.SUPERSEDED));
          } else {
            updates.add(new PlannedUpdate(actual, run.desired().orElseThrow(), run.staleFields()));
          }
        }
      }
      for (TargetModelPackage duplicate : run.duplicates()) {
        deletes.add(new PlannedDelete(duplicate, DeleteReason.DUPLICATE));
      }
    }

    ReconciliationPlan plan = new ReconciliationPlan(state.modelName(), creates, updates, deletes);
    log.info("Plan for model {}: {}", state.modelName(), plan);
    return plan;
  }
}
