package com.streamfirst.registry.sync.domain;

import static org.assertj.core.api.Assertions.assertThat;

import com.streamfirst.registry.sync.domain.ReconciliationPlan.DeleteReason;
import com.streamfirst.registry.sync.domain.ReconciliationPlan.PlannedDelete;
import com.streamfirst.registry.sync.domain.ReconciliationPlan.PlannedUpdate;
import com.streamfirst.registry.sync.domain.ReconciliationPlan.StaleField;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ReconciliationPlanTest {

  private static final ModelName MODEL = ModelName.of("churn_classifier");

  private static TargetModelPackage pkg(String runId) {
    return TargetModelPackage.builder()
        .packageArn("arn:" + runId)
        .groupName(MODEL.packageGroupName())
        .runId(RunId.of(runId))
        .approvalStatus(ApprovalStatus.APPROVED)
        .sourceVersion(1)
        .sourceStage(ModelStage.STAGING)
        .artifactLocation(ArtifactLocation.forRun("bucket", MODEL, RunId.of(runId)))
        .imageReference("image")
        .createdAt(Instant.EPOCH)
        .build();
  }

  @Test
  void counts_operations() {
    SourceModelVersion version =
        SourceModelVersion.builder()
            .modelName(MODEL)
            .version(1)
            .runId(RunId.of("a"))
            .stage(ModelStage.PRODUCTION)
            .artifactUri("runs:/a/model")
            .build();
    ReconciliationPlan plan =
        new ReconciliationPlan(
            MODEL,
            List.of(),
            List.of(new PlannedUpdate(pkg("a"), version, Set.of(StaleField.SOURCE_STAGE))),
            List.of(new PlannedDelete(pkg("b"), DeleteReason.NOT_DEPLOYABLE)));

    assertThat(plan.isEmpty()).isFalse();
    assertThat(plan.operationCount()).isEqualTo(2);
    assertThat(plan.updates().get(0).desiredApproval()).isEqualTo(ApprovalStatus.APPROVED);
    assertThat(plan.toString()).isEqualTo("0 packages to create, 1 packages to update, 1 packages to delete");
  }

  @Test
  void only_superseded_deletes_wait_for_replacement() {
    assertThat(new PlannedDelete(pkg("a"), DeleteReason.SUPERSEDED).requiresReplacement()).isTrue();
    assertThat(new PlannedDelete(pkg("a"), DeleteReason.DUPLICATE).requiresReplacement()).isFalse();
    assertThat(ReconciliationPlan.empty(MODEL).isEmpty()).isTrue();
  }
}
