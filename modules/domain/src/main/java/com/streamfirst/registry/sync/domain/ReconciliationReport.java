package com.streamfirst.registry.sync.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Aggregate result of one reconciliation pass: an outcome per attempted operation, or a pass level
 * failure when the pass could not start (lease not obtained, state not readable).
 */
@Value
@Builder
public class ReconciliationReport {
  @NonNull String notificationId;
  @NonNull ModelName modelName;
  @NonNull Instant startedAt;
  @NonNull Instant finishedAt;

  /** Number of operations the computed plan contained */
  int plannedOperations;

  @Singular List<RunOutcome> outcomes;

  /** Failure that stopped the whole pass before any operation ran */
  SyncException passFailure;

  public Optional<SyncException> getPassFailure() {
    return Optional.ofNullable(passFailure);
  }

  public Duration duration() {
    return Duration.between(startedAt, finishedAt);
  }

  public List<RunOutcome> successes() {
    return withStatus(RunOutcome.Status.SUCCEEDED);
  }

  public List<RunOutcome> retryableFailures() {
    return withStatus(RunOutcome.Status.RETRYABLE_FAILURE);
  }

  public List<RunOutcome> fatalFailures() {
    return withStatus(RunOutcome.Status.FATAL_FAILURE);
  }

  public List<RunOutcome> skipped() {
    return withStatus(RunOutcome.Status.SKIPPED);
  }

  /** True when the pass found nothing to do, i.e. the target already matched the source. */
  public boolean isConverged() {
    return passFailure == null && plannedOperations == 0;
  }

  /** True when another pass is expected to make progress. */
  public boolean needsRetry() {
    return (passFailure != null && passFailure.isRetryable())
        || !retryableFailures().isEmpty()
        || !skipped().isEmpty();
  }

  /** True when something happened that an operator has to look at. */
  public boolean requiresAttention() {
    return (passFailure != null && !passFailure.isRetryable()) || !fatalFailures().isEmpty();
  }

  private List<RunOutcome> withStatus(RunOutcome.Status status) {
    return outcomes.stream().filter(o -> o.status() == status).toList();
  }

  @Override
  public String toString() {
    if (passFailure != null) {
      return "ReconciliationReport{model="
          + modelName
          + ", passFailure="
          + passFailure.getMessage()
          + '}';
    }
    return "ReconciliationReport{model="
        + modelName
        + ", planned="
        + plannedOperations
        + ", succeeded="
        + successes().size()
        + ", retryable="
        + retryableFailures().size()
        + ", fatal="
        + fatalFailures().size()
        + ", skipped="
        + skipped().size()
        + '}';
  }
}
