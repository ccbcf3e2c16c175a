package com.streamfirst.registry.sync.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of one operation on one run ID within a reconciliation pass.
 *
 * @param runId the run the operation applied to
 * @param operation what was attempted
 * @param status how it ended
 * @param packageArn the package created, updated or deleted, when known
 * @param message human readable detail
 * @param errorCode the failure code, for failed operations
 */
public record RunOutcome(
    RunId runId,
    Operation operation,
    Status status,
    Optional<String> packageArn,
    String message,
    Optional<String> errorCode) {

  public enum Operation {
    CREATE,
    UPDATE,
    DELETE
  }

  public enum Status {
    SUCCEEDED,
    /** Failed with a transient cause; the next pass retries it */
    RETRYABLE_FAILURE,
    /** Failed for a reason retrying cannot fix; needs an operator */
    FATAL_FAILURE,
    /** Not attempted because an operation it depends on failed */
    SKIPPED
  }

  public RunOutcome {
    Objects.requireNonNull(runId, "Run ID cannot be null");
    Objects.requireNonNull(operation, "Operation cannot be null");
    Objects.requireNonNull(status, "Status cannot be null");
    Objects.requireNonNull(packageArn, "Package ARN cannot be null");
    Objects.requireNonNull(message, "Message cannot be null");
    Objects.requireNonNull(errorCode, "Error code cannot be null");
  }

  public static RunOutcome succeeded(
      RunId runId, Operation operation, String packageArn, String message) {
    return new RunOutcome(
        runId, operation, Status.SUCCEEDED, Optional.ofNullable(packageArn), message, Optional.empty());
  }

  public static RunOutcome failed(
      RunId runId, Operation operation, String packageArn, SyncException failure) {
    return new RunOutcome(
        runId,
        operation,
        failure.isRetryable() ? Status.RETRYABLE_FAILURE : Status.FATAL_FAILURE,
        Optional.ofNullable(packageArn),
        failure.getMessage(),
        Optional.ofNullable(failure.errorCode()));
  }

  public static RunOutcome skipped(
      RunId runId, Operation operation, String packageArn, String message) {
    return new RunOutcome(
        runId, operation, Status.SKIPPED, Optional.ofNullable(packageArn), message, Optional.empty());
  }

  public boolean isSuccess() {
    return status == Status.SUCCEEDED;
  }
}
