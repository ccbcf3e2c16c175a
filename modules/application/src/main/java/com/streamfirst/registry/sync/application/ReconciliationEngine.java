package com.streamfirst.registry.sync.application;

import com.streamfirst.registry.sync.application.packaging.ArtifactRepackager;
import com.streamfirst.registry.sync.application.packaging.RepackagedArtifact;
import com.streamfirst.registry.sync.domain.*;
import com.streamfirst.registry.sync.domain.ReconciliationPlan.PlannedCreate;
import com.streamfirst.registry.sync.domain.ReconciliationPlan.PlannedDelete;
import com.streamfirst.registry.sync.domain.ReconciliationPlan.PlannedUpdate;
import com.streamfirst.registry.sync.domain.RunOutcome.Operation;
import com.streamfirst.registry.sync.ports.ArtifactStorePort;
import com.streamfirst.registry.sync.ports.LeasePort;
import com.streamfirst.registry.sync.ports.TargetRegistryPort;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Brings one model's package group in line with the source registry's current stage assignments.
 *
 * <p>Each pass runs under an exclusive lease on the model's package group and recomputes the diff from fresh
 * reads, so a pass that follows a partial failure simply picks up what is still missing. Creates and
 * updates run first, in parallel across run IDs; deletes start only once every create and update has
 * finished, and an archive is removed from storage only after the last package referencing it is
 * deregistered. A failure on one run ID never stops work on the others.
 */
@Slf4j
public class ReconciliationEngine implements AutoCloseable {

  private final IdentityResolver identityResolver;
  private final ReconciliationPlanner planner;
  private final ArtifactRepackager repackager;
  private final TargetRegistryPort targetRegistry;
  private final ArtifactStorePort artifactStore;
  private final LeasePort leasePort;
  private final SyncSettings settings;
  private final RetryConfig retryConfig;
  private final ExecutorService workers;
  private final ExecutorService repackagingPool;

  public ReconciliationEngine(
      IdentityResolver identityResolver,
      ReconciliationPlanner planner,
      ArtifactRepackager repackager,
      TargetRegistryPort targetRegistry,
      ArtifactStorePort artifactStore,
      LeasePort leasePort,
      SyncSettings settings) {
    this.identityResolver = identityResolver;
    this.planner = planner;
    this.repackager = repackager;
    this.targetRegistry = targetRegistry;
    this.artifactStore = artifactStore;
    this.leasePort = leasePort;
    this.settings = settings;
    this.retryConfig =
        RetryConfig.custom()
            .maxAttempts(Math.max(1, settings.getRetryMaxAttempts()))
            .waitDuration(settings.getRetryWait())
            .retryOnException(e -> e instanceof SyncException s && s.isRetryable())
            .build();
    this.workers = Executors.newFixedThreadPool(settings.getWorkerThreads(), namedThreads("sync-worker"));
    this.repackagingPool =
        Executors.newFixedThreadPool(settings.getWorkerThreads(), namedThreads("sync-repackager"));
  }

  /**
   * Runs one reconciliation pass for the model named by a notification. The notification is only a
   * trigger; its version and stage are not used.
   *
   * @param notification the trigger
   * @return the outcome of every attempted operation, or the pass level failure
   */
  public ReconciliationReport reconcile(StageTransitionNotification notification) {
    ModelName modelName = notification.getModelName();
    Instant startedAt = Instant.now();
    ReconciliationReport.ReconciliationReportBuilder report =
        ReconciliationReport.builder()
            .notificationId(notification.getNotificationId())
            .modelName(modelName)
            .startedAt(startedAt);

    // Models whose names map to the same package group share one lease
    ModelName leaseKey = ModelName.of(modelName.packageGroupName());
    Optional<LeasePort.Lease> lease =
        leasePort.tryAcquire(
            leaseKey, settings.getHolderId(), settings.getLeaseTtl(), settings.getLeaseWait());
    if (lease.isEmpty()) {
      log.warn("Could not obtain lease for model {} within {}", modelName, settings.getLeaseWait());
      return report
          .passFailure(new LeaseUnavailableException(modelName))
          .finishedAt(Instant.now())
          .build();
    }

    try {
      log.info("Starting reconciliation of model {} for {}", modelName, notification);
      ResolvedState state = identityResolver.resolve(modelName);
      ReconciliationPlan plan = planner.plan(state);
      report.plannedOperations(plan.operationCount());
      if (plan.isEmpty()) {
        log.info("Model {} is already in sync", modelName);
        return report.finishedAt(Instant.now()).build();
      }

      List<RunOutcome> outcomes = execute(plan, state, lease.get());
      ReconciliationReport result = report.outcomes(outcomes).finishedAt(Instant.now()).build();
      log.info("Finished reconciliation of model {}: {}", modelName, result);
      return result;
    } catch (ResolutionException e) {
      log.warn("Could not resolve state of model {}: {}", modelName, e.getMessage());
      return report.passFailure(e).finishedAt(Instant.now()).build();
    } catch (RuntimeException e) {
      log.error("Reconciliation of model {} failed unexpectedly", modelName, e);
      return report
          .passFailure(new ResolutionException("Reconciliation of " + modelName + " failed: " + e.getMessage(), e))
          .finishedAt(Instant.now())
          .build();
    } finally {
      release(lease.get());
    }
  }

  private void release(LeasePort.Lease lease) {
    try {
      leasePort.release(lease);
    } catch (RuntimeException e) {
      // The lease expires on its own after its TTL
      log.warn("Failed to release lease {} on model {}", lease.leaseId(), lease.modelName(), e);
    }
  }

  private List<RunOutcome> execute(ReconciliationPlan plan, ResolvedState state, LeasePort.Lease lease) {
    List<RunOutcome> outcomes = new ArrayList<>();

    // Creates and updates, in parallel across run IDs
    Optional<SyncException> groupFailure = plan.creates().isEmpty() ? Optional.empty() : ensureGroup(plan.modelName());
    List<CompletableFuture<RunOutcome>> pending = new ArrayList<>();
    for (PlannedCreate create : plan.creates()) {
      if (groupFailure.isPresent()) {
        outcomes.add(RunOutcome.failed(create.runId(), Operation.CREATE, null, groupFailure.get()));
      } else {
        pending.add(CompletableFuture.supplyAsync(() -> renewAfter(create(create), lease), workers));
      }
    }
    for (PlannedUpdate update : plan.updates()) {
      pending.add(CompletableFuture.supplyAsync(() -> renewAfter(update(update), lease), workers));
    }
    CompletableFuture.allOf(pending.toArray(CompletableFuture[]::new)).join();
    pending.forEach(f -> outcomes.add(f.join()));

    // Deletes only once every create and update above has completed
    if (!plan.deletes().isEmpty()) {
      if (!leasePort.renew(lease, settings.getLeaseTtl())) {
        log.warn("Lease on model {} was lost, skipping {} deletes", plan.modelName(), plan.deletes().size());
        plan.deletes()
            .forEach(
                d ->
                    outcomes.add(
                        RunOutcome.skipped(
                            d.runId(), Operation.DELETE, d.target().getPackageArn(), "Lease lost before delete")));
        return outcomes;
      }
      outcomes.addAll(deleteAll(plan, state, outcomes));
    }
    return outcomes;
  }

  /** Extends the lease once an operation finishes, so a long create phase cannot outlive it. */
  private RunOutcome renewAfter(RunOutcome outcome, LeasePort.Lease lease) {
    try {
      if (!leasePort.renew(lease, settings.getLeaseTtl())) {
        log.warn("Lease {} on {} could not be renewed after {}", lease.leaseId(), lease.modelName(), outcome);
      }
    } catch (RuntimeException e) {
      log.warn("Failed to renew lease {} on {}", lease.leaseId(), lease.modelName(), e);
    }
    return outcome;
  }

  private Optional<SyncException> ensureGroup(ModelName modelName) {
    String groupName = modelName.packageGroupName();
    try {
      withRetry("ensure-group", () -> {
        targetRegistry.ensurePackageGroup(groupName);
        return groupName;
      });
      return Optional.empty();
    } catch (SyncException e) {
      log.error("Cannot ensure package group {} exists", groupName, e);
      return Optional.of(RegistrationException.from("Cannot create package group " + groupName, e));
    } catch (RuntimeException e) {
      log.error("Cannot ensure package group {} exists", groupName, e);
      return Optional.of(new RegistrationException("Cannot create package group " + groupName, true, e));
    }
  }

  private RunOutcome create(PlannedCreate create) {
    SourceModelVersion version = create.version();
    RepackagedArtifact artifact;
    try {
      artifact = withRetry("repackage", () -> repackageWithTimeout(version));
    } catch (SyncException e) {
      return failed(create.runId(), Operation.CREATE, null, e, "Repackaging failed for " + version);
    } catch (RuntimeException e) {
      return failed(
          create.runId(),
          Operation.CREATE,
          null,
          new RepackagingException("Unexpected repackaging failure: " + e.getMessage(), e),
          "Repackaging failed for " + version);
    }

    PackageDraft draft =
        PackageDraft.builder()
            .groupName(version.getModelName().packageGroupName())
            .runId(version.getRunId())
            .approvalStatus(ApprovalStatus.forStage(version.getStage()))
            .sourceVersion(version.getVersion())
            .sourceStage(version.getStage())
            .artifactLocation(artifact.location())
            .artifactSha256(artifact.sha256())
            .imageReference(artifact.image().imageReference())
            .environment(artifact.environment())
            .description("mlflow " + version.getModelName() + "-v" + version.getVersion())
            .metadata(PackageMetadata.describe(version, artifact.sha256(), artifact.flavor().name()))
            .build();
    try {
      TargetModelPackage created = withRetry("create-package", () -> targetRegistry.createPackage(draft));
      log.info("Registered package {} for {}", created.getPackageArn(), version);
      return RunOutcome.succeeded(
          create.runId(),
          Operation.CREATE,
          created.getPackageArn(),
          create.replacing().isPresent()
              ? "Registered replacement of " + create.replacing().get().getPackageArn()
              : "Registered version " + version.getVersion() + " as " + version.getStage());
    } catch (SyncException e) {
      return failed(
          create.runId(), Operation.CREATE, null, RegistrationException.from("Cannot register package", e), "Registration failed for " + version);
    } catch (RuntimeException e) {
      return failed(
          create.runId(), Operation.CREATE, null, new RegistrationException("Cannot register package", true, e), "Registration failed for " + version);
    }
  }

  private RepackagedArtifact repackageWithTimeout(SourceModelVersion version) {
    Future<RepackagedArtifact> task = repackagingPool.submit(() -> repackager.repackage(version));
    try {
      return task.get(settings.getRepackagingTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      task.cancel(true);
      throw new StorageException(
          "Repackaging of " + version + " timed out after " + settings.getRepackagingTimeout(), e);
    } catch (InterruptedException e) {
      task.cancel(true);
      Thread.currentThread().interrupt();
      throw new StorageException("Interrupted while repackaging " + version, e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new StorageException("Repackaging of " + version + " failed", cause);
    }
  }

  private RunOutcome update(PlannedUpdate update) {
    TargetModelPackage target = update.target();
    ApprovalStatus approval = update.desiredApproval();
    Map<String, String> metadata = PackageMetadata.withStage(target.getMetadata(), update.version().getStage());
    try {
      withRetry("update-approval", () -> targetRegistry.updateApproval(target, approval, metadata));
      log.info(
          "Updated package {} to {} (stage {}, stale {})",
          target.getPackageArn(),
          approval,
          update.version().getStage(),
          update.staleFields());
      return RunOutcome.succeeded(
          update.runId(),
          Operation.UPDATE,
          target.getPackageArn(),
          "Updated to " + approval + " for stage " + update.version().getStage());
    } catch (SyncException e) {
      return failed(
          update.runId(), Operation.UPDATE, target.getPackageArn(), RegistrationException.from("Cannot update package", e), "Update failed for " + target.getPackageArn());
    } catch (RuntimeException e) {
      return failed(
          update.runId(), Operation.UPDATE, target.getPackageArn(), new RegistrationException("Cannot update package", true, e), "Update failed for " + target.getPackageArn());
    }
  }

  private List<RunOutcome> deleteAll(
      ReconciliationPlan plan, ResolvedState state, List<RunOutcome> createAndUpdateOutcomes) {
    Set<RunId> registered = new HashSet<>();
    Set<ArtifactLocation> referenced = new HashSet<>();
    for (RunOutcome outcome : createAndUpdateOutcomes) {
      if (outcome.operation() == Operation.CREATE && outcome.isSuccess()) {
        registered.add(outcome.runId());
        referenced.add(ArtifactLocation.forRun(settings.getArtifactBucket(), plan.modelName(), outcome.runId()));
      }
    }
    Set<String> deletedArns = new HashSet<>();
    List<RunOutcome> outcomes = new ArrayList<>();
    List<PlannedDelete> confirmed = new ArrayList<>();

    for (PlannedDelete delete : plan.deletes()) {
      TargetModelPackage target = delete.target();
      if (delete.requiresReplacement() && !registered.contains(delete.runId())) {
        log.warn("Keeping package {} because its replacement was not registered", target.getPackageArn());
        outcomes.add(
            RunOutcome.skipped(
                delete.runId(), Operation.DELETE, target.getPackageArn(), "Replacement package was not registered"));
        continue;
      }
      RunOutcome outcome = delete(delete);
      outcomes.add(outcome);
      if (outcome.isSuccess()) {
        deletedArns.add(target.getPackageArn());
        confirmed.add(delete);
      }
    }

    if (settings.isPruneArtifacts()) {
      for (TargetModelPackage survivor : state.actualPackages()) {
        if (!deletedArns.contains(survivor.getPackageArn())) {
          referenced.add(survivor.getArtifactLocation());
        }
      }
      state.foreignPackages().forEach(p -> referenced.add(p.getArtifactLocation()));
      Set<ArtifactLocation> pruned = new HashSet<>();
      for (PlannedDelete delete : confirmed) {
        ArtifactLocation location = delete.target().getArtifactLocation();
        if (!referenced.contains(location) && pruned.add(location)) {
          pruneArtifact(location);
        }
      }
    }
    return outcomes;
  }

  private RunOutcome delete(PlannedDelete delete) {
    TargetModelPackage target = delete.target();
    try {
      withRetry("delete-package", () -> {
        targetRegistry.deletePackage(target);
        return target;
      });
      log.info("Deleted package {} ({})", target.getPackageArn(), delete.reason());
      return RunOutcome.succeeded(
          delete.runId(), Operation.DELETE, target.getPackageArn(), "Deleted package (" + delete.reason() + ")");
    } catch (RegistryAccessException e) {
      if (e.kind() == FailureKind.NOT_FOUND) {
        log.info("Package {} was already deleted", target.getPackageArn());
        return RunOutcome.succeeded(
            delete.runId(), Operation.DELETE, target.getPackageArn(), "Package was already absent");
      }
      return failed(
          delete.runId(), Operation.DELETE, target.getPackageArn(), RegistrationException.from("Cannot delete package", e), "Delete failed for " + target.getPackageArn());
    } catch (SyncException e) {
      return failed(
          delete.runId(), Operation.DELETE, target.getPackageArn(), RegistrationException.from("Cannot delete package", e), "Delete failed for " + target.getPackageArn());
    } catch (RuntimeException e) {
      return failed(
          delete.runId(), Operation.DELETE, target.getPackageArn(), new RegistrationException("Cannot delete package", true, e), "Delete failed for " + target.getPackageArn());
    }
  }

  private void pruneArtifact(ArtifactLocation location) {
    try {
      if (artifactStore.delete(location)) {
        log.info("Deleted unreferenced archive {}", location);
      }
    } catch (RuntimeException e) {
      // The package is already gone; a leftover archive is picked up by the next delete of its run
      log.warn("Failed to delete unreferenced archive {}", location, e);
    }
  }

  private RunOutcome failed(
      RunId runId, Operation operation, String packageArn, SyncException failure, String context) {
    if (failure.isRetryable()) {
      log.warn("{}: {}", context, failure.getMessage());
    } else {
      log.error("{}", context, failure);
    }
    return RunOutcome.failed(runId, operation, packageArn, failure);
  }

  private <T> T withRetry(String name, Supplier<T> call) {
    Retry retry = Retry.of(name, retryConfig);
    return Retry.decorateSupplier(retry, call).get();
  }

  private static ThreadFactory namedThreads(String prefix) {
    AtomicInteger counter = new AtomicInteger(1);
    return runnable -> {
      Thread thread = new Thread(runnable, prefix + "-" + counter.getAndIncrement());
      thread.setDaemon(true);
      return thread;
    };
  }

  @Override
  public void close() {
    log.info("Shutting down reconciliation engine");
    workers.shutdown();
    repackagingPool.shutdownNow();
    try {
      if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
        workers.shutdownNow();
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
