package com.streamfirst.registry.sync.application;

import com.streamfirst.registry.sync.domain.*;
import com.streamfirst.registry.sync.ports.EventPort;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Accepts stage transition notifications and runs reconciliation passes for them in the background.
 *
 * <p>Notifications for one model are coalesced: a notification arriving while a pass for the model
 * is still queued joins that pass, and one arriving while a pass is running schedules a single
 * follow-up pass that every later notification joins. Passes for different models run concurrently.
 * Every report is published on {@link EventPort#REPORTS_TOPIC}; reports an operator has to look at
 * also go to {@link EventPort#ALERTS_TOPIC}.
 */
@Slf4j
public class NotificationDispatcher implements AutoCloseable {

  private final ReconciliationEngine engine;
  private final EventPort eventPort;
  private final ExecutorService executor;

  /** Guarded by itself */
  private final Map<ModelName, ModelPasses> passes = new HashMap<>();

  public NotificationDispatcher(ReconciliationEngine engine, EventPort eventPort, SyncSettings settings) {
    this.engine = engine;
    this.eventPort = eventPort;
    AtomicInteger counter = new AtomicInteger(1);
    this.executor =
        Executors.newFixedThreadPool(
            settings.getDispatcherThreads(),
            runnable -> {
              Thread thread = new Thread(runnable, "sync-dispatcher-" + counter.getAndIncrement());
              thread.setDaemon(true);
              return thread;
            });
  }

  /**
   * Schedules a reconciliation pass for the notification's model.
   *
   * @param notification the trigger
   * @return completes with the report of the pass that covered this notification
   */
  public CompletableFuture<ReconciliationReport> submit(StageTransitionNotification notification) {
    ModelName modelName = notification.getModelName();
    synchronized (passes) {
      ModelPasses model = passes.computeIfAbsent(modelName, k -> new ModelPasses());
      if (model.current != null && !model.current.started) {
        log.debug("Merging {} into the queued pass for model {}", notification, modelName);
        return model.current.absorb(notification);
      }
      if (model.current != null) {
        if (model.followUp == null) {
          log.debug("Pass for model {} is running, scheduling a follow-up for {}", modelName, notification);
          model.followUp = new Pass(notification);
          return model.followUp.result;
        }
        log.debug("Merging {} into the follow-up pass for model {}", notification, modelName);
        return model.followUp.absorb(notification);
      }
      Pass pass = new Pass(notification);
      model.current = pass;
      schedule(pass);
      return pass.result;
    }
  }

  /**
   * Schedules a full sync of each model, e.g. on startup.
   *
   * @return completes once every pass has finished
   */
  public CompletableFuture<List<ReconciliationReport>> syncAll(Collection<ModelName> modelNames) {
    List<CompletableFuture<ReconciliationReport>> results =
        modelNames.stream().map(StageTransitionNotification::fullSync).map(this::submit).toList();
    return CompletableFuture.allOf(results.toArray(CompletableFuture[]::new))
        .thenApply(ignored -> results.stream().map(CompletableFuture::join).toList());
  }

  /** Number of models with a queued or running pass. */
  public int activeModels() {
    synchronized (passes) {
      return passes.size();
    }
  }

  private void schedule(Pass pass) {
    try {
      executor.execute(() -> run(pass));
    } catch (RejectedExecutionException e) {
      log.warn("Dispatcher is shut down, dropping pass for {}", pass.trigger);
      synchronized (passes) {
        passes.remove(pass.trigger.getModelName());
      }
      pass.result.completeExceptionally(e);
    }
  }

  private void run(Pass pass) {
    ModelName modelName = pass.trigger.getModelName();
    synchronized (passes) {
      pass.started = true;
    }
    if (pass.merged > 0) {
      log.info("Pass for model {} covers {} coalesced notifications", modelName, pass.merged + 1);
    }

    ReconciliationReport report;
    try {
      report = engine.reconcile(pass.trigger);
    } catch (RuntimeException e) {
      log.error("Reconciliation pass for model {} failed", modelName, e);
      Instant now = Instant.now();
      report =
          ReconciliationReport.builder()
              .notificationId(pass.trigger.getNotificationId())
              .modelName(modelName)
              .startedAt(now)
              .finishedAt(now)
              .passFailure(new ResolutionException("Reconciliation pass failed: " + e.getMessage(), e))
              .build();
    }

    publish(report);
    pass.result.complete(report);

    synchronized (passes) {
      ModelPasses model = passes.get(modelName);
      if (model.followUp != null) {
        model.current = model.followUp;
        model.followUp = null;
        schedule(model.current);
      } else {
        passes.remove(modelName);
      }
    }
  }

  private void publish(ReconciliationReport report) {
    try {
      eventPort.publish(EventPort.REPORTS_TOPIC, report);
      if (report.requiresAttention()) {
        log.error("Model {} needs operator attention: {}", report.getModelName(), describeFailures(report));
        eventPort.publish(EventPort.ALERTS_TOPIC, report);
      } else if (report.needsRetry()) {
        log.warn("Model {} is not converged yet, the next notification retries: {}", report.getModelName(), report);
      }
    } catch (RuntimeException e) {
      log.error("Failed to publish report for model {}", report.getModelName(), e);
    }
  }

  private static String describeFailures(ReconciliationReport report) {
    if (report.getPassFailure().isPresent()) {
      return report.getPassFailure().get().getMessage();
    }
    StringJoiner joiner = new StringJoiner("; ");
    report
        .fatalFailures()
        .forEach(o -> joiner.add(o.operation() + " " + o.runId() + ": " + o.message()));
    return joiner.toString();
  }

  @Override
  public void close() {
    log.info("Shutting down notification dispatcher");
    executor.shutdown();
    try {
      if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private static final class ModelPasses {
    Pass current;
    Pass followUp;
  }

  private static final class Pass {
    final StageTransitionNotification trigger;
    final CompletableFuture<ReconciliationReport> result = new CompletableFuture<>();
    boolean started;
    int merged;

    Pass(StageTransitionNotification trigger) {
      this.trigger = trigger;
    }

    CompletableFuture<ReconciliationReport> absorb(StageTransitionNotification notification) {
      merged++;
      return result;
    }
  }
}
