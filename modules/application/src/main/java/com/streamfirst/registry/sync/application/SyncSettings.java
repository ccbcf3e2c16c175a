package com.streamfirst.registry.sync.application;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/** Tuning and environment settings for the reconciliation services. */
@Value
@Builder(toBuilder = true)
public class SyncSettings {

  /** Bucket that receives repackaged archives */
  @NonNull String artifactBucket;

  /** Identifies this instance as a lease holder */
  @NonNull @Builder.Default String holderId = "registry-sync";

  /** Threads running create and update operations in parallel */
  @Builder.Default int workerThreads = 4;

  /** Threads running notification passes; one pass per model at a time */
  @Builder.Default int dispatcherThreads = 2;

  @NonNull @Builder.Default Duration leaseTtl = Duration.ofMinutes(15);

  @NonNull @Builder.Default Duration leaseWait = Duration.ofSeconds(30);

  @NonNull @Builder.Default Duration repackagingTimeout = Duration.ofMinutes(10);

  /** Attempts per operation within one pass, including the first */
  @Builder.Default int retryMaxAttempts = 3;

  @NonNull @Builder.Default Duration retryWait = Duration.ofMillis(500);

  /** Delete archives from storage once no package references them */
  @Builder.Default boolean pruneArtifacts = true;

  /** Serving image per flavor or serving framework, e.g. "sklearn" */
  @Singular Map<String, String> flavorImages;

  /** Image for models that only declare the generic python_function flavor */
  String pythonFunctionImage;

  public Optional<String> getPythonFunctionImage() {
    return Optional.ofNullable(pythonFunctionImage).filter(s -> !s.isBlank());
  }
}
