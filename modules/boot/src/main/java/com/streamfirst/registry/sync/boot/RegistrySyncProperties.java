package com.streamfirst.registry.sync.boot;

import com.streamfirst.registry.sync.application.SyncSettings;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Settings bound from the {@code registry-sync} section of the application configuration. */
@Data
@ConfigurationProperties(prefix = "registry-sync")
public class RegistrySyncProperties {

  public enum Mode {
    /** In-memory registries and storage, for local runs and tests */
    IN_MEMORY,
    /** MLflow REST source, SageMaker target, S3 storage */
    AWS
  }

  private Mode mode = Mode.IN_MEMORY;

  /** Lease holder name of this instance */
  private String holderId = "registry-sync";

  private int workerThreads = 4;

  private int dispatcherThreads = 2;

  private Duration leaseTtl = Duration.ofMinutes(15);

  private Duration leaseWait = Duration.ofSeconds(30);

  private Duration repackagingTimeout = Duration.ofMinutes(10);

  private Retry retry = new Retry();

  /** Delete archives from the bucket once no package references them */
  private boolean pruneArtifacts = true;

  private String artifactBucket;

  private String awsRegion;

  /** Serving image URI per flavor, e.g. {@code sklearn: 123.dkr.ecr...} */
  private Map<String, String> flavorImages = new LinkedHashMap<>();

  private String pythonFunctionImage;

  private Mlflow mlflow = new Mlflow();

  /** Shared secret of the registry webhook; deliveries are not accepted without it */
  private String webhookSecret;

  /** Models fully synced when the service starts */
  private List<String> startupModels = new ArrayList<>();

  @Data
  public static class Retry {
    /** Attempts per operation within a pass, including the first */
    private int maxAttempts = 3;

    private Duration wait = Duration.ofMillis(500);
  }

  @Data
  public static class Mlflow {
    /** Base URL of the tracking server, e.g. {@code https://dbc-1234.cloud.databricks.com} */
    private String trackingUri;

    /** Personal access token sent as a bearer token */
    private String token;
  }

  /** Converts to the immutable settings used by the application services. */
  public SyncSettings toSettings() {
    if (artifactBucket == null || artifactBucket.isBlank()) {
      throw new IllegalStateException("registry-sync.artifact-bucket must be set");
    }
    return SyncSettings.builder()
        .artifactBucket(artifactBucket)
        .holderId(holderId)
        .workerThreads(workerThreads)
        .dispatcherThreads(dispatcherThreads)
        .leaseTtl(leaseTtl)
        .leaseWait(leaseWait)
        .repackagingTimeout(repackagingTimeout)
        .retryMaxAttempts(retry.getMaxAttempts())
        .retryWait(retry.getWait())
        .pruneArtifacts(pruneArtifacts)
        .flavorImages(flavorImages)
        .pythonFunctionImage(pythonFunctionImage)
        .build();
  }
}
