package com.streamfirst.registry.sync.boot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamfirst.registry.sync.adapters.InMemoryArtifactStoreAdapter;
import com.streamfirst.registry.sync.adapters.InMemoryEventAdapter;
import com.streamfirst.registry.sync.adapters.InMemoryLeaseAdapter;
import com.streamfirst.registry.sync.adapters.InMemorySourceRegistryAdapter;
import com.streamfirst.registry.sync.adapters.InMemoryTargetRegistryAdapter;
import com.streamfirst.registry.sync.adapters.LocalDirectoryArtifactSourceAdapter;
import com.streamfirst.registry.sync.adapters.OperationJournal;
import com.streamfirst.registry.sync.adapters.registry.mlflow.MlflowArtifactSourceAdapter;
import com.streamfirst.registry.sync.adapters.registry.mlflow.MlflowRestClient;
import com.streamfirst.registry.sync.adapters.registry.mlflow.MlflowRestRegistryAdapter;
import com.streamfirst.registry.sync.adapters.registry.mlflow.MlflowWebhookDecoder;
import com.streamfirst.registry.sync.adapters.registry.sagemaker.SageMakerModelRegistryAdapter;
import com.streamfirst.registry.sync.adapters.storage.s3.S3ArtifactSourceAdapter;
import com.streamfirst.registry.sync.adapters.storage.s3.S3ArtifactStoreAdapter;
import com.streamfirst.registry.sync.application.IdentityResolver;
import com.streamfirst.registry.sync.application.NotificationDispatcher;
import com.streamfirst.registry.sync.application.ReconciliationEngine;
import com.streamfirst.registry.sync.application.ReconciliationPlanner;
import com.streamfirst.registry.sync.application.SyncSettings;
import com.streamfirst.registry.sync.application.packaging.ArtifactRepackager;
import com.streamfirst.registry.sync.application.packaging.ImageReferenceResolver;
import com.streamfirst.registry.sync.domain.ModelName;
import com.streamfirst.registry.sync.domain.ReconciliationReport;
import com.streamfirst.registry.sync.ports.*;
import java.net.URI;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.sagemaker.SageMakerClient;

/** Wires the reconciliation services to either in-memory or AWS backed adapters. */
@Slf4j
@Configuration
public class RegistrySyncConfiguration {

  // --- Adapters shared by every mode ---

  @Bean
  public SyncSettings syncSettings(RegistrySyncProperties properties) {
    return properties.toSettings();
  }

  @Bean
  public LeasePort leasePort() {
    return new InMemoryLeaseAdapter();
  }

  @Bean
  public EventPort eventPort() {
    return new InMemoryEventAdapter();
  }

  @Bean
  public ArtifactSourcePort localDirectoryArtifactSource() {
    return new LocalDirectoryArtifactSourceAdapter();
  }

  // --- Application services ---

  @Bean
  public ImageReferenceResolver imageReferenceResolver(SyncSettings settings) {
    return new ImageReferenceResolver(settings.getFlavorImages(), settings.getPythonFunctionImage());
  }

  @Bean
  public ArtifactRepackager artifactRepackager(
      List<ArtifactSourcePort> artifactSources,
      ArtifactStorePort artifactStore,
      ImageReferenceResolver imageReferenceResolver,
      SyncSettings settings) {
    return new ArtifactRepackager(
        artifactSources, artifactStore, imageReferenceResolver, settings.getArtifactBucket());
  }

  @Bean
  public IdentityResolver identityResolver(
      SourceRegistryPort sourceRegistry, TargetRegistryPort targetRegistry, SyncSettings settings) {
    return new IdentityResolver(sourceRegistry, targetRegistry, settings.getArtifactBucket());
  }

  @Bean
  public ReconciliationPlanner reconciliationPlanner() {
    return new ReconciliationPlanner();
  }

  @Bean
  public ReconciliationEngine reconciliationEngine(
      IdentityResolver identityResolver,
      ReconciliationPlanner planner,
      ArtifactRepackager repackager,
      TargetRegistryPort targetRegistry,
      ArtifactStorePort artifactStore,
      LeasePort leasePort,
      SyncSettings settings) {
    return new ReconciliationEngine(
        identityResolver, planner, repackager, targetRegistry, artifactStore, leasePort, settings);
  }

  @Bean
  public NotificationDispatcher notificationDispatcher(
      ReconciliationEngine engine, EventPort eventPort, SyncSettings settings) {
    return new NotificationDispatcher(engine, eventPort, settings);
  }

  @Bean
  @ConditionalOnProperty(prefix = "registry-sync", name = "webhook-secret")
  public WebhookNotificationIntake webhookNotificationIntake(
      RegistrySyncProperties properties, NotificationDispatcher dispatcher) {
    return new WebhookNotificationIntake(
        new MlflowWebhookDecoder(properties.getWebhookSecret(), new ObjectMapper()), dispatcher);
  }

  @Bean
  public CommandLineRunner startupSync(RegistrySyncProperties properties, NotificationDispatcher dispatcher) {
    return args -> {
      List<ModelName> models = properties.getStartupModels().stream().map(ModelName::of).toList();
      if (models.isEmpty()) {
        log.info("No startup models configured, waiting for notifications");
        return;
      }
      log.info("Starting full sync of {} models: {}", models.size(), models);
      dispatcher
          .syncAll(models)
          .whenComplete(
              (reports, failure) -> {
                if (failure != null) {
                  log.error("Startup sync did not complete", failure);
                  return;
                }
                long converged = reports.stream().filter(r -> !r.needsRetry() && !r.requiresAttention()).count();
                log.info("Startup sync finished: {} of {} models in sync", converged, reports.size());
                reports.stream()
                    .filter(ReconciliationReport::needsRetry)
                    .forEach(r -> log.warn("Model {} still needs work: {}", r.getModelName(), r));
              });
    };
  }

  /** In-memory registries and storage. */
  @Configuration
  @ConditionalOnProperty(prefix = "registry-sync", name = "mode", havingValue = "in-memory", matchIfMissing = true)
  static class InMemoryAdapters {

    @Bean
    public OperationJournal operationJournal() {
      return new OperationJournal();
    }

    @Bean
    public SourceRegistryPort sourceRegistry() {
      log.info("Using in-memory source registry");
      return new InMemorySourceRegistryAdapter();
    }

    @Bean
    public TargetRegistryPort targetRegistry(OperationJournal journal) {
      log.info("Using in-memory target registry");
      return new InMemoryTargetRegistryAdapter(journal);
    }

    @Bean
    public ArtifactStorePort artifactStore(OperationJournal journal) {
      return new InMemoryArtifactStoreAdapter(journal);
    }
  }

  /** MLflow REST source, SageMaker target and S3 storage. */
  @Configuration
  @ConditionalOnProperty(prefix = "registry-sync", name = "mode", havingValue = "aws")
  static class AwsAdapters {

    @Bean(destroyMethod = "close")
    public S3Client s3Client(RegistrySyncProperties properties) {
      var builder = S3Client.builder();
      if (properties.getAwsRegion() != null && !properties.getAwsRegion().isBlank()) {
        builder.region(Region.of(properties.getAwsRegion()));
      }
      return builder.build();
    }

    @Bean(destroyMethod = "close")
    public SageMakerClient sageMakerClient(RegistrySyncProperties properties) {
      var builder = SageMakerClient.builder();
      if (properties.getAwsRegion() != null && !properties.getAwsRegion().isBlank()) {
        builder.region(Region.of(properties.getAwsRegion()));
      }
      return builder.build();
    }

    @Bean
    public MlflowRestClient mlflowRestClient(RegistrySyncProperties properties) {
      String trackingUri = properties.getMlflow().getTrackingUri();
      if (trackingUri == null || trackingUri.isBlank()) {
        throw new IllegalStateException("registry-sync.mlflow.tracking-uri must be set in aws mode");
      }
      log.info("Using MLflow tracking server at {}", trackingUri);
      return new MlflowRestClient(URI.create(trackingUri), properties.getMlflow().getToken());
    }

    @Bean
    public SourceRegistryPort sourceRegistry(MlflowRestClient client) {
      return new MlflowRestRegistryAdapter(client);
    }

    @Bean
    public TargetRegistryPort targetRegistry(SageMakerClient sageMakerClient) {
      return new SageMakerModelRegistryAdapter(sageMakerClient);
    }

    @Bean
    public ArtifactStorePort artifactStore(S3Client s3Client) {
      return new S3ArtifactStoreAdapter(s3Client);
    }

    @Bean
    public ArtifactSourcePort mlflowArtifactSource(MlflowRestClient client) {
      return new MlflowArtifactSourceAdapter(client);
    }

    @Bean
    public ArtifactSourcePort s3ArtifactSource(S3Client s3Client) {
      return new S3ArtifactSourceAdapter(s3Client);
    }
  }
}
