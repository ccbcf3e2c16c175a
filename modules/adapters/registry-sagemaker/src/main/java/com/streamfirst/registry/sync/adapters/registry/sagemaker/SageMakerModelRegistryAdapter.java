package com.streamfirst.registry.sync.adapters.registry.sagemaker;

import com.streamfirst.registry.sync.domain.ApprovalStatus;
import com.streamfirst.registry.sync.domain.ArtifactLocation;
import com.streamfirst.registry.sync.domain.FailureKind;
import com.streamfirst.registry.sync.domain.ModelStage;
import com.streamfirst.registry.sync.domain.PackageDraft;
import com.streamfirst.registry.sync.domain.PackageMetadata;
import com.streamfirst.registry.sync.domain.RunId;
import com.streamfirst.registry.sync.domain.TargetModelPackage;
import com.streamfirst.registry.sync.ports.TargetRegistryPort;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sagemaker.SageMakerClient;
import software.amazon.awssdk.services.sagemaker.model.CreateModelPackageGroupRequest;
import software.amazon.awssdk.services.sagemaker.model.CreateModelPackageRequest;
import software.amazon.awssdk.services.sagemaker.model.CreateModelPackageResponse;
import software.amazon.awssdk.services.sagemaker.model.DeleteModelPackageRequest;
import software.amazon.awssdk.services.sagemaker.model.DescribeModelPackageGroupRequest;
import software.amazon.awssdk.services.sagemaker.model.DescribeModelPackageRequest;
import software.amazon.awssdk.services.sagemaker.model.DescribeModelPackageResponse;
import software.amazon.awssdk.services.sagemaker.model.InferenceSpecification;
import software.amazon.awssdk.services.sagemaker.model.ListModelPackagesRequest;
import software.amazon.awssdk.services.sagemaker.model.ModelPackageContainerDefinition;
import software.amazon.awssdk.services.sagemaker.model.ModelPackageSummary;
import software.amazon.awssdk.services.sagemaker.model.Tag;
import software.amazon.awssdk.services.sagemaker.model.UpdateModelPackageRequest;

/**
 * Target registry backed by the SageMaker Model Registry. One model package group per source model;
 * each package carries the source run ID and stage in its customer metadata properties.
 */
@Slf4j
@RequiredArgsConstructor
public class SageMakerModelRegistryAdapter implements TargetRegistryPort {

  static final String SOURCE_TAG_KEY = "model-source";
  static final String SOURCE_TAG_VALUE = "mlflow";
  static final List<String> CONTENT_TYPES = List.of("application/json", "text/csv", "application/x-npy");
  static final List<String> RESPONSE_TYPES = List.of("application/json");

  private final SageMakerClient sageMaker;

  @Override
  public List<TargetModelPackage> listPackages(String groupName) {
    List<TargetModelPackage> packages = new ArrayList<>();
    try {
      ListModelPackagesRequest request =
          ListModelPackagesRequest.builder().modelPackageGroupName(groupName).build();
      for (ModelPackageSummary summary : sageMaker.listModelPackagesPaginator(request).modelPackageSummaryList()) {
        describe(summary.modelPackageArn()).ifPresent(packages::add);
      }
    } catch (SdkException e) {
      if (SageMakerFailures.classify(e) == FailureKind.NOT_FOUND) {
        log.debug("Package group {} does not exist", groupName);
        return List.of();
      }
      throw SageMakerFailures.translate("Failed to list packages of group " + groupName, e);
    }
    log.debug("Found {} managed packages in group {}", packages.size(), groupName);
    return packages;
  }

  private Optional<TargetModelPackage> describe(String packageArn) {
    DescribeModelPackageResponse response;
    try {
      response =
          sageMaker.describeModelPackage(
              DescribeModelPackageRequest.builder().modelPackageName(packageArn).build());
    } catch (SdkException e) {
      if (SageMakerFailures.classify(e) == FailureKind.NOT_FOUND) {
        log.debug("Package {} was deleted while listing", packageArn);
        return Optional.empty();
      }
      throw e;
    }
    Map<String, String> metadata = response.customerMetadataProperties();
    String runId = metadata.get(PackageMetadata.RUN_ID);
    if (runId == null || runId.isBlank()) {
      log.debug("Ignoring package {} without {}", packageArn, PackageMetadata.RUN_ID);
      return Optional.empty();
    }
    Optional<ModelPackageContainerDefinition> container =
        Optional.ofNullable(response.inferenceSpecification())
            .flatMap(spec -> spec.containers().stream().findFirst());
    Optional<ArtifactLocation> location = container.flatMap(c -> parseLocation(packageArn, c.modelDataUrl()));
    if (location.isEmpty()) {
      log.warn("Ignoring package {}: no S3 model data URL", packageArn);
      return Optional.empty();
    }

    return Optional.of(
        TargetModelPackage.builder()
            .packageArn(response.modelPackageArn())
            .groupName(response.modelPackageGroupName())
            .runId(RunId.of(runId))
            .approvalStatus(parseApproval(packageArn, response.modelApprovalStatusAsString()))
            .sourceVersion(parseVersion(metadata.get(PackageMetadata.VERSION)))
            .sourceStage(parseStage(packageArn, metadata.get(PackageMetadata.CURRENT_STAGE)))
            .artifactLocation(location.get())
            .imageReference(container.map(ModelPackageContainerDefinition::image).orElse(""))
            .artifactSha256(metadata.get(PackageMetadata.ARTIFACT_SHA256))
            .createdAt(response.creationTime() == null ? Instant.EPOCH : response.creationTime())
            .metadata(metadata)
            .build());
  }

  @Override
  public void ensurePackageGroup(String groupName) {
    try {
      sageMaker.describeModelPackageGroup(
          DescribeModelPackageGroupRequest.builder().modelPackageGroupName(groupName).build());
      return;
    } catch (SdkException e) {
      if (SageMakerFailures.classify(e) != FailureKind.NOT_FOUND) {
        throw SageMakerFailures.translate("Failed to describe package group " + groupName, e);
      }
    }

    log.info("Creating model package group {}", groupName);
    try {
      sageMaker.createModelPackageGroup(
          CreateModelPackageGroupRequest.builder()
              .modelPackageGroupName(groupName)
              .modelPackageGroupDescription("Models registered from MLflow model " + groupName)
              .tags(Tag.builder().key(SOURCE_TAG_KEY).value(SOURCE_TAG_VALUE).build())
              .build());
    } catch (SdkException e) {
      String message = e.getMessage() == null ? "" : e.getMessage();
      if (message.contains("already exists")) {
        log.debug("Package group {} was created concurrently", groupName);
        return;
      }
      throw SageMakerFailures.translate("Failed to create package group " + groupName, e);
    }
  }

  @Override
  public TargetModelPackage createPackage(PackageDraft draft) {
    ModelPackageContainerDefinition container =
        ModelPackageContainerDefinition.builder()
            .image(draft.getImageReference())
            .modelDataUrl(draft.getArtifactLocation().uri())
            .environment(draft.getEnvironment())
            .build();
    CreateModelPackageRequest request =
        CreateModelPackageRequest.builder()
            .modelPackageGroupName(draft.getGroupName())
            .modelPackageDescription(draft.getDescription())
            .modelApprovalStatus(draft.getApprovalStatus().wireName())
            .inferenceSpecification(
                InferenceSpecification.builder()
                    .containers(container)
                    .supportedContentTypes(CONTENT_TYPES)
                    .supportedResponseMIMETypes(RESPONSE_TYPES)
                    .build())
            .customerMetadataProperties(draft.getMetadata())
            .build();
    try {
      CreateModelPackageResponse response = sageMaker.createModelPackage(request);
      log.debug("Created model package {} in group {}", response.modelPackageArn(), draft.getGroupName());
      return TargetModelPackage.builder()
          .packageArn(response.modelPackageArn())
          .groupName(draft.getGroupName())
          .runId(draft.getRunId())
          .approvalStatus(draft.getApprovalStatus())
          .sourceVersion(draft.getSourceVersion())
          .sourceStage(draft.getSourceStage())
          .artifactLocation(draft.getArtifactLocation())
          .imageReference(draft.getImageReference())
          .artifactSha256(draft.getArtifactSha256())
          .createdAt(Instant.now())
          .metadata(draft.getMetadata())
          .build();
    } catch (SdkException e) {
      throw SageMakerFailures.translate("Failed to create package for run " + draft.getRunId(), e);
    }
  }

  @Override
  public TargetModelPackage updateApproval(
      TargetModelPackage target, ApprovalStatus status, Map<String, String> metadata) {
    try {
      sageMaker.updateModelPackage(
          UpdateModelPackageRequest.builder()
              .modelPackageArn(target.getPackageArn())
              .modelApprovalStatus(status.wireName())
              .customerMetadataProperties(metadata)
              .build());
    } catch (SdkException e) {
      throw SageMakerFailures.translate("Failed to update package " + target.getPackageArn(), e);
    }
    log.debug("Updated model package {} to {}", target.getPackageArn(), status.wireName());
    return target.toBuilder()
        .approvalStatus(status)
        .sourceStage(parseStage(target.getPackageArn(), metadata.get(PackageMetadata.CURRENT_STAGE)))
        .clearMetadata()
        .metadata(metadata)
        .build();
  }

  @Override
  public void deletePackage(TargetModelPackage target) {
    try {
      sageMaker.deleteModelPackage(
          DeleteModelPackageRequest.builder().modelPackageName(target.getPackageArn()).build());
      log.debug("Deleted model package {}", target.getPackageArn());
    } catch (SdkException e) {
      throw SageMakerFailures.translate("Failed to delete package " + target.getPackageArn(), e);
    }
  }

  private static Optional<ArtifactLocation> parseLocation(String packageArn, String modelDataUrl) {
    if (modelDataUrl == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(ArtifactLocation.parse(modelDataUrl));
    } catch (IllegalArgumentException e) {
      log.warn("Package {} has an unreadable model data URL {}: {}", packageArn, modelDataUrl, e.getMessage());
      return Optional.empty();
    }
  }

  private static long parseVersion(String value) {
    if (value == null) {
      return 0L;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      log.warn("Ignoring non numeric version '{}'", value);
      return 0L;
    }
  }

  /** An unknown status reads as pending, so the package shows up as stale and is updated. */
  private static ApprovalStatus parseApproval(String packageArn, String value) {
    try {
      return ApprovalStatus.fromWireName(value);
    } catch (IllegalArgumentException e) {
      log.warn("Package {} has unknown approval status '{}'", packageArn, value);
      return ApprovalStatus.PENDING_MANUAL_APPROVAL;
    }
  }

  private static ModelStage parseStage(String packageArn, String value) {
    try {
      return ModelStage.parse(value);
    } catch (IllegalArgumentException e) {
      log.warn("Package {} records unknown stage '{}'", packageArn, value);
      return ModelStage.NONE;
    }
  }
}
