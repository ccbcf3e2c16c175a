package com.streamfirst.registry.sync.adapters.registry.sagemaker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.streamfirst.registry.sync.domain.ApprovalStatus;
import com.streamfirst.registry.sync.domain.ArtifactLocation;
import com.streamfirst.registry.sync.domain.FailureKind;
import com.streamfirst.registry.sync.domain.ModelName;
import com.streamfirst.registry.sync.domain.ModelStage;
import com.streamfirst.registry.sync.domain.PackageDraft;
import com.streamfirst.registry.sync.domain.PackageMetadata;
import com.streamfirst.registry.sync.domain.RegistryAccessException;
import com.streamfirst.registry.sync.domain.RunId;
import com.streamfirst.registry.sync.domain.TargetModelPackage;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.services.sagemaker.SageMakerClient;
import software.amazon.awssdk.services.sagemaker.model.CreateModelPackageGroupRequest;
import software.amazon.awssdk.services.sagemaker.model.CreateModelPackageRequest;
import software.amazon.awssdk.services.sagemaker.model.CreateModelPackageResponse;
import software.amazon.awssdk.services.sagemaker.model.DeleteModelPackageRequest;
import software.amazon.awssdk.services.sagemaker.model.DescribeModelPackageGroupRequest;
import software.amazon.awssdk.services.sagemaker.model.DescribeModelPackageGroupResponse;
import software.amazon.awssdk.services.sagemaker.model.DescribeModelPackageRequest;
import software.amazon.awssdk.services.sagemaker.model.DescribeModelPackageResponse;
import software.amazon.awssdk.services.sagemaker.model.InferenceSpecification;
import software.amazon.awssdk.services.sagemaker.model.ListModelPackagesRequest;
import software.amazon.awssdk.services.sagemaker.model.ListModelPackagesResponse;
import software.amazon.awssdk.services.sagemaker.model.ModelPackageContainerDefinition;
import software.amazon.awssdk.services.sagemaker.model.ModelPackageSummary;
import software.amazon.awssdk.services.sagemaker.model.ResourceNotFoundException;
import software.amazon.awssdk.services.sagemaker.model.SageMakerException;
import software.amazon.awssdk.services.sagemaker.model.UpdateModelPackageRequest;
import software.amazon.awssdk.services.sagemaker.paginators.ListModelPackagesIterable;

@ExtendWith(MockitoExtension.class)
class SageMakerModelRegistryAdapterTest {

  private static final ModelName MODEL = ModelName.of("churn_classifier");
  private static final String GROUP = MODEL.packageGroupName();
  private static final String ARN_PREFIX = "arn:aws:sagemaker:eu-west-1:123456789012:model-package/" + GROUP + "/";

  @Mock private SageMakerClient sageMaker;

  private SageMakerModelRegistryAdapter registry;

  @BeforeEach
  void setUp() {
    registry = new SageMakerModelRegistryAdapter(sageMaker);
  }

  private void listing(String... arns) {
    List<ModelPackageSummary> summaries =
        Arrays.stream(arns).map(a -> ModelPackageSummary.builder().modelPackageArn(a).build()).toList();
    when(sageMaker.listModelPackagesPaginator(any(ListModelPackagesRequest.class)))
        .thenAnswer(inv -> new ListModelPackagesIterable(sageMaker, inv.getArgument(0)));
    when(sageMaker.listModelPackages(any(ListModelPackagesRequest.class)))
        .thenReturn(ListModelPackagesResponse.builder().modelPackageSummaryList(summaries).build());
  }

  private static DescribeModelPackageResponse described(String arn, Map<String, String> metadata, String modelDataUrl) {
    return DescribeModelPackageResponse.builder()
        .modelPackageArn(arn)
        .modelPackageGroupName(GROUP)
        .modelApprovalStatus("Approved")
        .creationTime(Instant.parse("2024-05-01T10:00:00Z"))
        .customerMetadataProperties(metadata)
        .inferenceSpecification(
            InferenceSpecification.builder()
                .containers(
                    ModelPackageContainerDefinition.builder()
                        .image("sklearn-image")
                        .modelDataUrl(modelDataUrl)
                        .build())
                .build())
        .build();
  }

  private static SageMakerException serviceError(int status, String code, String message) {
    // build() is declared on AwsServiceException.Builder
    return (SageMakerException)
        SageMakerException.builder()
            .statusCode(status)
            .message(message)
            .awsErrorDetails(AwsErrorDetails.builder().errorCode(code).errorMessage(message).build())
            .build();
  }

  @Test
  void lists_managed_packages_only() {
    listing(ARN_PREFIX + "1", ARN_PREFIX + "2", ARN_PREFIX + "3");
    when(sageMaker.describeModelPackage(any(DescribeModelPackageRequest.class)))
        .thenReturn(
            described(
                ARN_PREFIX + "1",
                Map.of(
                    PackageMetadata.RUN_ID, "run-a",
                    PackageMetadata.VERSION, "4",
                    PackageMetadata.CURRENT_STAGE, "Production",
                    PackageMetadata.ARTIFACT_SHA256, "cafe"),
                "s3://artifacts/churn-classifier/run-a/model.tar.gz"))
        .thenReturn(described(ARN_PREFIX + "2", Map.of(), "s3://artifacts/manual/model.tar.gz"))
        .thenReturn(described(ARN_PREFIX + "3", Map.of(PackageMetadata.RUN_ID, "run-c"), null));

    List<TargetModelPackage> packages = registry.listPackages(GROUP);

    assertThat(packages).hasSize(1);
    TargetModelPackage pkg = packages.get(0);
    assertThat(pkg.getPackageArn()).isEqualTo(ARN_PREFIX + "1");
    assertThat(pkg.getRunId()).isEqualTo(RunId.of("run-a"));
    assertThat(pkg.getApprovalStatus()).isEqualTo(ApprovalStatus.APPROVED);
    assertThat(pkg.getSourceVersion()).isEqualTo(4);
    assertThat(pkg.getSourceStage()).isEqualTo(ModelStage.PRODUCTION);
    assertThat(pkg.getArtifactLocation())
        .isEqualTo(ArtifactLocation.parse("s3://artifacts/churn-classifier/run-a/model.tar.gz"));
    assertThat(pkg.getArtifactSha256()).contains("cafe");
    assertThat(pkg.getImageReference()).isEqualTo("sklearn-image");
  }

  @Test
  void unknown_approval_status_does_not_fail_the_listing() {
    listing(ARN_PREFIX + "1", ARN_PREFIX + "2");
    when(sageMaker.describeModelPackage(any(DescribeModelPackageRequest.class)))
        .thenReturn(
            described(ARN_PREFIX + "1", Map.of(PackageMetadata.RUN_ID, "run-a"), "s3://artifacts/a/model.tar.gz")
                .toBuilder()
                .modelApprovalStatus("Bogus")
                .build())
        .thenReturn(
            described(ARN_PREFIX + "2", Map.of(PackageMetadata.RUN_ID, "run-b"), "s3://artifacts/b/model.tar.gz"));

    List<TargetModelPackage> packages = registry.listPackages(GROUP);

    assertThat(packages)
        .extracting(TargetModelPackage::getApprovalStatus)
        .containsExactly(ApprovalStatus.PENDING_MANUAL_APPROVAL, ApprovalStatus.APPROVED);
  }

  @Test
  void package_deleted_while_listing_is_skipped() {
    listing(ARN_PREFIX + "1");
    when(sageMaker.describeModelPackage(any(DescribeModelPackageRequest.class)))
        .thenThrow(ResourceNotFoundException.builder().message("Model package does not exist").build());

    assertThat(registry.listPackages(GROUP)).isEmpty();
  }

  @Test
  void throttled_listing_is_retryable() {
    when(sageMaker.listModelPackagesPaginator(any(ListModelPackagesRequest.class)))
        .thenThrow(serviceError(400, "ThrottlingException", "Rate exceeded"));

    assertThatThrownBy(() -> registry.listPackages(GROUP))
        .isInstanceOfSatisfying(
            RegistryAccessException.class,
            e -> {
              assertThat(e.kind()).isEqualTo(FailureKind.THROTTLED);
              assertThat(e.isRetryable()).isTrue();
            });
  }

  @Test
  void missing_group_is_created_with_source_tag() {
    when(sageMaker.describeModelPackageGroup(any(DescribeModelPackageGroupRequest.class)))
        .thenThrow(serviceError(400, "ValidationException", "Model Package Group churn-classifier does not exist."));

    registry.ensurePackageGroup(GROUP);

    ArgumentCaptor<CreateModelPackageGroupRequest> request =
        ArgumentCaptor.forClass(CreateModelPackageGroupRequest.class);
    verify(sageMaker).createModelPackageGroup(request.capture());
    assertThat(request.getValue().modelPackageGroupName()).isEqualTo(GROUP);
    assertThat(request.getValue().tags())
        .anySatisfy(
            tag -> {
              assertThat(tag.key()).isEqualTo(SageMakerModelRegistryAdapter.SOURCE_TAG_KEY);
              assertThat(tag.value()).isEqualTo(SageMakerModelRegistryAdapter.SOURCE_TAG_VALUE);
            });
  }

  @Test
  void existing_group_is_left_alone() {
    when(sageMaker.describeModelPackageGroup(any(DescribeModelPackageGroupRequest.class)))
        .thenReturn(DescribeModelPackageGroupResponse.builder().modelPackageGroupName(GROUP).build());

    registry.ensurePackageGroup(GROUP);

    verify(sageMaker, never()).createModelPackageGroup(any(CreateModelPackageGroupRequest.class));
  }

  @Test
  void create_sends_container_and_metadata() {
    when(sageMaker.createModelPackage(any(CreateModelPackageRequest.class)))
        .thenReturn(CreateModelPackageResponse.builder().modelPackageArn(ARN_PREFIX + "7").build());
    PackageDraft draft =
        PackageDraft.builder()
            .groupName(GROUP)
            .runId(RunId.of("run-a"))
            .approvalStatus(ApprovalStatus.APPROVED)
            .sourceVersion(7)
            .sourceStage(ModelStage.STAGING)
            .artifactLocation(ArtifactLocation.parse("s3://artifacts/churn-classifier/run-a/model.tar.gz"))
            .artifactSha256("cafe")
            .imageReference("sklearn-image")
            .environmentVariable("SAGEMAKER_PROGRAM", "inference.py")
            .description("mlflow churn_classifier-v7")
            .metadataEntry(PackageMetadata.RUN_ID, "run-a")
            .build();

    TargetModelPackage created = registry.createPackage(draft);

    assertThat(created.getPackageArn()).isEqualTo(ARN_PREFIX + "7");
    ArgumentCaptor<CreateModelPackageRequest> request = ArgumentCaptor.forClass(CreateModelPackageRequest.class);
    verify(sageMaker).createModelPackage(request.capture());
    CreateModelPackageRequest sent = request.getValue();
    assertThat(sent.modelPackageGroupName()).isEqualTo(GROUP);
    assertThat(sent.modelApprovalStatusAsString()).isEqualTo("Approved");
    assertThat(sent.customerMetadataProperties()).containsEntry(PackageMetadata.RUN_ID, "run-a");
    ModelPackageContainerDefinition container = sent.inferenceSpecification().containers().get(0);
    assertThat(container.image()).isEqualTo("sklearn-image");
    assertThat(container.modelDataUrl()).isEqualTo("s3://artifacts/churn-classifier/run-a/model.tar.gz");
    assertThat(container.environment()).containsEntry("SAGEMAKER_PROGRAM", "inference.py");
    assertThat(sent.inferenceSpecification().supportedContentTypes())
        .containsExactlyElementsOf(SageMakerModelRegistryAdapter.CONTENT_TYPES);
  }

  @Test
  void update_sends_approval_and_replaces_metadata() {
    TargetModelPackage target =
        TargetModelPackage.builder()
            .packageArn(ARN_PREFIX + "1")
            .groupName(GROUP)
            .runId(RunId.of("run-a"))
            .approvalStatus(ApprovalStatus.APPROVED)
            .sourceVersion(1)
            .sourceStage(ModelStage.STAGING)
            .artifactLocation(ArtifactLocation.parse("s3://artifacts/churn-classifier/run-a/model.tar.gz"))
            .imageReference("sklearn-image")
            .createdAt(Instant.now())
            .metadataEntry(PackageMetadata.CURRENT_STAGE, "Staging")
            .build();

    TargetModelPackage updated =
        registry.updateApproval(
            target, ApprovalStatus.REJECTED, Map.of(PackageMetadata.CURRENT_STAGE, "Archived"));

    ArgumentCaptor<UpdateModelPackageRequest> request = ArgumentCaptor.forClass(UpdateModelPackageRequest.class);
    verify(sageMaker).updateModelPackage(request.capture());
    assertThat(request.getValue().modelApprovalStatusAsString()).isEqualTo("Rejected");
    assertThat(request.getValue().customerMetadataProperties())
        .containsEntry(PackageMetadata.CURRENT_STAGE, "Archived");
    assertThat(updated.getApprovalStatus()).isEqualTo(ApprovalStatus.REJECTED);
    assertThat(updated.getSourceStage()).isEqualTo(ModelStage.ARCHIVED);
  }

  @Test
  void delete_of_a_missing_package_reports_not_found() {
    when(sageMaker.deleteModelPackage(any(DeleteModelPackageRequest.class)))
        .thenThrow(ResourceNotFoundException.builder().message("gone").build());
    TargetModelPackage target =
        TargetModelPackage.builder()
            .packageArn(ARN_PREFIX + "1")
            .groupName(GROUP)
            .runId(RunId.of("run-a"))
            .approvalStatus(ApprovalStatus.APPROVED)
            .sourceStage(ModelStage.STAGING)
            .artifactLocation(ArtifactLocation.parse("s3://artifacts/churn-classifier/run-a/model.tar.gz"))
            .imageReference("sklearn-image")
            .createdAt(Instant.now())
            .build();

    assertThatThrownBy(() -> registry.deletePackage(target))
        .isInstanceOfSatisfying(
            RegistryAccessException.class, e -> assertThat(e.kind()).isEqualTo(FailureKind.NOT_FOUND));
  }

  @Test
  void classifies_service_errors() {
    assertThat(SageMakerFailures.classify(serviceError(403, "AccessDeniedException", "denied")))
        .isEqualTo(FailureKind.UNAUTHORIZED);
    assertThat(SageMakerFailures.classify(serviceError(400, "AccessDeniedException", "denied")))
        .isEqualTo(FailureKind.UNAUTHORIZED);
    assertThat(SageMakerFailures.classify(serviceError(500, "InternalFailure", "oops")))
        .isEqualTo(FailureKind.UNAVAILABLE);
    assertThat(SageMakerFailures.classify(serviceError(400, "ValidationException", "bad input")))
        .isEqualTo(FailureKind.INVALID_REQUEST);
    assertThat(SageMakerFailures.classify(serviceError(400, "ValidationException", "Package does not exist")))
        .isEqualTo(FailureKind.NOT_FOUND);
  }
}
