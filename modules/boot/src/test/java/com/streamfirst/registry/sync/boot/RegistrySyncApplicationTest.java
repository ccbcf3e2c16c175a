package com.streamfirst.registry.sync.boot;

import static org.assertj.core.api.Assertions.assertThat;

import com.streamfirst.registry.sync.adapters.InMemorySourceRegistryAdapter;
import com.streamfirst.registry.sync.adapters.InMemoryTargetRegistryAdapter;
import com.streamfirst.registry.sync.adapters.registry.mlflow.MlflowWebhookDecoder;
import com.streamfirst.registry.sync.application.NotificationDispatcher;
import com.streamfirst.registry.sync.application.SyncSettings;
import com.streamfirst.registry.sync.domain.ApprovalStatus;
import com.streamfirst.registry.sync.domain.ModelName;
import com.streamfirst.registry.sync.domain.ModelStage;
import com.streamfirst.registry.sync.domain.ReconciliationReport;
import com.streamfirst.registry.sync.domain.RunId;
import com.streamfirst.registry.sync.domain.SourceModelVersion;
import com.streamfirst.registry.sync.ports.SourceRegistryPort;
import com.streamfirst.registry.sync.ports.TargetRegistryPort;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(
    properties = {
      "registry-sync.mode=in-memory",
      "registry-sync.artifact-bucket=boot-test-bucket",
      "registry-sync.webhook-secret=boot-test-secret",
      "registry-sync.lease-wait=1s",
      "registry-sync.retry.wait=1ms",
      "registry-sync.flavor-images.sklearn=123.dkr.ecr.eu-west-1.amazonaws.com/sklearn:1.2"
    })
class RegistrySyncApplicationTest {

  private static final ModelName MODEL = ModelName.of("fraud_detector");

  @Autowired private SyncSettings settings;
  @Autowired private SourceRegistryPort sourceRegistry;
  @Autowired private TargetRegistryPort targetRegistry;
  @Autowired private NotificationDispatcher dispatcher;
  @Autowired private WebhookNotificationIntake intake;

  @TempDir Path workspace;

  @Test
  void binds_settings_from_properties() {
    assertThat(settings.getArtifactBucket()).isEqualTo("boot-test-bucket");
    assertThat(settings.getLeaseWait()).isEqualTo(Duration.ofSeconds(1));
    assertThat(settings.getRetryMaxAttempts()).isEqualTo(3);
    assertThat(settings.getFlavorImages()).containsKey("sklearn");
  }

  @Test
  void in_memory_mode_wires_in_memory_registries() {
    assertThat(sourceRegistry).isInstanceOf(InMemorySourceRegistryAdapter.class);
    assertThat(targetRegistry).isInstanceOf(InMemoryTargetRegistryAdapter.class);
    assertThat(dispatcher).isNotNull();
  }

  @Test
  void signed_delivery_mirrors_the_promoted_version() throws Exception {
    Path bundle = Files.createDirectories(workspace.resolve("model"));
    Files.writeString(
        bundle.resolve("MLmodel"),
        "flavors:\n  python_function:\n    loader_module: mlflow.sklearn\n  sklearn:\n    pickled_model: model.pkl\n");
    Files.writeString(bundle.resolve("model.pkl"), "pickled");
    ((InMemorySourceRegistryAdapter) sourceRegistry)
        .register(
            SourceModelVersion.builder()
                .modelName(MODEL)
                .version(1)
                .runId(RunId.of("run-boot"))
                .stage(ModelStage.PRODUCTION)
                .artifactUri(bundle.toUri().toString())
                .build());

    byte[] body =
        ("{\"event\":\"MODEL_VERSION_TRANSITIONED_STAGE\",\"model_name\":\"fraud_detector\","
                + "\"version\":\"1\",\"to_stage\":\"Production\"}")
            .getBytes(StandardCharsets.UTF_8);
    String signature = new HmacUtils(HmacAlgorithms.HMAC_SHA_256, "boot-test-secret").hmacHex(body);

    ReconciliationReport report =
        intake.accept(Map.of(MlflowWebhookDecoder.SIGNATURE_HEADER, signature), body).get(30, TimeUnit.SECONDS);

    assertThat(report.successes()).hasSize(1);
    assertThat(targetRegistry.listPackages(MODEL.packageGroupName()))
        .singleElement()
        .satisfies(
            pkg -> {
              assertThat(pkg.getRunId()).isEqualTo(RunId.of("run-boot"));
              assertThat(pkg.getApprovalStatus()).isEqualTo(ApprovalStatus.APPROVED);
              assertThat(pkg.getArtifactLocation().bucket()).isEqualTo("boot-test-bucket");
            });
  }
}
