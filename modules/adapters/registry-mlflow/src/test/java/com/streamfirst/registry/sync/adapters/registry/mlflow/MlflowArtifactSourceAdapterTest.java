package com.streamfirst.registry.sync.adapters.registry.mlflow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamfirst.registry.sync.domain.FailureKind;
import com.streamfirst.registry.sync.domain.ModelName;
import com.streamfirst.registry.sync.domain.ModelStage;
import com.streamfirst.registry.sync.domain.RegistryAccessException;
import com.streamfirst.registry.sync.domain.RepackagingException;
import com.streamfirst.registry.sync.domain.RunId;
import com.streamfirst.registry.sync.domain.SourceModelVersion;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MlflowArtifactSourceAdapterTest {

  private static final ObjectMapper JSON = new ObjectMapper();

  @Mock private MlflowRestClient client;

  @TempDir Path bundle;

  private static SourceModelVersion version(String artifactUri) {
    return SourceModelVersion.builder()
        .modelName(ModelName.of("churn_classifier"))
        .version(4)
        .runId(RunId.of("run-a"))
        .stage(ModelStage.STAGING)
        .artifactUri(artifactUri)
        .build();
  }

  private static JsonNode json(String text) throws Exception {
    return JSON.readTree(text);
  }

  @Test
  void supports_tracking_server_schemes_only() {
    MlflowArtifactSourceAdapter source = new MlflowArtifactSourceAdapter(client);

    assertThat(source.supports("runs:/run-a/model")).isTrue();
    assertThat(source.supports("models:/churn_classifier/4")).isTrue();
    assertThat(source.supports("dbfs:/databricks/mlflow-tracking/1/run-a/artifacts/model")).isTrue();
    assertThat(source.supports("mlflow-artifacts:/1/run-a/artifacts/model")).isTrue();
    assertThat(source.supports("s3://bucket/model")).isFalse();
    assertThat(source.supports(null)).isFalse();
  }

  @Test
  void resolves_artifact_path_from_each_uri_form() throws Exception {
    MlflowArtifactSourceAdapter source = new MlflowArtifactSourceAdapter(client);
    when(client.getJson(eq(MlflowArtifactSourceAdapter.DOWNLOAD_URI_PATH), anyMap()))
        .thenReturn(json("{\"artifact_uri\":\"dbfs:/databricks/mlflow-tracking/1/run-a/artifacts/sk_model/\"}"));

    assertThat(source.artifactPath(version("runs:/run-a/model"))).isEqualTo("model");
    assertThat(source.artifactPath(version("runs:/run-a"))).isEmpty();
    assertThat(source.artifactPath(version("dbfs:/databricks/mlflow-tracking/1/run-a/artifacts/model/")))
        .isEqualTo("model");
    assertThat(source.artifactPath(version("models:/churn_classifier/4"))).isEqualTo("sk_model");
  }

  @Test
  void uri_without_artifact_root_is_not_repackageable() {
    MlflowArtifactSourceAdapter source = new MlflowArtifactSourceAdapter(client);

    assertThatThrownBy(() -> source.artifactPath(version("dbfs:/somewhere/else")))
        .isInstanceOf(RepackagingException.class);
  }

  @Test
  void downloads_the_tree_relative_to_the_bundle_root() throws Exception {
    when(client.getJson(eq(MlflowArtifactSourceAdapter.LIST_PATH), argThat(q -> q != null && "model".equals(q.get("path")))))
        .thenReturn(
            json(
                "{\"files\":[{\"path\":\"model/MLmodel\",\"is_dir\":false},"
                    + "{\"path\":\"model/data\",\"is_dir\":true}]}"));
    when(client.getJson(eq(MlflowArtifactSourceAdapter.LIST_PATH), argThat(q -> q != null && "model/data".equals(q.get("path")))))
        .thenReturn(json("{\"files\":[{\"path\":\"model/data/model.pkl\",\"is_dir\":false}]}"));
    doAnswer(
            inv -> {
              Map<String, String> query = inv.getArgument(1);
              Path target = inv.getArgument(2);
              Files.writeString(target, "content of " + query.get("path"));
              return null;
            })
        .when(client)
        .download(eq(MlflowArtifactSourceAdapter.DOWNLOAD_PATH), anyMap(), any(Path.class));

    new MlflowArtifactSourceAdapter(client).download(version("runs:/run-a/model"), bundle);

    assertThat(bundle.resolve("MLmodel")).hasContent("content of model/MLmodel");
    assertThat(Files.readString(bundle.resolve("data/model.pkl"), StandardCharsets.UTF_8))
        .isEqualTo("content of model/data/model.pkl");
  }

  @Test
  void empty_or_missing_artifact_is_not_repackageable() throws Exception {
    when(client.getJson(eq(MlflowArtifactSourceAdapter.LIST_PATH), anyMap())).thenReturn(json("{}"));
    MlflowArtifactSourceAdapter source = new MlflowArtifactSourceAdapter(client);

    assertThatThrownBy(() -> source.download(version("runs:/run-a/model"), bundle))
        .isInstanceOf(RepackagingException.class)
        .hasMessageContaining("No artifact files");
  }

  @Test
  void missing_run_becomes_repackaging_failure_while_outages_propagate() {
    MlflowArtifactSourceAdapter source = new MlflowArtifactSourceAdapter(client);
    when(client.getJson(eq(MlflowArtifactSourceAdapter.LIST_PATH), anyMap()))
        .thenThrow(new RegistryAccessException(FailureKind.NOT_FOUND, "no such run"))
        .thenThrow(new RegistryAccessException(FailureKind.UNAVAILABLE, "down"));

    assertThatThrownBy(() -> source.download(version("runs:/run-a/model"), bundle))
        .isInstanceOf(RepackagingException.class);
    assertThatThrownBy(() -> source.download(version("runs:/run-a/model"), bundle))
        .isInstanceOfSatisfying(
            RegistryAccessException.class, e -> assertThat(e.isRetryable()).isTrue());
  }
}
