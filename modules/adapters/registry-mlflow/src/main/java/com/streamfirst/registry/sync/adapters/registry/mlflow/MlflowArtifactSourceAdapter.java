package com.streamfirst.registry.sync.adapters.registry.mlflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.streamfirst.registry.sync.domain.FailureKind;
import com.streamfirst.registry.sync.domain.RegistryAccessException;
import com.streamfirst.registry.sync.domain.RepackagingException;
import com.streamfirst.registry.sync.domain.SourceModelVersion;
import com.streamfirst.registry.sync.domain.StorageException;
import com.streamfirst.registry.sync.ports.ArtifactSourcePort;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Downloads a version's artifact bundle through the tracking server's artifact endpoints. Handles
 * {@code runs:/}, {@code models:/} and the stored run artifact URIs ({@code dbfs:/},
 * {@code mlflow-artifacts:/}) whose path contains the run's {@code artifacts/} root.
 */
@Slf4j
@RequiredArgsConstructor
public class MlflowArtifactSourceAdapter implements ArtifactSourcePort {

  static final String LIST_PATH = "/api/2.0/mlflow/artifacts/list";
  static final String DOWNLOAD_PATH = "/get-artifact";
  static final String DOWNLOAD_URI_PATH = "/api/2.0/mlflow/model-versions/get-download-uri";

  private static final List<String> SCHEMES = List.of("runs:/", "models:/", "dbfs:/", "mlflow-artifacts:/");
  private static final String ARTIFACTS_ROOT = "/artifacts/";

  private final MlflowRestClient client;

  @Override
  public boolean supports(String artifactUri) {
    return artifactUri != null && SCHEMES.stream().anyMatch(artifactUri::startsWith);
  }

  @Override
  public void download(SourceModelVersion version, Path targetDirectory) {
    String runId = version.getRunId().value();
    String artifactPath = artifactPath(version);
    log.debug("Downloading artifacts of run {} under '{}' for {}", runId, artifactPath, version);
    int count;
    try {
      count = downloadTree(runId, artifactPath, artifactPath, targetDirectory);
    } catch (IOException e) {
      throw new StorageException("Failed to stage artifact of " + version, e);
    } catch (RegistryAccessException e) {
      if (e.kind() == FailureKind.NOT_FOUND) {
        throw new RepackagingException("Artifact of " + version + " does not exist: " + e.getMessage(), e);
      }
      throw e;
    }
    if (count == 0) {
      throw new RepackagingException("No artifact files found for " + version + " at " + version.getArtifactUri());
    }
    log.debug("Downloaded {} files for {}", count, version);
  }

  /** Path of the bundle relative to the run's artifact root. */
  String artifactPath(SourceModelVersion version) {
    String uri = version.getArtifactUri();
    if (uri.startsWith("models:/")) {
      Map<String, String> query = new LinkedHashMap<>();
      query.put("name", version.getModelName().value());
      query.put("version", Long.toString(version.getVersion()));
      uri = client.getJson(DOWNLOAD_URI_PATH, query).path("artifact_uri").asText("");
    }
    if (uri.startsWith("runs:/")) {
      String rest = uri.substring("runs:/".length());
      int slash = rest.indexOf('/');
      return slash < 0 ? "" : trimSlashes(rest.substring(slash + 1));
    }
    int root = uri.indexOf(ARTIFACTS_ROOT);
    if (root < 0) {
      throw new RepackagingException("Cannot locate the run artifact root in " + uri);
    }
    return trimSlashes(uri.substring(root + ARTIFACTS_ROOT.length()));
  }

  private int downloadTree(String runId, String rootPath, String path, Path targetDirectory) throws IOException {
    int count = 0;
    String pageToken = null;
    do {
      Map<String, String> query = new LinkedHashMap<>();
      query.put("run_id", runId);
      query.put("path", path);
      query.put("page_token", pageToken);
      JsonNode listing = client.getJson(LIST_PATH, query);
      for (JsonNode file : listing.path("files")) {
        String filePath = file.path("path").asText();
        if (file.path("is_dir").asBoolean(false)) {
          count += downloadTree(runId, rootPath, filePath, targetDirectory);
          continue;
        }
        String relative = rootPath.isEmpty() ? filePath : filePath.substring(rootPath.length() + 1);
        Path target = targetDirectory.resolve(relative).normalize();
        if (!target.startsWith(targetDirectory)) {
          throw new RepackagingException("Artifact path escapes the bundle directory: " + filePath);
        }
        Files.createDirectories(target.getParent());
        Map<String, String> download = new LinkedHashMap<>();
        download.put("run_id", runId);
        download.put("path", filePath);
        client.download(DOWNLOAD_PATH, download, target);
        count++;
      }
      pageToken = listing.path("next_page_token").asText(null);
    } while (pageToken != null && !pageToken.isEmpty());
    return count;
  }

  private static String trimSlashes(String path) {
    String trimmed = path;
    while (trimmed.startsWith("/")) {
      trimmed = trimmed.substring(1);
    }
    while (trimmed.endsWith("/")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    return trimmed;
  }
}
