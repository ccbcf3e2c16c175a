package com.streamfirst.registry.sync.adapters.registry.mlflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamfirst.registry.sync.domain.FailureKind;
import com.streamfirst.registry.sync.domain.RegistryAccessException;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Map;
import java.util.StringJoiner;
import lombok.extern.slf4j.Slf4j;

/**
 * Minimal client for the MLflow tracking server REST API, authenticating with a bearer token the way
 * Databricks workspaces expect. Translates HTTP failures into {@link RegistryAccessException}s.
 */
@Slf4j
public class MlflowRestClient {

  private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(60);

  private final URI trackingUri;
  private final String token;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;

  public MlflowRestClient(URI trackingUri, String token, HttpClient httpClient, ObjectMapper objectMapper) {
    this.trackingUri = trackingUri;
    this.token = token;
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
  }

  public MlflowRestClient(URI trackingUri, String token) {
    this(
        trackingUri,
        token,
        HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
        new ObjectMapper());
  }

  /**
   * Calls a GET endpoint and parses the JSON response.
   *
   * @param path the endpoint path, e.g. {@code /api/2.0/mlflow/model-versions/search}
   * @param query query parameters; null values are left out
   */
  public JsonNode getJson(String path, Map<String, String> query) {
    HttpResponse<InputStream> response = send(path, query);
    try (InputStream body = response.body()) {
      return objectMapper.readTree(body);
    } catch (IOException e) {
      throw new RegistryAccessException(
          FailureKind.UNAVAILABLE, "Unreadable response from " + path + ": " + e.getMessage(), e);
    }
  }

  /** Streams the response of a GET endpoint into a file, replacing it if present. */
  public void download(String path, Map<String, String> query, Path target) {
    HttpResponse<InputStream> response = send(path, query);
    try (InputStream body = response.body()) {
      Files.copy(body, target, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      throw new RegistryAccessException(
          FailureKind.UNAVAILABLE, "Interrupted download from " + path + ": " + e.getMessage(), e);
    }
  }

  private HttpResponse<InputStream> send(String path, Map<String, String> query) {
    URI uri = resolve(path, query);
    HttpRequest.Builder request = HttpRequest.newBuilder(uri).timeout(REQUEST_TIMEOUT).GET();
    if (token != null && !token.isBlank()) {
      request.header("Authorization", "Bearer " + token);
    }
    HttpResponse<InputStream> response;
    try {
      response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofInputStream());
    } catch (IOException e) {
      throw new RegistryAccessException(
          FailureKind.UNAVAILABLE, "Cannot reach MLflow at " + trackingUri + ": " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RegistryAccessException(FailureKind.UNAVAILABLE, "Interrupted calling " + path, e);
    }

    int status = response.statusCode();
    if (status >= 200 && status < 300) {
      return response;
    }
    String detail = readError(response);
    FailureKind kind = classify(status);
    log.debug("MLflow call {} failed with {}: {}", path, status, detail);
    throw new RegistryAccessException(kind, "MLflow call " + path + " failed with HTTP " + status + ": " + detail);
  }

  static FailureKind classify(int status) {
    if (status == 429) {
      return FailureKind.THROTTLED;
    }
    if (status >= 500) {
      return FailureKind.UNAVAILABLE;
    }
    if (status == 401 || status == 403) {
      return FailureKind.UNAUTHORIZED;
    }
    if (status == 404) {
      return FailureKind.NOT_FOUND;
    }
    return FailureKind.INVALID_REQUEST;
  }

  private URI resolve(String path, Map<String, String> query) {
    String base = trackingUri.toString();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    StringJoiner parameters = new StringJoiner("&", "?", "").setEmptyValue("");
    query.forEach(
        (name, value) -> {
          if (value != null) {
            parameters.add(encode(name) + "=" + encode(value));
          }
        });
    return URI.create(base + path + parameters);
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  private static String readError(HttpResponse<InputStream> response) {
    try (InputStream body = response.body()) {
      String text = new String(body.readAllBytes(), StandardCharsets.UTF_8);
      return text.length() > 500 ? text.substring(0, 500) + "..." : text;
    } catch (IOException e) {
      return "<unreadable body: " + e.getMessage() + ">";
    }
  }
}
