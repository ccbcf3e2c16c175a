package com.streamfirst.registry.sync.adapters.registry.mlflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamfirst.registry.sync.domain.ModelName;
import com.streamfirst.registry.sync.domain.ModelStage;
import com.streamfirst.registry.sync.domain.StageTransitionNotification;
import com.streamfirst.registry.sync.domain.WebhookRejectedException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;

/**
 * Verifies and decodes registry webhook deliveries. Every delivery must carry an {@code
 * X-Databricks-Signature} header holding the hex HMAC-SHA256 of the raw body keyed with the shared
 * webhook secret.
 */
@Slf4j
public class MlflowWebhookDecoder {

  public static final String SIGNATURE_HEADER = "X-Databricks-Signature";

  private final byte[] key;
  private final ObjectMapper objectMapper;

  public MlflowWebhookDecoder(String secret, ObjectMapper objectMapper) {
    if (secret == null || secret.isEmpty()) {
      throw new IllegalArgumentException("Webhook secret cannot be empty");
    }
    this.key = secret.getBytes(StandardCharsets.UTF_8);
    this.objectMapper = objectMapper;
  }

  /**
   * Checks the signature of a delivery and turns its body into a notification.
   *
   * @param headers the request headers; names are matched case-insensitively
   * @param body the raw request body
   * @throws WebhookRejectedException if the signature is missing or wrong, or the body is unusable
   */
  public StageTransitionNotification decode(Map<String, String> headers, byte[] body) {
    verify(headers, body);

    JsonNode payload;
    try {
      payload = objectMapper.readTree(body);
    } catch (IOException e) {
      throw new WebhookRejectedException("Webhook body is not valid JSON", e);
    }
    String modelName = payload.path("model_name").asText("");
    if (modelName.isBlank()) {
      throw new WebhookRejectedException("Webhook body has no model_name");
    }

    String event = payload.path("event").asText("");
    String version = payload.path("version").asText("");
    if (version.isBlank()) {
      log.info("Received {} for model {} without a version, syncing the whole model", event, modelName);
      return StageTransitionNotification.fullSync(ModelName.of(modelName));
    }
    try {
      ModelStage stage = ModelStage.parse(payload.path("to_stage").asText(null));
      log.info("Received {} for model {} version {} to {}", event, modelName, version, stage);
      return StageTransitionNotification.transition(ModelName.of(modelName), Long.parseLong(version), stage);
    } catch (IllegalArgumentException e) {
      throw new WebhookRejectedException("Webhook body is malformed: " + e.getMessage(), e);
    }
  }

  private void verify(Map<String, String> headers, byte[] body) {
    String signature = header(headers, SIGNATURE_HEADER);
    if (signature == null || signature.isBlank()) {
      log.warn("Rejected webhook delivery without {}", SIGNATURE_HEADER);
      throw new WebhookRejectedException("No " + SIGNATURE_HEADER + " header, delivery cannot be trusted");
    }
    // HmacUtils wraps a Mac, which is not thread-safe
    String digest = new HmacUtils(HmacAlgorithms.HMAC_SHA_256, key).hmacHex(body);
    byte[] expected = digest.getBytes(StandardCharsets.US_ASCII);
    byte[] actual = signature.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);
    if (!MessageDigest.isEqual(expected, actual)) {
      log.warn("Rejected webhook delivery with a mismatching signature");
      throw new WebhookRejectedException(SIGNATURE_HEADER + " mismatch, delivery cannot be trusted");
    }
  }

  private static String header(Map<String, String> headers, String name) {
    for (Map.Entry<String, String> entry : headers.entrySet()) {
      if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(name)) {
        return entry.getValue();
      }
    }
    return null;
  }
}
