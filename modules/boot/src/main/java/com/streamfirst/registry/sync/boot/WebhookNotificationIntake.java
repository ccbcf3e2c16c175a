package com.streamfirst.registry.sync.boot;

import com.streamfirst.registry.sync.adapters.registry.mlflow.MlflowWebhookDecoder;
import com.streamfirst.registry.sync.application.NotificationDispatcher;
import com.streamfirst.registry.sync.domain.ReconciliationReport;
import com.streamfirst.registry.sync.domain.StageTransitionNotification;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for raw webhook deliveries, for whatever HTTP front end receives them. Verifies and
 * decodes a delivery, then hands it to the dispatcher.
 */
@Slf4j
@RequiredArgsConstructor
public class WebhookNotificationIntake {

  private final MlflowWebhookDecoder decoder;
  private final NotificationDispatcher dispatcher;

  /**
   * Accepts one delivery.
   *
   * @return completes with the report of the pass covering the delivery
   * @throws com.streamfirst.registry.sync.domain.WebhookRejectedException if the delivery is not
   *     trusted or not understood
   */
  public CompletableFuture<ReconciliationReport> accept(Map<String, String> headers, byte[] body) {
    StageTransitionNotification notification = decoder.decode(headers, body);
    log.debug("Accepted webhook delivery as {}", notification);
    return dispatcher.submit(notification);
  }
}
