package com.streamfirst.registry.sync.domain;

/** An inbound webhook call failed signature verification or could not be decoded. */
public class WebhookRejectedException extends SyncException {

  public WebhookRejectedException(String message) {
    this(message, null);
  }

  public WebhookRejectedException(String message, Throwable cause) {
    super(message, false, "WEBHOOK_REJECTED", cause);
  }
}
