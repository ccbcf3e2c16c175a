package com.streamfirst.registry.sync.domain;

/**
 * A write to the target registry failed. Retryable unless the registry refused the call for
 * authorization reasons or because the package no longer exists.
 */
public class RegistrationException extends SyncException {

  public RegistrationException(String message, boolean retryable, Throwable cause) {
    super(message, retryable, retryable ? "REGISTRATION_RETRYABLE" : "REGISTRATION_REJECTED", cause);
  }

  /** Wraps an adapter failure, keeping its retry classification. */
  public static RegistrationException from(String message, SyncException cause) {
    return new RegistrationException(message + ": " + cause.getMessage(), cause.isRetryable(), cause);
  }
}
