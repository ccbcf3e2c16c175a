package com.streamfirst.registry.sync.domain;

/**
 * Base of every failure raised while synchronizing the registries. Each failure says whether trying
 * again later can succeed; callers pick their retry policy from that, adapters never retry on their
 * own.
 */
public abstract class SyncException extends RuntimeException {

  private final boolean retryable;
  private final String errorCode;

  protected SyncException(String message, boolean retryable, String errorCode, Throwable cause) {
    super(message, cause);
    this.retryable = retryable;
    this.errorCode = errorCode;
  }

  public boolean isRetryable() {
    return retryable;
  }

  public String errorCode() {
    return errorCode;
  }
}
