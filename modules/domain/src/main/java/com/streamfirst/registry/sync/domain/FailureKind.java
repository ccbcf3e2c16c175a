package com.streamfirst.registry.sync.domain;

/** Classification of a failed call to an external registry or store. */
public enum FailureKind {
  /** The remote side rejected the call because of rate limits */
  THROTTLED(true),
  /** Network failure, timeout or a server side error */
  UNAVAILABLE(true),
  /** Credentials missing, expired or not allowed to perform the call */
  UNAUTHORIZED(false),
  /** The addressed resource does not exist */
  NOT_FOUND(false),
  /** The remote side refused the request as malformed */
  INVALID_REQUEST(false);

  private final boolean retryable;

  FailureKind(boolean retryable) {
    this.retryable = retryable;
  }

  public boolean isRetryable() {
    return retryable;
  }
}
