package com.streamfirst.registry.sync.domain;

/** Current state could not be read from one of the registries. Always retryable. */
public class ResolutionException extends SyncException {

  public ResolutionException(String message, Throwable cause) {
    super(message, true, "RESOLUTION_FAILED", cause);
  }
}
