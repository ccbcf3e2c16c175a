package com.streamfirst.registry.sync.domain;

/** Raised by adapters when a call to an external registry fails. */
public class RegistryAccessException extends SyncException {

  private final FailureKind kind;

  public RegistryAccessException(FailureKind kind, String message) {
    this(kind, message, null);
  }

  public RegistryAccessException(FailureKind kind, String message, Throwable cause) {
    super(message, kind.isRetryable(), kind.name(), cause);
    this.kind = kind;
  }

  public FailureKind kind() {
    return kind;
  }
}
