package com.streamfirst.registry.sync.domain;

/** A transient failure while reading or writing artifact storage. */
public class StorageException extends SyncException {

  public StorageException(String message, Throwable cause) {
    this(message, true, cause);
  }

  public StorageException(String message, boolean retryable, Throwable cause) {
    super(message, retryable, retryable ? "STORAGE_UNAVAILABLE" : "STORAGE_REJECTED", cause);
  }
}
