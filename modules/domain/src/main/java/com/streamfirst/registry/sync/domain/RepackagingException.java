package com.streamfirst.registry.sync.domain;

/**
 * The source artifact cannot be turned into a deployable archive: it is malformed or its flavor is
 * not supported. Retrying does not help; only the affected run fails.
 */
public class RepackagingException extends SyncException {

  public RepackagingException(String message) {
    this(message, null);
  }

  public RepackagingException(String message, Throwable cause) {
    super(message, false, "REPACKAGING_FAILED", cause);
  }
}
