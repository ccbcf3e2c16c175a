package com.streamfirst.registry.sync.domain;

/** Another pass holds the model's lease for longer than the caller was willing to wait. */
public class LeaseUnavailableException extends SyncException {

  public LeaseUnavailableException(ModelName modelName) {
    super("Lease for model " + modelName + " is held by another pass", true, "LEASE_UNAVAILABLE", null);
  }
}
