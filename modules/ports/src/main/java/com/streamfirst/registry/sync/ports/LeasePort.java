package com.streamfirst.registry.sync.ports;

import com.streamfirst.registry.sync.domain.ModelName;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Exclusive, expiring leases on a name. The engine leases the package group name, so at most one
 * pass at a time writes to a group, even when several source models map to it.
 */
public interface LeasePort {

  /** A granted lease. The holder must release it when the pass ends. */
  record Lease(String leaseId, ModelName modelName, String holder, Instant expiresAt) {}

  /**
   * Tries to obtain the lease for a model, waiting up to {@code wait} for a current holder to release
   * it. Expired leases are treated as released.
   *
   * @param modelName the model to lock
   * @param holder identifies the caller, for diagnostics
   * @param ttl how long the lease stays valid without renewal
   * @param wait how long to wait for the lease to become free
   * @return the lease, or empty if it could not be obtained in time
   */
  Optional<Lease> tryAcquire(ModelName modelName, String holder, Duration ttl, Duration wait);

  /** Extends a lease that is still held. Returns false if it was lost in the meantime. */
  boolean renew(Lease lease, Duration ttl);

  /** Releases a lease. Releasing a lease that already expired or was taken over is a no-op. */
  void release(Lease lease);
}
