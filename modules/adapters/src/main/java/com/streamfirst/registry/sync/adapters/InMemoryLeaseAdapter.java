package com.streamfirst.registry.sync.adapters;

import com.streamfirst.registry.sync.domain.ModelName;
import com.streamfirst.registry.sync.ports.LeasePort;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * In-process leases for a single service instance. Waiters block on a condition until the lease is
 * released or expires.
 */
@Slf4j
public class InMemoryLeaseAdapter implements LeasePort {

  private final Map<ModelName, Lease> leases = new HashMap<>();
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition released = lock.newCondition();
  private final Clock clock;

  public InMemoryLeaseAdapter() {
    this(Clock.systemUTC());
  }

  public InMemoryLeaseAdapter(Clock clock) {
    this.clock = clock;
  }

  @Override
  public Optional<Lease> tryAcquire(ModelName modelName, String holder, Duration ttl, Duration wait) {
    long remainingNanos = wait.toNanos();
    lock.lock();
    try {
      while (true) {
        Lease current = leases.get(modelName);
        Instant now = clock.instant();
        if (current == null || !current.expiresAt().isAfter(now)) {
          if (current != null) {
            log.warn("Lease {} on model {} held by {} expired, taking over", current.leaseId(), modelName, current.holder());
          }
          Lease lease = new Lease(UUID.randomUUID().toString(), modelName, holder, now.plus(ttl));
          leases.put(modelName, lease);
          log.debug("Granted lease {} on model {} to {}", lease.leaseId(), modelName, holder);
          return Optional.of(lease);
        }
        if (remainingNanos <= 0) {
          log.debug("Lease on model {} is held by {} until {}", modelName, current.holder(), current.expiresAt());
          return Optional.empty();
        }
        // Wake up at the latest when the current lease expires
        long untilExpiry = Duration.between(now, current.expiresAt()).toNanos();
        long slice = Math.min(remainingNanos, Math.max(1, untilExpiry));
        long left = released.awaitNanos(slice);
        remainingNanos -= slice - Math.max(0, left);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for lease on model {}", modelName);
      return Optional.empty();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean renew(Lease lease, Duration ttl) {
    lock.lock();
    try {
      Lease current = leases.get(lease.modelName());
      Instant now = clock.instant();
      if (current == null || !current.leaseId().equals(lease.leaseId()) || !current.expiresAt().isAfter(now)) {
        log.warn("Lease {} on model {} is no longer held", lease.leaseId(), lease.modelName());
        return false;
      }
      leases.put(lease.modelName(), new Lease(current.leaseId(), current.modelName(), current.holder(), now.plus(ttl)));
      return true;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void release(Lease lease) {
    lock.lock();
    try {
      Lease current = leases.get(lease.modelName());
      if (current != null && current.leaseId().equals(lease.leaseId())) {
        leases.remove(lease.modelName());
        log.debug("Released lease {} on model {}", lease.leaseId(), lease.modelName());
        released.signalAll();
      }
    } finally {
      lock.unlock();
    }
  }

  /** Gets the lease currently recorded for a model, expired or not. */
  public Optional<Lease> currentLease(ModelName modelName) {
    lock.lock();
    try {
      return Optional.ofNullable(leases.get(modelName));
    } finally {
      lock.unlock();
    }
  }

  /** Forcibly drops a lease, as if its holder had crashed and it was reclaimed. */
  public void revoke(ModelName modelName) {
    lock.lock();
    try {
      leases.remove(modelName);
      released.signalAll();
    } finally {
      lock.unlock();
    }
  }
}
