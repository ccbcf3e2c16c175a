package com.streamfirst.registry.sync.adapters;

import static org.assertj.core.api.Assertions.assertThat;

import com.streamfirst.registry.sync.domain.ModelName;
import com.streamfirst.registry.sync.ports.LeasePort.Lease;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class InMemoryLeaseAdapterTest {

  private static final ModelName MODEL = ModelName.of("churn_classifier");
  private static final Duration TTL = Duration.ofMinutes(5);

  /** Clock the test moves by hand. */
  private static final class MutableClock extends Clock {
    private volatile Instant now = Instant.parse("2024-06-01T12:00:00Z");

    void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }

  private final MutableClock clock = new MutableClock();
  private final InMemoryLeaseAdapter leases = new InMemoryLeaseAdapter(clock);

  @Test
  void lease_is_exclusive_per_model() {
    Optional<Lease> first = leases.tryAcquire(MODEL, "a", TTL, Duration.ZERO);
    Optional<Lease> second = leases.tryAcquire(MODEL, "b", TTL, Duration.ZERO);
    Optional<Lease> other = leases.tryAcquire(ModelName.of("fraud_detector"), "b", TTL, Duration.ZERO);

    assertThat(first).isPresent();
    assertThat(second).isEmpty();
    assertThat(other).isPresent();
  }

  @Test
  void released_lease_can_be_taken_again() {
    Lease first = leases.tryAcquire(MODEL, "a", TTL, Duration.ZERO).orElseThrow();

    leases.release(first);

    assertThat(leases.tryAcquire(MODEL, "b", TTL, Duration.ZERO)).isPresent();
  }

  @Test
  void expired_lease_is_taken_over() {
    Lease first = leases.tryAcquire(MODEL, "a", TTL, Duration.ZERO).orElseThrow();
    clock.advance(TTL.plusSeconds(1));

    Lease second = leases.tryAcquire(MODEL, "b", TTL, Duration.ZERO).orElseThrow();

    assertThat(second.holder()).isEqualTo("b");
    assertThat(leases.renew(first, TTL)).isFalse();
    // Releasing the stale lease must not drop the new holder's lease
    leases.release(first);
    assertThat(leases.currentLease(MODEL)).contains(second);
  }

  @Test
  void renew_extends_a_held_lease() {
    Lease lease = leases.tryAcquire(MODEL, "a", TTL, Duration.ZERO).orElseThrow();
    clock.advance(Duration.ofMinutes(4));

    assertThat(leases.renew(lease, TTL)).isTrue();
    clock.advance(Duration.ofMinutes(4));

    assertThat(leases.tryAcquire(MODEL, "b", TTL, Duration.ZERO)).isEmpty();
  }

  @Test
  void revoked_lease_cannot_be_renewed() {
    Lease lease = leases.tryAcquire(MODEL, "a", TTL, Duration.ZERO).orElseThrow();

    leases.revoke(MODEL);

    assertThat(leases.renew(lease, TTL)).isFalse();
  }

  @Test
  void waiter_gets_the_lease_once_it_is_released() throws Exception {
    InMemoryLeaseAdapter realTime = new InMemoryLeaseAdapter();
    Lease held = realTime.tryAcquire(MODEL, "a", TTL, Duration.ZERO).orElseThrow();

    CompletableFuture<Optional<Lease>> waiter =
        CompletableFuture.supplyAsync(() -> realTime.tryAcquire(MODEL, "b", TTL, Duration.ofSeconds(5)));
    Thread.sleep(100);
    assertThat(waiter).isNotDone();
    realTime.release(held);

    Optional<Lease> granted = waiter.get(5, TimeUnit.SECONDS);
    assertThat(granted).isPresent();
    assertThat(granted.get().holder()).isEqualTo("b");
  }

  @Test
  void waiter_gives_up_after_its_wait() {
    InMemoryLeaseAdapter realTime = new InMemoryLeaseAdapter();
    realTime.tryAcquire(MODEL, "a", TTL, Duration.ZERO).orElseThrow();

    long start = System.nanoTime();
    Optional<Lease> lease = realTime.tryAcquire(MODEL, "b", TTL, Duration.ofMillis(150));

    assertThat(lease).isEmpty();
    assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(100));
  }
}
