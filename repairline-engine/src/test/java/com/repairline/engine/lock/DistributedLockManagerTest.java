package com.repairline.engine.lock;

import com.repairline.core.exception.ResourceBusyException;
import com.repairline.core.model.ExecutionLock;
import com.repairline.core.test.MutableClock;
import com.repairline.engine.metrics.EngineMetrics;
import com.repairline.engine.persistence.InMemoryLockRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DistributedLockManagerTest {

    private static final Duration TTL = Duration.ofSeconds(60);

    private MutableClock clock;
    private InMemoryLockRepository repository;
    private DistributedLockManager locks;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at(Instant.parse("2026-03-01T10:00:00Z"));
        repository = new InMemoryLockRepository();
        locks = new DistributedLockManager(repository, EngineMetrics.noop(), clock);
    }

    @AfterEach
    void tearDown() {
        locks.shutdown();
    }

    @Test
    @DisplayName("A free resource is acquired and a second acquirer is told it is busy")
    void secondAcquirerIsBusy() {
        Optional<ExecutionLock> first = locks.acquire("job:a", TTL);
        Optional<ExecutionLock> second = locks.acquire("job:a", TTL);

        assertThat(first).isPresent();
        assertThat(second).isEmpty();
        assertThatThrownBy(() -> locks.acquireOrThrow("job:a", TTL))
            .isInstanceOf(ResourceBusyException.class);
    }

    @Test
    @DisplayName("Releasing requires the holder token")
    void releaseRequiresToken() {
        ExecutionLock lock = locks.acquire("job:b", TTL).orElseThrow();

        assertThat(locks.release("job:b", "someone-else")).isFalse();
        assertThat(locks.inspect("job:b")).isPresent();

        assertThat(locks.release("job:b", lock.holderToken())).isTrue();
        assertThat(locks.inspect("job:b")).isEmpty();
        assertThat(locks.acquire("job:b", TTL)).isPresent();
    }

    @Test
    @DisplayName("An expired lock is reclaimable and the old holder can no longer renew or release it")
    void expiredLockIsReclaimable() {
        ExecutionLock crashed = locks.acquire("job:c", TTL).orElseThrow();

        clock.advance(TTL.plusSeconds(1));
        ExecutionLock next = locks.acquire("job:c", TTL).orElseThrow();

        assertThat(next.holderToken()).isNotEqualTo(crashed.holderToken());
        assertThat(next.fenceToken()).isGreaterThan(crashed.fenceToken());
        assertThat(locks.renew("job:c", crashed.holderToken(), TTL)).isFalse();
        assertThat(locks.release("job:c", crashed.holderToken())).isFalse();
    }

    @Test
    @DisplayName("Renewing pushes the expiry forward")
    void renewExtendsLease() {
        ExecutionLock lock = locks.acquire("job:d", TTL).orElseThrow();

        clock.advance(Duration.ofSeconds(50));
        assertThat(locks.renew("job:d", lock.holderToken(), TTL)).isTrue();
        clock.advance(Duration.ofSeconds(50));

        assertThat(locks.acquire("job:d", TTL)).isEmpty();
        assertThat(locks.inspect("job:d")).get()
            .extracting(ExecutionLock::renewalCount).isEqualTo(1);
    }

    @Test
    @DisplayName("Fence tokens keep increasing across release and reacquire")
    void fenceTokensIncrease() {
        ExecutionLock first = locks.acquire("job:e", TTL).orElseThrow();
        locks.release("job:e", first.holderToken());
        ExecutionLock second = locks.acquire("job:e", TTL).orElseThrow();

        assertThat(second.fenceToken()).isEqualTo(first.fenceToken() + 1);
    }

    @Test
    @DisplayName("Only one of many concurrent acquirers wins")
    void concurrentAcquireHasSingleWinner() throws Exception {
        DistributedLockManager shared = new DistributedLockManager(
            new InMemoryLockRepository(), EngineMetrics.noop(), Clock.systemUTC());
        int contenders = 16;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();
        try {
            for (int i = 0; i < contenders; i++) {
                pool.submit(() -> {
                    start.await();
                    if (shared.acquire("job:race", TTL).isPresent()) {
                        winners.incrementAndGet();
                    }
                    return null;
                });
            }
            start.countDown();
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
            assertThat(winners.get()).isEqualTo(1);
        } finally {
            pool.shutdownNow();
            shared.shutdown();
        }
    }

    @Test
    @DisplayName("Background renewal keeps a short lease alive until closed")
    void scheduledRenewalKeepsLeaseAlive() throws Exception {
        DistributedLockManager realTime = new DistributedLockManager(
            new InMemoryLockRepository(), EngineMetrics.noop(), Clock.systemUTC());
        Duration shortTtl = Duration.ofMillis(300);
        try {
            ExecutionLock lock = realTime.acquire("job:renew", shortTtl).orElseThrow();

            try (DistributedLockManager.RenewalHandle handle = realTime.scheduleRenewal(lock, shortTtl)) {
                Thread.sleep(900);
                assertThat(handle.isLost()).isFalse();
                assertThat(realTime.acquire("job:renew", shortTtl)).isEmpty();
            }

            Thread.sleep(600);
            assertThat(realTime.acquire("job:renew", shortTtl)).isPresent();
        } finally {
            realTime.shutdown();
        }
    }

    @Test
    @DisplayName("Background renewal reports a lost lease")
    void scheduledRenewalDetectsLoss() throws Exception {
        DistributedLockManager realTime = new DistributedLockManager(
            new InMemoryLockRepository(), EngineMetrics.noop(), Clock.systemUTC());
        Duration shortTtl = Duration.ofMillis(300);
        try {
            ExecutionLock lock = realTime.acquire("job:lost", shortTtl).orElseThrow();
            realTime.release("job:lost", lock.holderToken());

            try (DistributedLockManager.RenewalHandle handle = realTime.scheduleRenewal(lock, shortTtl)) {
                Thread.sleep(400);
                assertThat(handle.isLost()).isTrue();
            }
        } finally {
            realTime.shutdown();
        }
    }

    @Test
    @DisplayName("Expired lock rows are purged after the grace period")
    void purgeExpired() {
        locks.acquire("job:old", TTL);
        locks.acquire("job:young", Duration.ofHours(1));

        clock.advance(Duration.ofMinutes(10));

        assertThat(locks.purgeExpired(Duration.ofMinutes(1))).isEqualTo(1);
    }

    @Test
    @DisplayName("Released locks are purged with their fence state once past the grace period")
    void purgeReleased() {
        ExecutionLock first = locks.acquire("job:done", TTL).orElseThrow();
        assertThat(locks.release("job:done", first.holderToken())).isTrue();
        clock.advance(Duration.ofMinutes(9));
        ExecutionLock recent = locks.acquire("job:recent", TTL).orElseThrow();
        assertThat(locks.release("job:recent", recent.holderToken())).isTrue();

        clock.advance(Duration.ofMinutes(1));

        assertThat(locks.purgeExpired(Duration.ofMinutes(5))).isEqualTo(1);
        assertThat(locks.acquire("job:done", TTL).orElseThrow().fenceToken()).isEqualTo(1);
        assertThat(locks.acquire("job:recent", TTL).orElseThrow().fenceToken()).isEqualTo(2);
    }
}
