package com.repairline.engine.lock;

import com.repairline.core.exception.ResourceBusyException;
import com.repairline.core.model.ExecutionLock;
import com.repairline.core.repository.LockRepository;
import com.repairline.engine.metrics.EngineMetrics;
import com.repairline.engine.service.LockService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lease-based lock manager.
 *
 * Locks are never blocking: a busy resource is reported immediately and the caller
 * decides whether to retry later. Long-running holders keep their lease alive with
 * {@link #scheduleRenewal(ExecutionLock, Duration)}.
 */
public class DistributedLockManager implements LockService {

    private static final Logger log = LoggerFactory.getLogger(DistributedLockManager.class);

    private final LockRepository repository;
    private final EngineMetrics metrics;
    private final Clock clock;
    private final ScheduledExecutorService renewalExecutor;

    public DistributedLockManager(LockRepository repository, EngineMetrics metrics, Clock clock) {
        this.repository = repository;
        this.metrics = metrics;
        this.clock = clock;
        AtomicInteger threadCount = new AtomicInteger();
        this.renewalExecutor = Executors.newScheduledThreadPool(1, r -> {
            Thread t = new Thread(r, "lock-renewal-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public Optional<ExecutionLock> acquire(String resourceKey, Duration ttl) {
        requireKey(resourceKey);
        Duration lease = ttl == null ? ExecutionLock.DEFAULT_TTL : ttl;
        if (lease.isZero() || lease.isNegative()) {
            throw new IllegalArgumentException("Lock TTL must be positive");
        }
        Instant now = now();
        Optional<ExecutionLock> acquired = repository.tryAcquire(ExecutionLock.create(resourceKey, lease, now), now);
        metrics.lockOperation("acquire", acquired.isPresent());
        if (acquired.isPresent()) {
            log.debug("Acquired lock {} (fence {}, ttl {}ms)",
                resourceKey, acquired.get().fenceToken(), lease.toMillis());
        } else {
            log.debug("Lock {} is held by another worker", resourceKey);
        }
        return acquired;
    }

    @Override
    public ExecutionLock acquireOrThrow(String resourceKey, Duration ttl) {
        return acquire(resourceKey, ttl)
            .orElseThrow(() -> new ResourceBusyException(resourceKey));
    }

    @Override
    public boolean release(String resourceKey, String holderToken) {
        boolean released = repository.release(resourceKey, holderToken);
        metrics.lockOperation("release", released);
        if (!released) {
            log.warn("Lock {} was not held by this token at release", resourceKey);
        }
        return released;
    }

    @Override
    public boolean renew(String resourceKey, String holderToken, Duration ttl) {
        Instant now = now();
        boolean renewed = repository.renew(resourceKey, holderToken, now.plus(ttl), now);
        metrics.lockOperation("renew", renewed);
        if (!renewed) {
            log.warn("Failed to renew lock {}: expired or taken over", resourceKey);
        }
        return renewed;
    }

    @Override
    public Optional<ExecutionLock> inspect(String resourceKey) {
        Instant now = now();
        return repository.findByKey(resourceKey).filter(lock -> !lock.isExpired(now));
    }

    /**
     * Renew the lease every third of its TTL until the handle is closed.
     * If a renewal fails the handle reports the lease as lost and stops renewing.
     */
    public RenewalHandle scheduleRenewal(ExecutionLock lock, Duration ttl) {
        long periodMs = Math.max(1, ttl.toMillis() / 3);
        RenewalHandle handle = new RenewalHandle(lock.resourceKey());
        ScheduledFuture<?> future = renewalExecutor.scheduleAtFixedRate(() -> {
            try {
                if (!renew(lock.resourceKey(), lock.holderToken(), ttl)) {
                    handle.markLost();
                }
            } catch (RuntimeException e) {
                log.error("Lock renewal for {} failed", lock.resourceKey(), e);
                handle.markLost();
            }
        }, periodMs, periodMs, TimeUnit.MILLISECONDS);
        handle.attach(future);
        return handle;
    }

    /**
     * Delete lock rows that expired before the given grace period.
     */
    public int purgeExpired(Duration grace) {
        int purged = repository.deleteExpiredBefore(now().minus(grace));
        if (purged > 0) {
            log.info("Purged {} expired locks", purged);
        }
        return purged;
    }

    public void shutdown() {
        renewalExecutor.shutdownNow();
    }

    // ========== Internal Methods ==========

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }

    private static void requireKey(String resourceKey) {
        if (resourceKey == null || resourceKey.isBlank()) {
            throw new IllegalArgumentException("Lock resource key is required");
        }
    }

    /**
     * Handle on a background renewal task.
     */
    public static final class RenewalHandle implements AutoCloseable {

        private final String resourceKey;
        private final AtomicBoolean lost = new AtomicBoolean(false);
        private volatile ScheduledFuture<?> future;

        RenewalHandle(String resourceKey) {
            this.resourceKey = resourceKey;
        }

        void attach(ScheduledFuture<?> future) {
            this.future = future;
        }

        void markLost() {
            if (lost.compareAndSet(false, true)) {
                log.warn("Lost lease on {}", resourceKey);
                ScheduledFuture<?> current = future;
                if (current != null) {
                    current.cancel(false);
                }
            }
        }

        /**
         * Whether a renewal failed, meaning another worker may now hold the resource.
         */
        public boolean isLost() {
            return lost.get();
        }

        @Override
        public void close() {
            ScheduledFuture<?> current = future;
            if (current != null) {
                current.cancel(false);
            }
        }
    }
}
