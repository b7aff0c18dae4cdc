package com.repairline.engine.persistence;

import com.repairline.core.model.ExecutionLock;
import com.repairline.core.repository.LockRepository;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of LockRepository.
 * Fence tokens survive release so they keep increasing per resource key, until
 * {@link #deleteExpiredBefore} purges the key.
 */
public class InMemoryLockRepository implements LockRepository {

    private final Map<String, ExecutionLock> locks = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> fenceTokens = new ConcurrentHashMap<>();
    // Released keys and the acquisition time of their last lock, which counts as its expiry.
    private final Map<String, Instant> released = new ConcurrentHashMap<>();

    @Override
    public Optional<ExecutionLock> tryAcquire(ExecutionLock lock, Instant now) {
        synchronized (locks) {
            ExecutionLock existing = locks.get(lock.resourceKey());
            if (existing != null && !existing.isExpired(now)) {
                return Optional.empty();
            }

            long token = fenceTokens
                .computeIfAbsent(lock.resourceKey(), k -> new AtomicLong(0))
                .incrementAndGet();
            ExecutionLock acquired = lock.withFenceToken(token);
            locks.put(lock.resourceKey(), acquired);
            released.remove(lock.resourceKey());
            return Optional.of(acquired);
        }
    }

    @Override
    public boolean renew(String resourceKey, String holderToken, Instant newExpiresAt, Instant now) {
        synchronized (locks) {
            ExecutionLock existing = locks.get(resourceKey);
            if (existing == null || !existing.isHeldBy(holderToken) || existing.isExpired(now)) {
                return false;
            }
            locks.put(resourceKey, existing.renew(Duration.between(now, newExpiresAt), now));
            return true;
        }
    }

    @Override
    public boolean release(String resourceKey, String holderToken) {
        synchronized (locks) {
            ExecutionLock existing = locks.get(resourceKey);
            if (existing == null || !existing.isHeldBy(holderToken)) {
                return false;
            }
            locks.remove(resourceKey);
            released.put(resourceKey, existing.acquiredAt());
            return true;
        }
    }

    @Override
    public Optional<ExecutionLock> findByKey(String resourceKey) {
        return Optional.ofNullable(locks.get(resourceKey));
    }

    @Override
    public int deleteExpiredBefore(Instant expiredBefore) {
        synchronized (locks) {
            List<String> expired = locks.entrySet().stream()
                .filter(e -> e.getValue().expiresAt().isBefore(expiredBefore))
                .map(Map.Entry::getKey)
                .toList();
            List<String> stale = released.entrySet().stream()
                .filter(e -> e.getValue().isBefore(expiredBefore))
                .map(Map.Entry::getKey)
                .toList();
            expired.forEach(locks::remove);
            stale.forEach(released::remove);
            expired.forEach(fenceTokens::remove);
            stale.forEach(fenceTokens::remove);
            return expired.size() + stale.size();
        }
    }
}
