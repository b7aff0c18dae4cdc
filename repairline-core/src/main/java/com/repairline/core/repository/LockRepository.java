package com.repairline.core.repository;

import com.repairline.core.model.ExecutionLock;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository for lease-based locks.
 */
public interface LockRepository {

    /**
     * Acquire the lock if it is absent or expired at {@code now}.
     * Atomic across replicas.
     *
     * @return the stored lock with its new fence token, or empty if held by someone else
     */
    Optional<ExecutionLock> tryAcquire(ExecutionLock lock, Instant now);

    /**
     * Extend an unexpired lock held by the given token.
     */
    boolean renew(String resourceKey, String holderToken, Instant newExpiresAt, Instant now);

    /**
     * Release the lock if held by the given token.
     */
    boolean release(String resourceKey, String holderToken);

    Optional<ExecutionLock> findByKey(String resourceKey);

    int deleteExpiredBefore(Instant expiredBefore);
}
