package com.repairline.engine.service;

import com.repairline.core.model.ExecutionLock;

import java.time.Duration;
import java.util.Optional;

/**
 * Lease-based mutual exclusion across worker replicas.
 * A holder that crashes loses the lock once its TTL elapses.
 */
public interface LockService {

    /**
     * @return the held lock (its holder token is required to release or renew), or empty if busy
     */
    Optional<ExecutionLock> acquire(String resourceKey, Duration ttl);

    /**
     * @throws com.repairline.core.exception.ResourceBusyException if the lock is held
     */
    ExecutionLock acquireOrThrow(String resourceKey, Duration ttl);

    /**
     * @return false if the lock is not held by this token (already released or taken over)
     */
    boolean release(String resourceKey, String holderToken);

    /**
     * @return false if the lock expired or is held by another token
     */
    boolean renew(String resourceKey, String holderToken, Duration ttl);

    /**
     * The current unexpired holder, if any.
     */
    Optional<ExecutionLock> inspect(String resourceKey);
}
