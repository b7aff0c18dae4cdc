package com.repairline.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Lease-based lock serializing work on one resource key across worker replicas.
 *
 * Primary Key: resourceKey
 *
 * Invariants:
 * - Only one unexpired lock per resourceKey
 * - fenceToken increases on every acquisition
 * - An expired lock is indistinguishable from an absent one
 */
public record ExecutionLock(
    String resourceKey,

    // Ownership
    String holderToken,

    // Timing
    Instant acquiredAt,
    Instant expiresAt,
    Duration ttl,
    int renewalCount,

    // Fencing
    long fenceToken
) {
    /**
     * Default lock TTL: one minute.
     */
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(1);

    /**
     * Create a lock request with a fresh holder token.
     * The fence token is assigned by the repository on acquisition.
     */
    public static ExecutionLock create(String resourceKey, Duration ttl, Instant now) {
        return new ExecutionLock(
            resourceKey,
            UUID.randomUUID().toString(),
            now,
            now.plus(ttl),
            ttl,
            0,
            0L
        );
    }

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public boolean isHeldBy(String token) {
        return holderToken != null && holderToken.equals(token);
    }

    public Duration remainingTime(Instant now) {
        Duration remaining = Duration.between(now, expiresAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public ExecutionLock renew(Duration newTtl, Instant now) {
        return new ExecutionLock(
            resourceKey, holderToken, acquiredAt, now.plus(newTtl), newTtl,
            renewalCount + 1, fenceToken
        );
    }

    public ExecutionLock withFenceToken(long token) {
        return new ExecutionLock(
            resourceKey, holderToken, acquiredAt, expiresAt, ttl, renewalCount, token
        );
    }
}
