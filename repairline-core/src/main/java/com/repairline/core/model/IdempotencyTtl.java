package com.repairline.core.model;

import java.time.Duration;

/**
 * Bounds for idempotency record lifetimes.
 * Requested TTLs are clamped into [min, max]; a missing TTL falls back to the default.
 */
public record IdempotencyTtl(
    Duration defaultTtl,
    Duration minTtl,
    Duration maxTtl
) {
    public static final Duration DEFAULT_TTL = Duration.ofHours(24);
    public static final Duration MIN_TTL = Duration.ofMinutes(1);
    public static final Duration MAX_TTL = Duration.ofDays(7);

    public IdempotencyTtl {
        if (minTtl.compareTo(maxTtl) > 0) {
            throw new IllegalArgumentException("minTtl must not exceed maxTtl");
        }
    }

    public static IdempotencyTtl defaults() {
        return new IdempotencyTtl(DEFAULT_TTL, MIN_TTL, MAX_TTL);
    }

    /**
     * Normalize a requested TTL in seconds.
     *
     * @param ttlSeconds requested TTL, may be null
     */
    public Duration normalize(Long ttlSeconds) {
        Duration requested = ttlSeconds == null ? defaultTtl : Duration.ofSeconds(ttlSeconds);
        if (requested.compareTo(minTtl) < 0) {
            return minTtl;
        }
        if (requested.compareTo(maxTtl) > 0) {
            return maxTtl;
        }
        return requested;
    }
}
