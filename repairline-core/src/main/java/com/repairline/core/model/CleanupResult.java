package com.repairline.core.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Result of one bounded cleanup batch.
 */
public record CleanupResult(
    int deletedCount,
    int scannedCount,
    Instant startedAt,
    Instant completedAt,
    long durationMs
) {
    public static CleanupResult of(int deletedCount, int scannedCount, Instant startedAt, Instant completedAt) {
        return new CleanupResult(
            deletedCount,
            scannedCount,
            startedAt,
            completedAt,
            Duration.between(startedAt, completedAt).toMillis()
        );
    }
}
