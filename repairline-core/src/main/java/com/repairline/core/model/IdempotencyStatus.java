package com.repairline.core.model;

/**
 * Lifecycle of an idempotency record.
 * PENDING transitions exactly once to COMPLETED or FAILED.
 * A retryable FAILED record may be reclaimed back to PENDING by a redelivery.
 */
public enum IdempotencyStatus {
    PENDING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
