package com.repairline.core.model;

/**
 * Outcome of an atomic check-and-set on the idempotency store.
 *
 * @param record the record now stored for the key
 * @param isNew true only for the single caller that created the record
 */
public record CheckAndSetResult(IdempotencyRecord record, boolean isNew) {

    public static CheckAndSetResult created(IdempotencyRecord record) {
        return new CheckAndSetResult(record, true);
    }

    public static CheckAndSetResult existing(IdempotencyRecord record) {
        return new CheckAndSetResult(record, false);
    }
}
