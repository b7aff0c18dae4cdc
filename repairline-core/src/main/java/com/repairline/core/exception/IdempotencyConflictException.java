package com.repairline.core.exception;

/**
 * Thrown when an idempotency key is reused with a different request payload.
 * The stored payload hash is never overwritten.
 */
public class IdempotencyConflictException extends RepairlineException {

    public static final String ERROR_CODE = "IDEMPOTENCY_CONFLICT";

    private final String keyHash;

    public IdempotencyConflictException(String keyHash) {
        super(ERROR_CODE, String.format(
            "Idempotency key %s was already used with a different request payload",
            abbreviate(keyHash)
        ));
        this.keyHash = keyHash;
    }

    public String getKeyHash() {
        return keyHash;
    }

    private static String abbreviate(String keyHash) {
        return keyHash != null && keyHash.length() > 12 ? keyHash.substring(0, 12) + "..." : keyHash;
    }
}
