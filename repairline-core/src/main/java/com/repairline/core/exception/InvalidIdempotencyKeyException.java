package com.repairline.core.exception;

/**
 * Thrown when a logical idempotency key does not follow the key scheme.
 */
public class InvalidIdempotencyKeyException extends RepairlineException {

    public static final String ERROR_CODE = "INVALID_IDEMPOTENCY_KEY";

    public InvalidIdempotencyKeyException(String reason) {
        super(ERROR_CODE, "Invalid idempotency key: " + reason);
    }
}
