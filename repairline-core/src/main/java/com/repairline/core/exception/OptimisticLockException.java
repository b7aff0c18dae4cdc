package com.repairline.core.exception;

/**
 * Thrown when a concurrent writer updated an execution first.
 */
public class OptimisticLockException extends RepairlineException {

    public static final String ERROR_CODE = "OPTIMISTIC_LOCK_FAILED";

    public OptimisticLockException(String entityType, String entityId, long expectedVersion) {
        super(ERROR_CODE, String.format(
            "%s %s was modified concurrently (expected version %d)",
            entityType, entityId, expectedVersion
        ));
    }
}
