package com.repairline.core.exception;

/**
 * Thrown when a lock is held by someone else or an idempotency record is still pending.
 * Always retryable by the caller after backoff.
 */
public class ResourceBusyException extends RepairlineException {

    public static final String ERROR_CODE = "RESOURCE_BUSY";

    private final String resourceKey;

    public ResourceBusyException(String resourceKey) {
        super(ERROR_CODE, String.format("Resource '%s' is busy", resourceKey));
        this.resourceKey = resourceKey;
    }

    public ResourceBusyException(String resourceKey, String reason) {
        super(ERROR_CODE, String.format("Resource '%s' is busy: %s", resourceKey, reason));
        this.resourceKey = resourceKey;
    }

    public String getResourceKey() {
        return resourceKey;
    }
}
