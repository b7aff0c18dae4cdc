package com.repairline.core.exception;

/**
 * Thrown when an idempotency record, lock, workflow, agent or execution is not found.
 */
public class NotFoundException extends RepairlineException {

    public static final String ERROR_CODE = "NOT_FOUND";

    private final String entityType;
    private final String entityId;

    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
        this.entityType = entityType;
        this.entityId = entityId;
    }

    public String getEntityType() {
        return entityType;
    }

    public String getEntityId() {
        return entityId;
    }
}
