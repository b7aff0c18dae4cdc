package com.repairline.core.exception;

/**
 * Thrown when workflow definition validation fails.
 */
public class WorkflowValidationException extends RepairlineException {

    public static final String ERROR_CODE = "WORKFLOW_VALIDATION_FAILED";

    public WorkflowValidationException(String message) {
        super(ERROR_CODE, message);
    }

    protected WorkflowValidationException(String errorCode, String message) {
        super(errorCode, message);
    }

    public static WorkflowValidationException invalidField(String field, String reason) {
        return new WorkflowValidationException(
            String.format("Invalid workflow definition: %s - %s", field, reason));
    }
}
