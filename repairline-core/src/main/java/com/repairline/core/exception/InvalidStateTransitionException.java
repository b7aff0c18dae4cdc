package com.repairline.core.exception;

import com.repairline.core.model.ExecutionStatus;

/**
 * Thrown when an invalid state transition is attempted.
 */
public class InvalidStateTransitionException extends RepairlineException {

    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";

    public InvalidStateTransitionException(ExecutionStatus currentStatus, ExecutionStatus targetStatus) {
        super(ERROR_CODE, String.format(
            "Cannot transition from %s to %s",
            currentStatus, targetStatus
        ));
    }

    public InvalidStateTransitionException(String entityType, String currentState, String targetState) {
        super(ERROR_CODE, String.format(
            "Cannot transition %s from %s to %s",
            entityType, currentState, targetState
        ));
    }
}
