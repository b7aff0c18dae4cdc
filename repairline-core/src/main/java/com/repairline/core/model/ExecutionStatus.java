package com.repairline.core.model;

/**
 * Lifecycle states for a workflow execution.
 */
public enum ExecutionStatus {
    /**
     * Created, no task dispatched yet.
     * Transitions: -> RUNNING, CANCELLED
     */
    PENDING,

    /**
     * Tasks are being dispatched.
     * Transitions: -> COMPLETED, FAILED, CANCELLED, PAUSED
     */
    RUNNING,

    /**
     * Dispatch halted until resumed; in-flight tasks still drain.
     * Transitions: -> RUNNING, CANCELLED, FAILED
     */
    PAUSED,

    COMPLETED,

    FAILED,

    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(ExecutionStatus target) {
        return switch (this) {
            case PENDING -> target == RUNNING;
            case RUNNING -> target == COMPLETED || target == FAILED
                || target == CANCELLED || target == PAUSED;
            case PAUSED -> target == RUNNING || target == CANCELLED || target == FAILED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
