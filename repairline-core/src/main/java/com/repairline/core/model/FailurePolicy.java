package com.repairline.core.model;

/**
 * Workflow-level rule governing whether one task failure halts the whole execution.
 */
public enum FailurePolicy {
    /** First terminal task failure fails the execution; nothing new is dispatched. */
    FAIL_FAST,
    /** Independent branches keep running; dependents of a failed task are never run. */
    CONTINUE
}
