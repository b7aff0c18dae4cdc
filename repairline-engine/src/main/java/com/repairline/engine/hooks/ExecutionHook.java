package com.repairline.engine.hooks;

import com.repairline.core.model.Execution;
import com.repairline.core.model.TaskDefinition;
import com.repairline.core.model.TaskResult;

/**
 * Observer of execution lifecycle events.
 * A hook that throws is logged and skipped; it never affects the execution.
 */
public interface ExecutionHook {

    /**
     * Unique registration name.
     */
    String name();

    default void onExecutionStarted(Execution execution) {
    }

    default void onTaskStarted(Execution execution, TaskDefinition task) {
    }

    default void onTaskCompleted(Execution execution, TaskResult result) {
    }

    default void onTaskFailed(Execution execution, TaskResult result) {
    }

    default void onExecutionFinished(Execution execution) {
    }
}
