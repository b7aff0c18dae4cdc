package com.repairline.core.exception;

/**
 * Thrown when a task depends on a task id that is not part of the same workflow.
 */
public class UnknownTaskReferenceException extends WorkflowValidationException {

    public static final String ERROR_CODE = "NON_EXISTENT_TASK";

    private final String taskId;
    private final String missingDependency;

    public UnknownTaskReferenceException(String taskId, String missingDependency) {
        super(ERROR_CODE, String.format(
            "Task %s depends on non-existent task %s",
            taskId, missingDependency
        ));
        this.taskId = taskId;
        this.missingDependency = missingDependency;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getMissingDependency() {
        return missingDependency;
    }
}
