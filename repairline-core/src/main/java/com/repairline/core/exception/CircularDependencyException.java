package com.repairline.core.exception;

import java.util.List;

/**
 * Thrown when the task graph of a workflow contains a cycle, including a self-dependency.
 */
public class CircularDependencyException extends WorkflowValidationException {

    public static final String ERROR_CODE = "CIRCULAR_DEPENDENCY";

    private final List<String> cycle;

    public CircularDependencyException(List<String> cycle) {
        super(ERROR_CODE, "Circular dependency detected: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /**
     * Task ids along the detected cycle, first id repeated at the end.
     */
    public List<String> getCycle() {
        return cycle;
    }
}
