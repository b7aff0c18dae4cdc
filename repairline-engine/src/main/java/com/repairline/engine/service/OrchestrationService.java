package com.repairline.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.repairline.core.model.Execution;
import com.repairline.core.model.TaskResult;
import com.repairline.core.model.WorkflowDefinition;

import java.util.List;

/**
 * Validates workflow DAGs and executes them against the agent registry.
 */
public interface OrchestrationService {

    /**
     * Validate and store a workflow definition.
     *
     * @throws com.repairline.core.exception.CircularDependencyException on a cycle or self-dependency
     * @throws com.repairline.core.exception.UnknownTaskReferenceException on a dangling dependency
     * @throws com.repairline.core.exception.WorkflowValidationException on other malformed input
     */
    WorkflowDefinition createWorkflow(WorkflowDefinition definition);

    WorkflowDefinition getWorkflow(String workflowId);

    List<WorkflowDefinition> listWorkflows();

    boolean deleteWorkflow(String workflowId);

    /**
     * Run a workflow to a terminal (or paused) status and return the execution.
     */
    Execution executeWorkflow(String workflowId, JsonNode input);

    /**
     * Run a workflow. When the request names an existing non-terminal execution,
     * it is resumed: completed tasks are not run again.
     */
    Execution executeWorkflow(ExecuteRequest request);

    Execution getExecution(String executionId);

    List<Execution> listExecutions(String workflowId);

    /**
     * Stop dispatching new tasks; in-flight tasks drain.
     *
     * @throws com.repairline.core.exception.InvalidStateTransitionException unless running or paused
     */
    Execution cancelExecution(String executionId);

    Execution pauseExecution(String executionId);

    /**
     * Continue a paused execution and run it to a terminal (or paused) status.
     */
    Execution resumeExecution(String executionId);

    /**
     * Run a single capability through agent selection and retry, outside any workflow.
     */
    TaskResult invokeCapability(String capability, JsonNode input, String tenantId);

    /**
     * Request to execute a workflow.
     *
     * @param executionId optional caller-chosen id; reusing it resumes that execution
     */
    record ExecuteRequest(
        String workflowId,
        JsonNode input,
        String tenantId,
        String executionId
    ) {
        public static ExecuteRequest of(String workflowId, JsonNode input) {
            return new ExecuteRequest(workflowId, input, null, null);
        }
    }
}
