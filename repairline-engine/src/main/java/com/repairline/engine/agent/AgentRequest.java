package com.repairline.engine.agent;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One task attempt handed to an agent.
 *
 * @param input composed input: {@code {"workflow": ..., "task": ..., "dependencies": {...}}}
 * @param attempt 1-indexed attempt number
 */
public record AgentRequest(
    String executionId,
    String workflowId,
    String taskId,
    String capability,
    JsonNode input,
    int attempt,
    String tenantId
) {
    /**
     * Input supplied on the task definition.
     */
    public JsonNode taskInput() {
        return input == null ? null : input.get("task");
    }

    /**
     * Output of a completed dependency, or null.
     */
    public JsonNode dependencyOutput(String taskId) {
        return input == null ? null : input.path("dependencies").get(taskId);
    }
}
