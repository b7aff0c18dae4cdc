package com.repairline.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one task within one execution.
 * Recorded once per task; retries only raise {@code attempts}.
 */
public record TaskResult(
    String taskId,
    TaskStatus status,
    JsonNode output,
    String error,
    String errorCode,
    Instant startTime,
    Instant endTime,
    long durationMs,
    int attempts,
    String agentId
) {
    public static final String DEPENDENCY_FAILED = "DEPENDENCY_FAILED";

    public static TaskResult completed(
            String taskId, JsonNode output, Instant startTime, Instant endTime,
            int attempts, String agentId) {
        return new TaskResult(taskId, TaskStatus.COMPLETED, output, null, null,
            startTime, endTime, Duration.between(startTime, endTime).toMillis(), attempts, agentId);
    }

    public static TaskResult failed(
            String taskId, String errorCode, String error, Instant startTime, Instant endTime,
            int attempts, String agentId) {
        return new TaskResult(taskId, TaskStatus.FAILED, null, error, errorCode,
            startTime, endTime, Duration.between(startTime, endTime).toMillis(), attempts, agentId);
    }

    /**
     * Result for a task that never ran because a dependency failed.
     */
    public static TaskResult dependencyFailed(String taskId, String failedDependency, Instant now) {
        return new TaskResult(taskId, TaskStatus.FAILED, null,
            "Dependency failed: " + failedDependency, DEPENDENCY_FAILED,
            now, now, 0L, 0, null);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == TaskStatus.COMPLETED;
    }
}
