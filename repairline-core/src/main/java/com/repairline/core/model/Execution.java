package com.repairline.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import com.repairline.core.exception.InvalidStateTransitionException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A single run of a WorkflowDefinition.
 * Mutated only by the orchestration engine; every copy bumps {@code version}.
 *
 * Primary Key: id
 *
 * Invariants:
 * - currentTasks, completedTasks and failedTasks are pairwise disjoint
 * - their union is a subset of the workflow's task ids
 * - one TaskResult per task id
 * - terminal once status leaves RUNNING (or PAUSED)
 */
public record Execution(
    String id,
    String workflowId,
    String workflowName,
    String tenantId,
    ExecutionStatus status,
    JsonNode input,
    JsonNode output,
    List<TaskResult> taskResults,
    List<String> currentTasks,
    List<String> completedTasks,
    List<String> failedTasks,
    String error,
    Instant startTime,
    Instant endTime,
    Instant cancelledAt,
    long version
) {
    public Execution {
        taskResults = taskResults == null ? List.of() : List.copyOf(taskResults);
        currentTasks = currentTasks == null ? List.of() : List.copyOf(currentTasks);
        completedTasks = completedTasks == null ? List.of() : List.copyOf(completedTasks);
        failedTasks = failedTasks == null ? List.of() : List.copyOf(failedTasks);
    }

    /**
     * Create a new execution in PENDING state.
     */
    public static Execution create(
            String id,
            WorkflowDefinition workflow,
            String tenantId,
            JsonNode input,
            Instant now) {
        return new Execution(
            id,
            workflow.id(),
            workflow.name(),
            tenantId,
            ExecutionStatus.PENDING,
            input,
            null,
            List.of(),
            List.of(),
            List.of(),
            List.of(),
            null,
            now,
            null,
            null,
            0L
        );
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Whether the engine may start new tasks for this execution.
     */
    @JsonIgnore
    public boolean allowsDispatch() {
        return status == ExecutionStatus.RUNNING;
    }

    public boolean isSettled(String taskId) {
        return completedTasks.contains(taskId) || failedTasks.contains(taskId);
    }

    public boolean isStarted(String taskId) {
        return isSettled(taskId) || currentTasks.contains(taskId);
    }

    public Optional<TaskResult> taskResult(String taskId) {
        return taskResults.stream()
            .filter(r -> r.taskId().equals(taskId))
            .findFirst();
    }

    /**
     * Create a copy in the target status.
     *
     * @throws InvalidStateTransitionException if the state machine forbids it
     */
    public Execution transitionTo(ExecutionStatus target, Instant now) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStateTransitionException(status, target);
        }
        return toBuilder()
            .status(target)
            .endTime(target.isTerminal() ? now : endTime)
            .cancelledAt(target == ExecutionStatus.CANCELLED ? now : cancelledAt)
            .build();
    }

    /**
     * Create a copy with the task marked in flight.
     */
    public Execution withTaskStarted(String taskId) {
        if (isStarted(taskId)) {
            return this;
        }
        List<String> current = new ArrayList<>(currentTasks);
        current.add(taskId);
        return toBuilder().currentTasks(current).build();
    }

    /**
     * Create a copy with the task result recorded.
     * An existing result for the same task is replaced, never duplicated.
     */
    public Execution withTaskResult(TaskResult result) {
        String taskId = result.taskId();

        List<TaskResult> results = new ArrayList<>(taskResults);
        results.removeIf(r -> r.taskId().equals(taskId));
        results.add(result);

        List<String> current = new ArrayList<>(currentTasks);
        current.remove(taskId);
        List<String> completed = new ArrayList<>(completedTasks);
        completed.remove(taskId);
        List<String> failed = new ArrayList<>(failedTasks);
        failed.remove(taskId);

        if (result.isSuccess()) {
            completed.add(taskId);
        } else {
            failed.add(taskId);
        }

        return toBuilder()
            .taskResults(results)
            .currentTasks(current)
            .completedTasks(completed)
            .failedTasks(failed)
            .build();
    }

    /**
     * Create a copy with in-flight markers cleared, used when resuming after a crash.
     */
    public Execution withCurrentTasksCleared() {
        return toBuilder().currentTasks(List.of()).build();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static class Builder {
        private final String id;
        private final String workflowId;
        private final String workflowName;
        private final String tenantId;
        private ExecutionStatus status;
        private final JsonNode input;
        private JsonNode output;
        private List<TaskResult> taskResults;
        private List<String> currentTasks;
        private List<String> completedTasks;
        private List<String> failedTasks;
        private String error;
        private Instant startTime;
        private Instant endTime;
        private Instant cancelledAt;
        private long version;

        public Builder(Execution execution) {
            this.id = execution.id();
            this.workflowId = execution.workflowId();
            this.workflowName = execution.workflowName();
            this.tenantId = execution.tenantId();
            this.status = execution.status();
            this.input = execution.input();
            this.output = execution.output();
            this.taskResults = execution.taskResults();
            this.currentTasks = execution.currentTasks();
            this.completedTasks = execution.completedTasks();
            this.failedTasks = execution.failedTasks();
            this.error = execution.error();
            this.startTime = execution.startTime();
            this.endTime = execution.endTime();
            this.cancelledAt = execution.cancelledAt();
            this.version = execution.version() + 1;
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder output(JsonNode output) {
            this.output = output;
            return this;
        }

        public Builder taskResults(List<TaskResult> taskResults) {
            this.taskResults = taskResults;
            return this;
        }

        public Builder currentTasks(List<String> currentTasks) {
            this.currentTasks = currentTasks;
            return this;
        }

        public Builder completedTasks(List<String> completedTasks) {
            this.completedTasks = completedTasks;
            return this;
        }

        public Builder failedTasks(List<String> failedTasks) {
            this.failedTasks = failedTasks;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder cancelledAt(Instant cancelledAt) {
            this.cancelledAt = cancelledAt;
            return this;
        }

        public Execution build() {
            return new Execution(
                id, workflowId, workflowName, tenantId, status, input, output,
                taskResults, currentTasks, completedTasks, failedTasks,
                error, startTime, endTime, cancelledAt, version
            );
        }
    }
}
