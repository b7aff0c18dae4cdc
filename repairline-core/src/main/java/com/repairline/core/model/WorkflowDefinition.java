package com.repairline.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable definition of a task DAG.
 * A new version is a new definition.
 *
 * Invariants (enforced when the workflow is created):
 * - task ids are unique
 * - every dependency references a task of this definition
 * - the task graph is acyclic
 */
public record WorkflowDefinition(
    String id,
    String name,
    String version,
    String description,
    List<TaskDefinition> tasks,
    JsonNode inputSchema,
    Duration timeout,
    FailurePolicy failurePolicy,
    Map<String, String> tags,
    Instant createdAt
) {
    public WorkflowDefinition {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        tags = tags == null ? Map.of() : Map.copyOf(tags);
        failurePolicy = failurePolicy == null ? FailurePolicy.FAIL_FAST : failurePolicy;
    }

    public Optional<TaskDefinition> getTask(String taskId) {
        return tasks.stream()
            .filter(t -> t.id().equals(taskId))
            .findFirst();
    }

    @JsonIgnore
    public List<String> taskIds() {
        return tasks.stream().map(TaskDefinition::id).toList();
    }

    /**
     * Tasks that list the given task among their dependencies.
     */
    public List<TaskDefinition> dependentsOf(String taskId) {
        return tasks.stream()
            .filter(t -> t.dependencies().contains(taskId))
            .toList();
    }

    public WorkflowDefinition withIdentity(String newId, Instant newCreatedAt) {
        return new WorkflowDefinition(newId, name, version, description, tasks,
            inputSchema, timeout, failurePolicy, tags, newCreatedAt);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private String id;
        private final String name;
        private String version = "1.0.0";
        private String description;
        private final List<TaskDefinition> tasks = new ArrayList<>();
        private JsonNode inputSchema;
        private Duration timeout;
        private FailurePolicy failurePolicy = FailurePolicy.FAIL_FAST;
        private Map<String, String> tags = Map.of();

        public Builder(String name) {
            this.name = name;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder task(TaskDefinition task) {
            this.tasks.add(task);
            return this;
        }

        public Builder tasks(List<TaskDefinition> tasks) {
            this.tasks.addAll(tasks);
            return this;
        }

        public Builder inputSchema(JsonNode inputSchema) {
            this.inputSchema = inputSchema;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder failurePolicy(FailurePolicy failurePolicy) {
            this.failurePolicy = failurePolicy;
            return this;
        }

        public Builder tags(Map<String, String> tags) {
            this.tags = tags;
            return this;
        }

        public WorkflowDefinition build() {
            return new WorkflowDefinition(id, name, version, description, tasks,
                inputSchema, timeout, failurePolicy, tags, null);
        }
    }
}
