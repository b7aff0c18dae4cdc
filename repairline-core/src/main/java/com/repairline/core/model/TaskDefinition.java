package com.repairline.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A single task within a workflow DAG.
 * Routed to an agent by capability, or to a pinned agent when agentId is set.
 */
public record TaskDefinition(
    String id,
    String name,
    String capability,
    String agentId,
    JsonNode input,
    List<String> dependencies,
    DependencyType dependencyType,
    Duration timeout,
    RetryPolicy retryPolicy
) {
    public TaskDefinition {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        dependencyType = dependencyType == null ? DependencyType.SEQUENTIAL : dependencyType;
    }

    @JsonIgnore
    public boolean isRoot() {
        return dependencies.isEmpty();
    }

    @JsonIgnore
    public boolean isPinned() {
        return agentId != null && !agentId.isBlank();
    }

    /**
     * Whether this task and the other are siblings of a shared predecessor.
     * Root tasks are siblings of each other.
     */
    public boolean sharesPredecessorWith(TaskDefinition other) {
        if (isRoot() && other.isRoot()) {
            return true;
        }
        return !Collections.disjoint(dependencies, other.dependencies());
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static class Builder {
        private final String id;
        private String name;
        private String capability;
        private String agentId;
        private JsonNode input;
        private final List<String> dependencies = new ArrayList<>();
        private DependencyType dependencyType = DependencyType.SEQUENTIAL;
        private Duration timeout;
        private RetryPolicy retryPolicy;

        public Builder(String id) {
            this.id = id;
            this.name = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder capability(String capability) {
            this.capability = capability;
            return this;
        }

        public Builder agentId(String agentId) {
            this.agentId = agentId;
            return this;
        }

        public Builder input(JsonNode input) {
            this.input = input;
            return this;
        }

        public Builder dependsOn(String... taskIds) {
            this.dependencies.addAll(List.of(taskIds));
            return this;
        }

        public Builder dependencyType(DependencyType dependencyType) {
            this.dependencyType = dependencyType;
            return this;
        }

        public Builder parallel() {
            this.dependencyType = DependencyType.PARALLEL;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public TaskDefinition build() {
            return new TaskDefinition(
                id, name, capability, agentId, input,
                dependencies, dependencyType, timeout, retryPolicy
            );
        }
    }
}
