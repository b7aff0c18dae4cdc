package com.repairline.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Catalog entry for an executable agent.
 * Tasks reference agents by capability name, or by id when pinned.
 *
 * Invariants:
 * - maxConcurrency >= 1
 * - id is assigned by the registry on registration
 */
public record AgentDescriptor(
    String id,
    String name,
    String version,
    String description,
    List<AgentCapability> capabilities,
    int priority,
    int maxConcurrency,
    Map<String, String> tags,
    boolean healthy
) {
    public AgentDescriptor {
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
        tags = tags == null ? Map.of() : Map.copyOf(tags);
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be >= 1");
        }
    }

    public boolean hasCapability(String capabilityName) {
        return capabilities.stream().anyMatch(c -> c.name().equals(capabilityName));
    }

    @JsonIgnore
    public List<String> capabilityNames() {
        return capabilities.stream().map(AgentCapability::name).toList();
    }

    public AgentDescriptor withId(String newId) {
        return new AgentDescriptor(newId, name, version, description, capabilities,
            priority, maxConcurrency, tags, healthy);
    }

    public AgentDescriptor withHealthy(boolean newHealthy) {
        return new AgentDescriptor(id, name, version, description, capabilities,
            priority, maxConcurrency, tags, newHealthy);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private String id;
        private final String name;
        private String version = "1.0.0";
        private String description;
        private List<AgentCapability> capabilities = List.of();
        private int priority = 0;
        private int maxConcurrency = 1;
        private Map<String, String> tags = Map.of();
        private boolean healthy = true;

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

        public Builder capabilities(List<AgentCapability> capabilities) {
            this.capabilities = capabilities;
            return this;
        }

        public Builder capability(String capabilityName) {
            this.capabilities = new ArrayList<>(this.capabilities);
            this.capabilities.add(AgentCapability.of(capabilityName));
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder maxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder tags(Map<String, String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder healthy(boolean healthy) {
            this.healthy = healthy;
            return this;
        }

        public AgentDescriptor build() {
            return new AgentDescriptor(id, name, version, description, capabilities,
                priority, maxConcurrency, tags, healthy);
        }
    }
}
