package com.repairline.core.model;

/**
 * A named, versioned unit of work an agent can perform.
 */
public record AgentCapability(
    String name,
    String version,
    String description
) {
    public static AgentCapability of(String name) {
        return new AgentCapability(name, "1.0.0", null);
    }
}
