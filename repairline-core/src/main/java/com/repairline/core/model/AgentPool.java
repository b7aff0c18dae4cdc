package com.repairline.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Named group of agents sharing a load-balancing strategy.
 */
public record AgentPool(
    String id,
    String name,
    List<String> agentIds,
    LoadBalancingStrategy strategy
) {
    public AgentPool {
        agentIds = agentIds == null ? List.of() : List.copyOf(agentIds);
        strategy = strategy == null ? LoadBalancingStrategy.ROUND_ROBIN : strategy;
    }

    public boolean contains(String agentId) {
        return agentIds.contains(agentId);
    }

    public AgentPool withAgent(String agentId) {
        if (agentIds.contains(agentId)) {
            return this;
        }
        List<String> updated = new ArrayList<>(agentIds);
        updated.add(agentId);
        return new AgentPool(id, name, updated, strategy);
    }

    public AgentPool withoutAgent(String agentId) {
        List<String> updated = new ArrayList<>(agentIds);
        updated.remove(agentId);
        return new AgentPool(id, name, updated, strategy);
    }
}
