package com.repairline.engine.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.repairline.core.model.AgentDescriptor;

/**
 * A unit that performs the work behind one or more capabilities.
 */
public interface Agent {

    /**
     * Static description of the agent. The registry assigns the id.
     */
    AgentDescriptor descriptor();

    /**
     * Invoke the agent for one task attempt.
     *
     * @return the task output
     * @throws AgentException if the attempt fails
     */
    JsonNode invoke(AgentRequest request) throws AgentException;

    /**
     * Agent backed by a single handler function.
     */
    static Agent of(AgentDescriptor descriptor, AgentHandler handler) {
        return new Agent() {
            @Override
            public AgentDescriptor descriptor() {
                return descriptor;
            }

            @Override
            public JsonNode invoke(AgentRequest request) throws AgentException {
                return handler.handle(request);
            }
        };
    }

    @FunctionalInterface
    interface AgentHandler {
        JsonNode handle(AgentRequest request) throws AgentException;
    }
}
