package com.repairline.core.exception;

/**
 * Thrown when no healthy agent can serve a task.
 */
public class AgentUnavailableException extends RepairlineException {

    public static final String ERROR_CODE = "AGENT_UNAVAILABLE";

    public AgentUnavailableException(String capability) {
        super(ERROR_CODE, String.format("No healthy agent available for capability: %s", capability));
    }

    public AgentUnavailableException(String agentId, String reason) {
        super(ERROR_CODE, String.format("Agent %s unavailable: %s", agentId, reason));
    }
}
