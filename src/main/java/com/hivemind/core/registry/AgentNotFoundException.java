package com.hivemind.core.registry;

/**
 * Thrown when a referenced agent id is not registered.
 */
public class AgentNotFoundException extends RuntimeException {

    private final String agentId;

    public AgentNotFoundException(String agentId) {
        super("Agent with ID '" + agentId + "' not found");
        this.agentId = agentId;
    }

    public String getAgentId() {
        return agentId;
    }
}
