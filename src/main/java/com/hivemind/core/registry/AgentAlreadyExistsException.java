package com.hivemind.core.registry;

/**
 * Thrown when creating an agent whose id is already registered.
 */
public class AgentAlreadyExistsException extends RuntimeException {

    private final String agentId;

    public AgentAlreadyExistsException(String agentId) {
        super("Agent with ID '" + agentId + "' already exists");
        this.agentId = agentId;
    }

    public String getAgentId() {
        return agentId;
    }
}
