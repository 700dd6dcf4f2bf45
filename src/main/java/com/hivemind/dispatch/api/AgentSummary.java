package com.hivemind.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hivemind.core.model.AgentRecord;

import java.time.Instant;
import java.util.Set;

/**
 * List view of an agent for GET /api/v1/agent/list.
 */
public record AgentSummary(
    @JsonProperty("agent_id") String agentId,
    String name,
    @JsonProperty("created_at") Instant createdAt,
    Set<String> modules
) {

    public static AgentSummary from(AgentRecord agent) {
        return new AgentSummary(agent.agentId(), agent.name(), agent.createdAt(), agent.modules());
    }
}
