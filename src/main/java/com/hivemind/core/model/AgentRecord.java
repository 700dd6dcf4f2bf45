package com.hivemind.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Identity and runtime state of a registered agent.
 *
 * @param agentId     unique, immutable key (e.g. "HAL")
 * @param name        display name
 * @param description what the agent is for
 * @param traits      ordered personality / behaviour traits
 * @param modules     capability tags such as memory, reflection, loop, delegate
 * @param createdAt   registration time
 * @param loopCount   loop cycles consumed since the last operator reset
 * @param agentState  current activity state
 * @param lastActive  time of the most recent invocation
 */
public record AgentRecord(
    @JsonProperty("agent_id") String agentId,
    String name,
    String description,
    List<String> traits,
    Set<String> modules,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("loop_count") int loopCount,
    @JsonProperty("agent_state") AgentState agentState,
    @JsonProperty("last_active") Instant lastActive
) implements Serializable {

    public AgentRecord {
        traits = Labels.list(traits);
        modules = Labels.sortedSet(modules);
        agentState = agentState == null ? AgentState.IDLE : agentState;
    }

    public AgentRecord withState(AgentState state, Instant touchedAt) {
        return new AgentRecord(agentId, name, description, traits, modules, createdAt,
                loopCount, state, touchedAt != null ? touchedAt : lastActive);
    }

    public AgentRecord withLoopCount(int count) {
        return new AgentRecord(agentId, name, description, traits, modules, createdAt,
                count, agentState, lastActive);
    }
}
