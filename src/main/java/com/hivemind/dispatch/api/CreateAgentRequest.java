package com.hivemind.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Set;

/**
 * Inbound JSON body for POST /api/v1/agent/create.
 *
 * @param name    display name; nullable, defaults to the upper-cased id
 * @param modules capability tags; nullable, defaults to memory, reflection, loop and delegate
 */
public record CreateAgentRequest(
    @JsonProperty("agent_id") String agentId,
    String name,
    String description,
    List<String> traits,
    Set<String> modules
) {}
