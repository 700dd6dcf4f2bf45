package com.hivemind.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Hand-off of a task from one agent to another.
 *
 * @param delegationDepth depth already reached by the chain this request belongs to (null means 0)
 * @param autoExecute     run the task on the receiving agent immediately
 */
public record DelegationRequest(
    @JsonProperty("from_agent") String fromAgent,
    @JsonProperty("to_agent") String toAgent,
    String task,
    @JsonProperty("delegation_depth") Integer delegationDepth,
    @JsonProperty("auto_execute") Boolean autoExecute,
    @JsonProperty("project_id") String projectId
) {

    public int depth() {
        return delegationDepth == null ? 0 : delegationDepth;
    }

    public boolean shouldExecute() {
        return Boolean.TRUE.equals(autoExecute);
    }
}
