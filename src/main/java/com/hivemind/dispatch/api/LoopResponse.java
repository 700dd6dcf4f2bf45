package com.hivemind.dispatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hivemind.core.model.LoopResult;

/**
 * JSON response for POST /api/v1/agent/loop.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LoopResponse(
    String status,
    @JsonProperty("agent_id") String agentId,
    @JsonProperty("loop_id") String loopId,
    @JsonProperty("loop_type") String loopType,
    @JsonProperty("loop_cycles") int loopCycles,
    @JsonProperty("loop_result") String loopResult,
    @JsonProperty("loop_summary") String loopSummary,
    @JsonProperty("memory_id") String memoryId,
    @JsonProperty("exit_condition_met") boolean exitConditionMet,
    String message
) {

    public static LoopResponse from(LoopResult result) {
        return new LoopResponse(
                result.status().wireName(),
                result.agentId(),
                result.loopId(),
                result.loopType(),
                result.loopCycles(),
                result.loopResult(),
                result.loopSummary(),
                result.memoryId(),
                result.exitConditionMet(),
                result.message());
    }
}
