package com.hivemind.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request for one cognitive loop cycle.
 *
 * @param agentId         agent to loop
 * @param loopType        reflective, task or planning (blank means reflective)
 * @param memoryLimit     how many recent memories feed the prompt; null uses the configured default
 * @param projectId       optional project scope for context and the written entry
 * @param taskId          optional task identifier
 * @param taskDescription concrete task text for task loops; falls back to the task id
 * @param memoryTraceId   optional trace id
 * @param maxCycles       optional caller-side ceiling, tighter than the system cap
 * @param exitConditions  phrases that mark the loop goal as reached when found in the output
 * @param loopCount       cycles the caller believes have already run
 */
public record LoopRequest(
    @JsonProperty("agent_id") String agentId,
    @JsonProperty("loop_type") String loopType,
    @JsonProperty("memory_limit") Integer memoryLimit,
    @JsonProperty("project_id") String projectId,
    @JsonProperty("task_id") String taskId,
    @JsonProperty("task_description") String taskDescription,
    @JsonProperty("memory_trace_id") String memoryTraceId,
    @JsonProperty("max_cycles") Integer maxCycles,
    @JsonProperty("exit_conditions") List<String> exitConditions,
    @JsonProperty("loop_count") Integer loopCount
) {

    public LoopRequest {
        exitConditions = exitConditions == null ? List.of() : List.copyOf(exitConditions);
    }

    public static LoopRequest of(String agentId, String loopType) {
        return new LoopRequest(agentId, loopType, null, null, null, null, null, null, null, null);
    }
}
