package com.hivemind.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * A single agent invocation.
 *
 * @param agentId            agent to invoke
 * @param taskId             caller's task identifier, echoed back for traceability
 * @param projectId          project scope for the memory entry
 * @param objective          what the agent should achieve
 * @param inputData          structured input, serialised into the prompt
 * @param memoryTraceId      optional trace id linking related memory entries
 * @param expectedOutputType optional output format hint (defaults to "text")
 */
public record RunRequest(
    @JsonProperty("agent_id") String agentId,
    @JsonProperty("task_id") String taskId,
    @JsonProperty("project_id") String projectId,
    String objective,
    @JsonProperty("input_data") Map<String, Object> inputData,
    @JsonProperty("memory_trace_id") String memoryTraceId,
    @JsonProperty("expected_output_type") String expectedOutputType
) {

    public RunRequest {
        inputData = inputData == null ? Map.of() : inputData;
    }
}
