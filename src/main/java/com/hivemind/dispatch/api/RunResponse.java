package com.hivemind.dispatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hivemind.core.model.RunResult;

/**
 * JSON response for POST /api/v1/agent/run.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunResponse(
    String status,
    String log,
    Output output,
    @JsonProperty("task_id") String taskId,
    @JsonProperty("project_id") String projectId,
    @JsonProperty("memory_trace_id") String memoryTraceId,
    @JsonProperty("contract_version") String contractVersion,
    String message
) {

    public static final String CONTRACT_VERSION = "1.0.0";

    public record Output(
        @JsonProperty("result_text") String resultText,
        String format,
        @JsonProperty("processing_time") double processingTime,
        @JsonProperty("memory_id") String memoryId
    ) {}

    public static RunResponse from(RunResult result) {
        Output output = result.succeeded()
                ? new Output(result.resultText(), result.format(), result.processingTime(), result.memoryId())
                : null;
        return new RunResponse(
                result.status().wireName(),
                result.message(),
                output,
                result.taskId(),
                result.projectId(),
                result.memoryTraceId(),
                CONTRACT_VERSION,
                result.succeeded() ? null : result.message());
    }
}
