package com.hivemind.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Set;

/**
 * Inbound JSON body for POST /api/v1/memory/write.
 *
 * @param content free text, or any JSON value which is stored in its serialised form
 */
public record MemoryWriteRequest(
    @JsonProperty("agent_id") String agentId,
    @JsonProperty("project_id") String projectId,
    String type,
    JsonNode content,
    Set<String> tags,
    @JsonProperty("task_id") String taskId,
    @JsonProperty("memory_trace_id") String memoryTraceId,
    String status
) {

    public String contentText() {
        if (content == null || content.isNull()) {
            return "";
        }
        return content.isTextual() ? content.asText() : content.toString();
    }
}
