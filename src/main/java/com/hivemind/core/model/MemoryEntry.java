package com.hivemind.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Set;

/**
 * An immutable, timestamped record of something an agent said, did or observed.
 *
 * @param memoryId      unique id assigned at write time
 * @param sequence      store-wide insertion counter, the tie-breaker for equal timestamps
 * @param agentId       owning agent
 * @param projectId     project scope
 * @param type          free-form tag such as task_execution, reflection, delegation
 * @param content       payload text
 * @param tags          optional labels
 * @param timestamp     write time
 * @param taskId        optional task the entry belongs to
 * @param memoryTraceId optional trace linking related entries
 * @param status        optional outcome marker (success, error, ...)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MemoryEntry(
    @JsonProperty("memory_id") String memoryId,
    long sequence,
    @JsonProperty("agent_id") String agentId,
    @JsonProperty("project_id") String projectId,
    String type,
    String content,
    Set<String> tags,
    Instant timestamp,
    @JsonProperty("task_id") String taskId,
    @JsonProperty("memory_trace_id") String memoryTraceId,
    String status
) implements Serializable {

    public MemoryEntry {
        tags = Labels.sortedSet(tags);
    }
}
