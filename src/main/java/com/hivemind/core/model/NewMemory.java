package com.hivemind.core.model;

import java.util.Set;

/**
 * Caller-supplied part of a memory entry; the store adds id, sequence and timestamp.
 */
public record NewMemory(
    String agentId,
    String projectId,
    String type,
    String content,
    Set<String> tags,
    String taskId,
    String memoryTraceId,
    String status
) {

    /** Project scope used when a caller has none. */
    public static final String DEFAULT_PROJECT = "default";

    public NewMemory {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agent_id is required");
        }
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type is required");
        }
        projectId = projectId == null || projectId.isBlank() ? DEFAULT_PROJECT : projectId;
        content = content == null ? "" : content;
        tags = Labels.sortedSet(tags);
    }

    public static NewMemory of(String agentId, String projectId, String type, String content) {
        return new NewMemory(agentId, projectId, type, content, Set.of(), null, null, null);
    }

    public NewMemory withTags(Set<String> newTags) {
        return new NewMemory(agentId, projectId, type, content, newTags, taskId, memoryTraceId, status);
    }

    public NewMemory withTrace(String newTaskId, String newMemoryTraceId) {
        return new NewMemory(agentId, projectId, type, content, tags, newTaskId, newMemoryTraceId, status);
    }

    public NewMemory withStatus(String newStatus) {
        return new NewMemory(agentId, projectId, type, content, tags, taskId, memoryTraceId, newStatus);
    }
}
