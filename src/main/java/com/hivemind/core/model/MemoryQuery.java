package com.hivemind.core.model;

import java.time.Instant;

/**
 * Filter for memory recall. Null fields do not constrain the result;
 * a {@code limit} of zero or less returns every match.
 */
public record MemoryQuery(
    String agentId,
    String projectId,
    String type,
    String tag,
    Instant since,
    int limit
) {

    public static MemoryQuery of(String agentId, String projectId, String type, int limit) {
        return new MemoryQuery(agentId, projectId, type, null, null, limit);
    }

    public boolean matches(MemoryEntry entry) {
        if (agentId != null && !agentId.equals(entry.agentId())) return false;
        if (projectId != null && !projectId.equals(entry.projectId())) return false;
        if (type != null && !type.equals(entry.type())) return false;
        if (tag != null && !entry.tags().contains(tag)) return false;
        return since == null || !entry.timestamp().isBefore(since);
    }
}
