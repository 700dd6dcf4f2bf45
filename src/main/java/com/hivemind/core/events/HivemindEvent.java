package com.hivemind.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by the orchestration core, consumed by supervision.
 *
 * @param eventType event type (e.g. "run.completed", "loop.capped", "delegation.refused")
 * @param agentId   the agent this event relates to
 * @param taskId    the task, when the operation carried one
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record HivemindEvent(
    String eventType,
    String agentId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String RUN_COMPLETED = "run.completed";
    public static final String RUN_FAILED = "run.failed";
    public static final String LOOP_COMPLETED = "loop.completed";
    public static final String LOOP_CAPPED = "loop.capped";
    public static final String LOOP_INCOMPLETE = "loop.incomplete";
    public static final String LOOP_FAILED = "loop.failed";
    public static final String DELEGATION_ACCEPTED = "delegation.accepted";
    public static final String DELEGATION_REFUSED = "delegation.refused";
}
