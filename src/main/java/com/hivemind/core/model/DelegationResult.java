package com.hivemind.core.model;

import java.util.Map;

/**
 * Outcome of a delegation attempt.
 *
 * @param details delegation metadata: agents, depth reached, memory id and, when executed, the run outcome
 */
public record DelegationResult(
    DelegationStatus status,
    String message,
    Map<String, Object> details
) {

    public DelegationResult {
        details = details == null ? Map.of() : details;
    }
}
