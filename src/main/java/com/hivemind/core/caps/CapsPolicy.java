package com.hivemind.core.caps;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Process-wide safety ceilings, loaded once at startup and never mutated.
 *
 * @param maxLoopsPerTask    loop cycles an agent may consume before it is halted
 * @param maxDelegationDepth length of delegation chain at which hand-offs are refused
 */
public record CapsPolicy(
    @JsonProperty("max_loops_per_task") int maxLoopsPerTask,
    @JsonProperty("max_delegation_depth") int maxDelegationDepth
) {

    public static final int DEFAULT_MAX_LOOPS_PER_TASK = 5;
    public static final int DEFAULT_MAX_DELEGATION_DEPTH = 3;

    public CapsPolicy {
        if (maxLoopsPerTask < 1) {
            throw new IllegalArgumentException("max_loops_per_task must be >= 1, got " + maxLoopsPerTask);
        }
        if (maxDelegationDepth < 1) {
            throw new IllegalArgumentException("max_delegation_depth must be >= 1, got " + maxDelegationDepth);
        }
    }

    public static CapsPolicy defaults() {
        return new CapsPolicy(DEFAULT_MAX_LOOPS_PER_TASK, DEFAULT_MAX_DELEGATION_DEPTH);
    }

    public boolean loopCapReached(int loopCount) {
        return loopCount >= maxLoopsPerTask;
    }

    public boolean delegationCapReached(int depth) {
        return depth >= maxDelegationDepth;
    }
}
