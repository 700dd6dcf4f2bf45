package com.hivemind.core.model;

/**
 * Summary view of one loop invocation, derived from a {@link LoopResult}.
 */
public record LoopRun(
    String loopId,
    String agentId,
    String loopType,
    int cyclesExecuted,
    TerminalReason terminalReason
) {}
