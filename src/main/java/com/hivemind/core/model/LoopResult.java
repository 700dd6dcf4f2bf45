package com.hivemind.core.model;

/**
 * Outcome of a loop invocation.
 *
 * @param loopCycles       the agent's loop count after this invocation
 * @param loopSummary      reflection produced by the first inference step
 * @param loopResult       plan produced by the second inference step
 * @param exitConditionMet whether one of the requested exit conditions appeared in the output
 */
public record LoopResult(
    LoopStatus status,
    String agentId,
    String loopId,
    String loopType,
    int loopCycles,
    String loopSummary,
    String loopResult,
    String memoryId,
    boolean exitConditionMet,
    String message
) {

    public static LoopResult ok(String agentId, String loopId, LoopType type, int cycles,
                                String summary, String result, String memoryId, boolean exitConditionMet) {
        return new LoopResult(LoopStatus.OK, agentId, loopId, type.wireName(), cycles, summary, result,
                memoryId, exitConditionMet, "Loop cycle " + cycles + " completed");
    }

    public static LoopResult terminal(LoopStatus status, String agentId, String loopId, String loopType,
                                      int cycles, String memoryId, String message) {
        return new LoopResult(status, agentId, loopId, loopType, cycles, null, null, memoryId, false, message);
    }

    public LoopRun toRun() {
        int executed = status == LoopStatus.OK ? 1 : 0;
        return new LoopRun(loopId, agentId, loopType, executed, status.terminalReason());
    }
}
