package com.hivemind.core.loop;

import com.hivemind.core.model.LoopRequest;
import com.hivemind.core.model.LoopType;
import com.hivemind.core.model.MemoryEntry;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Prompt templates for the two inference steps of a loop cycle.
 */
final class LoopPrompts {

    static final String NO_CONTEXT = "(no recorded actions)";

    private LoopPrompts() {}

    /**
     * First step: a type-specific look back over the agent's recent memory.
     */
    static String reflection(LoopType type, String agentId, LoopRequest request, List<MemoryEntry> context) {
        String actions = render(context);
        return switch (type) {
            case REFLECTIVE -> "You are " + agentId + ". Reflect on your recent actions and summarise "
                    + "what they show:\n" + actions;
            case TASK -> "You are " + agentId + ". Your task is: " + taskText(request) + "\n"
                    + "Reflect on your recent actions and analyze progress toward the task:\n" + actions;
            case PLANNING -> "You are " + agentId + ". Reflect on your recent actions as input for planning "
                    + "and identify open goals:\n" + actions;
        };
    }

    /**
     * Second step: turn the reflection into the next action.
     */
    static String plan(String reflection) {
        return "Based on this reflection: '" + reflection + "', what should the agent do next?";
    }

    static String render(List<MemoryEntry> context) {
        if (context.isEmpty()) {
            return NO_CONTEXT;
        }
        return context.stream()
                .map(m -> "- [" + m.type() + "] " + m.content())
                .collect(Collectors.joining("\n"));
    }

    private static String taskText(LoopRequest request) {
        if (request.taskDescription() != null && !request.taskDescription().isBlank()) {
            return request.taskDescription();
        }
        return request.taskId() != null ? request.taskId() : "the current task";
    }
}
