package com.hivemind.core.registry;

import com.hivemind.core.model.AgentRecord;
import com.hivemind.core.model.AgentState;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Built-in agents that must always be registered.
 */
public final class CoreAgents {

    public static final Set<String> DEFAULT_MODULES = Set.of("memory", "reflection", "loop", "delegate");

    private record Definition(String agentId, String name, String description, List<String> traits) {}

    private static final List<Definition> DEFINITIONS = List.of(
            new Definition("HAL", "HAL 9000",
                    "Builds minimal working solutions for simple tasks, performs safety checks and defers complex builds",
                    List.of("cautious", "methodical", "safety-focused")),
            new Definition("ASH", "Ash",
                    "Clinical analyst for logic under pressure and resolution of ambiguous decisions",
                    List.of("clinical", "precise", "logical")),
            new Definition("NOVA", "Nova",
                    "Designs and builds user-facing components, forms and styles",
                    List.of("creative", "visual", "detail-oriented")),
            new Definition("CRITIC", "Critic",
                    "Evaluates agent outputs for quality, validates loop outputs and logs its reasoning",
                    List.of("skeptical", "thorough", "constructive")),
            new Definition("ORCHESTRATOR", "Orchestrator",
                    "Routes tasks to the appropriate agents and tracks project progress",
                    List.of("organized", "strategic", "decisive"))
    );

    private CoreAgents() {}

    public static List<String> ids() {
        return DEFINITIONS.stream().map(Definition::agentId).toList();
    }

    public static boolean isCore(String agentId) {
        return ids().contains(agentId);
    }

    /** Fresh record for a built-in agent with default metadata and an idle runtime state. */
    public static AgentRecord defaultRecord(String agentId, Instant now) {
        return DEFINITIONS.stream()
                .filter(d -> d.agentId().equals(agentId))
                .findFirst()
                .map(d -> new AgentRecord(d.agentId(), d.name(), d.description(), d.traits(),
                        DEFAULT_MODULES, now, 0, AgentState.IDLE, now))
                .orElseThrow(() -> new IllegalArgumentException("Not a core agent: " + agentId));
    }
}
