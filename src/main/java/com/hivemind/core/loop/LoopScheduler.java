package com.hivemind.core.loop;

import com.hivemind.core.caps.CapsPolicy;
import com.hivemind.core.events.EventBus;
import com.hivemind.core.events.HivemindEvent;
import com.hivemind.core.llm.InferenceException;
import com.hivemind.core.llm.InferenceGateway;
import com.hivemind.core.logging.MdcContext;
import com.hivemind.core.memory.MemoryStore;
import com.hivemind.core.metrics.HivemindMetrics;
import com.hivemind.core.model.AgentRecord;
import com.hivemind.core.model.AgentState;
import com.hivemind.core.model.LoopRequest;
import com.hivemind.core.model.LoopResult;
import com.hivemind.core.model.LoopStatus;
import com.hivemind.core.model.LoopType;
import com.hivemind.core.model.MemoryEntry;
import com.hivemind.core.model.MemoryQuery;
import com.hivemind.core.model.NewMemory;
import com.hivemind.core.persistence.StorageException;
import com.hivemind.core.registry.AgentRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Runs one capped cognitive loop cycle for an agent.
 * <p>
 * The cap check, the loop-count increment and the state change happen as one
 * step under the agent's registry lock, before any inference. Concurrent
 * invocations for the same agent therefore can never push its loop count past
 * {@link CapsPolicy#maxLoopsPerTask()}. Inference runs outside the lock.
 * <p>
 * The counter is per agent and survives across invocations; only an operator
 * reset ({@link AgentRegistry#resetLoopCount}) clears it.
 */
@Service
public class LoopScheduler {

    private static final Logger log = LoggerFactory.getLogger(LoopScheduler.class);

    static final String HALT_TYPE = "system_halt";

    private final AgentRegistry registry;
    private final MemoryStore memoryStore;
    private final InferenceGateway inference;
    private final CapsPolicy caps;
    private final LoopProperties properties;
    private final EventBus eventBus;
    private final HivemindMetrics metrics;

    public LoopScheduler(AgentRegistry registry, MemoryStore memoryStore, InferenceGateway inference,
                         CapsPolicy caps, LoopProperties properties, EventBus eventBus, HivemindMetrics metrics) {
        this.registry = registry;
        this.memoryStore = memoryStore;
        this.inference = inference;
        this.caps = caps;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /** Outcome of the locked admission step. */
    private record Gate(LoopStatus status, int cycles, String memoryId, String message) {}

    public LoopResult loop(LoopRequest request) {
        String agentId = request.agentId();
        String loopId = UUID.randomUUID().toString();

        if (!registry.contains(agentId)) {
            log.warn("Loop requested for unknown agent {}", agentId);
            return finish(request, LoopResult.terminal(LoopStatus.NOT_FOUND, agentId, loopId, request.loopType(),
                    0, null, "Agent with ID '" + agentId + "' not found"));
        }
        Optional<LoopType> resolved = LoopType.fromWire(request.loopType());
        if (resolved.isEmpty()) {
            return finish(request, LoopResult.terminal(LoopStatus.ERROR, agentId, loopId, request.loopType(),
                    registry.require(agentId).loopCount(), null,
                    "Unknown loop type '" + request.loopType() + "'. Expected reflective, task or planning"));
        }
        LoopType type = resolved.get();

        MdcContext.setLoop(agentId, loopId);
        try {
            Gate gate;
            try {
                gate = registry.withAgentLock(agentId, () -> admit(request, type));
            } catch (StorageException e) {
                log.error("Loop admission failed for agent {}: {}", agentId, e.getMessage());
                return finish(request, LoopResult.terminal(LoopStatus.ERROR, agentId, loopId, type.wireName(),
                        0, null, "Storage failure: " + e.getMessage()));
            }
            if (gate.status() != LoopStatus.OK) {
                return finish(request, LoopResult.terminal(gate.status(), agentId, loopId, type.wireName(),
                        gate.cycles(), gate.memoryId(), gate.message()));
            }
            return finish(request, execute(request, type, loopId, gate.cycles()));
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Runs under the agent lock. Decides whether this invocation may consume a cycle and,
     * if so, consumes it.
     */
    private Gate admit(LoopRequest request, LoopType type) {
        String agentId = request.agentId();
        AgentRecord agent = registry.require(agentId);
        int requested = request.loopCount() == null ? 0 : Math.max(0, request.loopCount());
        int current = Math.max(agent.loopCount(), requested);

        if (caps.loopCapReached(current)) {
            registry.updateState(agentId, AgentState.SYSTEM_HALT);
            String memoryId = recordHalt(request, type, current);
            log.warn("Agent {} reached loop cap ({}/{}); halted", agentId, current, caps.maxLoopsPerTask());
            return new Gate(LoopStatus.CAPPED, current, memoryId,
                    "Loop limit reached (" + current + "/" + caps.maxLoopsPerTask() + "). Agent halted until reset");
        }
        if (request.maxCycles() != null && request.maxCycles() > 0 && current >= request.maxCycles()) {
            log.info("Agent {} reached requested max_cycles {}", agentId, request.maxCycles());
            return new Gate(LoopStatus.INCOMPLETE, current, null,
                    "Requested max_cycles (" + request.maxCycles() + ") reached without completing");
        }
        int cycles = registry.incrementLoopCount(agentId);
        registry.markBusy(agentId, AgentState.LOOPING);
        return new Gate(LoopStatus.OK, cycles, null, null);
    }

    private String recordHalt(LoopRequest request, LoopType type, int current) {
        try {
            return memoryStore.append(NewMemory.of(request.agentId(), request.projectId(), HALT_TYPE,
                            "Loop limit reached: " + current + " of " + caps.maxLoopsPerTask()
                                    + " cycles used (" + type.wireName() + " loop refused)")
                    .withTags(Set.of("loop_limit", "supervision"))
                    .withTrace(request.taskId(), request.memoryTraceId())
                    .withStatus("capped")).memoryId();
        } catch (StorageException e) {
            log.error("system_halt entry for agent {} not written: {}", request.agentId(), e.getMessage());
            return null;
        }
    }

    private LoopResult execute(LoopRequest request, LoopType type, String loopId, int cycles) {
        String agentId = request.agentId();
        try {
            int limit = request.memoryLimit() != null ? request.memoryLimit() : properties.getDefaultMemoryLimit();
            List<MemoryEntry> context = memoryStore.query(
                    new MemoryQuery(agentId, request.projectId(), null, null, null, limit));

            log.info("Agent {} {} loop cycle {} with {} memories", agentId, type.wireName(), cycles, context.size());
            String summary = inference.infer(LoopPrompts.reflection(type, agentId, request, context));
            String plan = inference.infer(LoopPrompts.plan(summary));
            boolean exitMet = exitConditionMet(request.exitConditions(), summary, plan);

            MemoryEntry entry = memoryStore.append(NewMemory.of(agentId, request.projectId(), type.wireName(),
                            "Summary: " + summary + "\nResult: " + plan)
                    .withTags(Set.of("loop", type.wireName(), "loop_id:" + loopId))
                    .withTrace(request.taskId(), request.memoryTraceId())
                    .withStatus("ok"));
            return LoopResult.ok(agentId, loopId, type, cycles, summary, plan, entry.memoryId(), exitMet);
        } catch (InferenceException e) {
            log.warn("Loop {} for agent {} failed: {}", loopId, agentId, e.getMessage());
            return LoopResult.terminal(LoopStatus.ERROR, agentId, loopId, type.wireName(), cycles, null,
                    "Inference failed: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Loop {} for agent {} failed: {}", loopId, agentId, e.getMessage(), e);
            return LoopResult.terminal(LoopStatus.ERROR, agentId, loopId, type.wireName(), cycles, null,
                    "Loop failed: " + e.getMessage());
        } finally {
            try {
                registry.releaseToIdle(agentId);
            } catch (RuntimeException e) {
                log.error("Could not return agent {} to idle: {}", agentId, e.getMessage());
            }
        }
    }

    static boolean exitConditionMet(List<String> conditions, String... outputs) {
        for (String condition : conditions) {
            if (condition == null || condition.isBlank()) {
                continue;
            }
            String needle = condition.toLowerCase(Locale.ROOT);
            for (String output : outputs) {
                if (output != null && output.toLowerCase(Locale.ROOT).contains(needle)) {
                    return true;
                }
            }
        }
        return false;
    }

    private LoopResult finish(LoopRequest request, LoopResult result) {
        String outcome = result.status().name().toLowerCase(Locale.ROOT);
        metrics.recordLoop(LoopType.fromWire(result.loopType()).map(LoopType::wireName).orElse("unknown"), outcome);
        String eventType = switch (result.status()) {
            case OK -> HivemindEvent.LOOP_COMPLETED;
            case CAPPED -> HivemindEvent.LOOP_CAPPED;
            case INCOMPLETE -> HivemindEvent.LOOP_INCOMPLETE;
            case ERROR, NOT_FOUND -> HivemindEvent.LOOP_FAILED;
        };
        eventBus.publish(eventType, result.agentId(), request.taskId(),
                Map.of("loop_id", result.loopId(), "loop_cycles", result.loopCycles()));
        return result;
    }
}
