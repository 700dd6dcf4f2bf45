package com.hivemind.core.delegation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hivemind.core.caps.CapsPolicy;
import com.hivemind.core.engine.RunEngine;
import com.hivemind.core.events.EventBus;
import com.hivemind.core.events.HivemindEvent;
import com.hivemind.core.logging.MdcContext;
import com.hivemind.core.memory.MemoryStore;
import com.hivemind.core.metrics.HivemindMetrics;
import com.hivemind.core.model.DelegationRequest;
import com.hivemind.core.model.DelegationResult;
import com.hivemind.core.model.DelegationStatus;
import com.hivemind.core.model.MemoryEntry;
import com.hivemind.core.model.NewMemory;
import com.hivemind.core.model.RunRequest;
import com.hivemind.core.model.RunResult;
import com.hivemind.core.persistence.StorageException;
import com.hivemind.core.registry.AgentRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Hands tasks from one agent to another, refusing chains deeper than
 * {@link CapsPolicy#maxDelegationDepth()}.
 * <p>
 * The depth carried by a request is the depth already reached. An accepted
 * delegation records a {@code delegation} memory entry for the sending agent
 * and, with {@code auto_execute}, runs the task on the receiver passing
 * {@code delegation_depth + 1} along in the run's input data.
 */
@Service
public class DelegationManager {

    private static final Logger log = LoggerFactory.getLogger(DelegationManager.class);

    static final String MEMORY_TYPE = "delegation";
    static final String HALT_TYPE = "system_halt";

    private final AgentRegistry registry;
    private final MemoryStore memoryStore;
    private final RunEngine runEngine;
    private final CapsPolicy caps;
    private final EventBus eventBus;
    private final HivemindMetrics metrics;
    private final ObjectMapper objectMapper;

    public DelegationManager(AgentRegistry registry, MemoryStore memoryStore, RunEngine runEngine,
                             CapsPolicy caps, EventBus eventBus, HivemindMetrics metrics,
                             ObjectMapper objectMapper) {
        this.registry = registry;
        this.memoryStore = memoryStore;
        this.runEngine = runEngine;
        this.caps = caps;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
    }

    public DelegationResult delegate(DelegationRequest request) {
        if (isBlank(request.fromAgent()) || isBlank(request.toAgent()) || isBlank(request.task())) {
            return finish(request, DelegationStatus.ERROR, "from_agent, to_agent and task are required", null);
        }
        if (request.depth() < 0) {
            return finish(request, DelegationStatus.ERROR,
                    "delegation_depth must be >= 0, got " + request.depth(), null);
        }

        MdcContext.setTask(request.fromAgent(), null, request.projectId());
        try {
            if (caps.delegationCapReached(request.depth())) {
                return refuse(request);
            }
            for (String agentId : new String[] {request.fromAgent(), request.toAgent()}) {
                if (!registry.contains(agentId)) {
                    log.warn("Delegation references unknown agent {}", agentId);
                    return finish(request, DelegationStatus.NOT_FOUND,
                            "Agent with ID '" + agentId + "' not found", Map.of("agent_id", agentId));
                }
            }
            return accept(request);
        } catch (StorageException e) {
            log.error("Delegation from {} to {} failed: {}", request.fromAgent(), request.toAgent(), e.getMessage());
            return finish(request, DelegationStatus.ERROR, "Storage failure: " + e.getMessage(), null);
        } finally {
            MdcContext.clear();
        }
    }

    private DelegationResult refuse(DelegationRequest request) {
        String message = "Delegation depth limit reached (" + request.depth() + "/"
                + caps.maxDelegationDepth() + ")";
        log.warn("Refusing delegation {} -> {}: {}", request.fromAgent(), request.toAgent(), message);

        if (registry.contains(request.fromAgent())) {
            try {
                memoryStore.append(NewMemory.of(request.fromAgent(), request.projectId(), HALT_TYPE,
                                message + " delegating to " + request.toAgent() + ": " + request.task())
                        .withTags(Set.of("delegation_limit", "supervision"))
                        .withStatus("capped"));
            } catch (StorageException e) {
                log.error("system_halt entry for agent {} not written: {}", request.fromAgent(), e.getMessage());
            }
        }
        var details = new LinkedHashMap<String, Object>();
        details.put("from_agent", request.fromAgent());
        details.put("to_agent", request.toAgent());
        details.put("delegation_depth", request.depth());
        details.put("max_delegation_depth", caps.maxDelegationDepth());
        return finish(request, DelegationStatus.CAPPED, message, details);
    }

    private DelegationResult accept(DelegationRequest request) {
        int depth = request.depth();
        var link = new LinkedHashMap<String, Object>();
        link.put("from_agent", request.fromAgent());
        link.put("to_agent", request.toAgent());
        link.put("task", request.task());
        link.put("delegation_depth", depth);

        MemoryEntry entry = memoryStore.append(NewMemory.of(request.fromAgent(), request.projectId(), MEMORY_TYPE,
                        toJson(link))
                .withTags(Set.of("delegation", "to:" + request.toAgent()))
                .withStatus("delegated"));
        log.info("Delegated task from {} to {} at depth {}", request.fromAgent(), request.toAgent(), depth);

        var details = new LinkedHashMap<String, Object>(link);
        details.put("memory_id", entry.memoryId());

        if (request.shouldExecute()) {
            RunResult run = runEngine.run(new RunRequest(
                    request.toAgent(),
                    "delegation-" + entry.memoryId(),
                    request.projectId(),
                    request.task(),
                    Map.of("delegated_by", request.fromAgent(), "delegation_depth", depth + 1),
                    entry.memoryId(),
                    null));
            var execution = new LinkedHashMap<String, Object>();
            execution.put("status", run.status());
            execution.put("result_text", run.resultText());
            execution.put("memory_id", run.memoryId());
            execution.put("message", run.message());
            details.put("execution", execution);
            details.put("next_delegation_depth", depth + 1);
        }
        return finish(request, DelegationStatus.DELEGATED,
                "Task delegated from " + request.fromAgent() + " to " + request.toAgent(), details);
    }

    private String toJson(Map<String, Object> value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Delegation record not serialisable", e);
        }
    }

    private DelegationResult finish(DelegationRequest request, DelegationStatus status, String message,
                                    Map<String, Object> details) {
        metrics.recordDelegation(status.wireName());
        if (request.fromAgent() != null) {
            eventBus.publish(status == DelegationStatus.DELEGATED
                            ? HivemindEvent.DELEGATION_ACCEPTED : HivemindEvent.DELEGATION_REFUSED,
                    request.fromAgent(), null, Map.of("status", status.wireName(), "message", message));
        }
        return new DelegationResult(status, message, details);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
