package com.hivemind.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hivemind.core.events.EventBus;
import com.hivemind.core.events.HivemindEvent;
import com.hivemind.core.llm.InferenceException;
import com.hivemind.core.llm.InferenceGateway;
import com.hivemind.core.logging.MdcContext;
import com.hivemind.core.memory.MemoryStore;
import com.hivemind.core.metrics.HivemindMetrics;
import com.hivemind.core.model.AgentState;
import com.hivemind.core.model.MemoryEntry;
import com.hivemind.core.model.NewMemory;
import com.hivemind.core.model.RunRequest;
import com.hivemind.core.model.RunResult;
import com.hivemind.core.registry.AgentRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Set;

/**
 * Executes a single agent invocation: one prompt, one inference call, one memory entry.
 * <p>
 * Failures never escape {@link #run}; they come back as {@link RunResult#error} and the
 * agent is always returned to idle.
 */
@Service
public class RunEngine {

    private static final Logger log = LoggerFactory.getLogger(RunEngine.class);

    static final String MEMORY_TYPE = "task_execution";
    static final String DEFAULT_FORMAT = "text";

    private final AgentRegistry registry;
    private final MemoryStore memoryStore;
    private final InferenceGateway inference;
    private final EventBus eventBus;
    private final HivemindMetrics metrics;
    private final ObjectMapper objectMapper;

    public RunEngine(AgentRegistry registry, MemoryStore memoryStore, InferenceGateway inference,
                     EventBus eventBus, HivemindMetrics metrics, ObjectMapper objectMapper) {
        this.registry = registry;
        this.memoryStore = memoryStore;
        this.inference = inference;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
    }

    public RunResult run(RunRequest request) {
        String agentId = request.agentId();
        if (!registry.contains(agentId)) {
            log.warn("Run requested for unknown agent {}", agentId);
            metrics.recordRun("unknown", "not_found", 0);
            return RunResult.notFound(request);
        }

        MdcContext.setTask(agentId, request.taskId(), request.projectId());
        long start = System.nanoTime();
        try {
            registry.markBusy(agentId, AgentState.RESPONDING);
            log.info("Running agent {} on task {}", agentId, request.taskId());

            String response = inference.infer(buildPrompt(request));
            double seconds = (System.nanoTime() - start) / 1_000_000_000.0;

            MemoryEntry entry = memoryStore.append(
                    NewMemory.of(agentId, request.projectId(), MEMORY_TYPE,
                                    "Objective: " + request.objective() + "\nResponse: " + response)
                            .withTags(Set.of("run"))
                            .withTrace(request.taskId(), request.memoryTraceId())
                            .withStatus("success"));

            String format = request.expectedOutputType() == null || request.expectedOutputType().isBlank()
                    ? DEFAULT_FORMAT : request.expectedOutputType();
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            metrics.recordRun(agentId, "success", elapsedMs);
            eventBus.publish(HivemindEvent.RUN_COMPLETED, agentId, request.taskId(),
                    Map.of("memory_id", entry.memoryId(), "elapsed_ms", elapsedMs));
            log.info("Agent {} completed task {} in {} ms", agentId, request.taskId(), elapsedMs);
            return RunResult.success(request, response, format, seconds, entry.memoryId());
        } catch (InferenceException e) {
            log.warn("Inference failed for agent {}: {}", agentId, e.getMessage());
            return failed(request, start, "Inference failed: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Run failed for agent {}: {}", agentId, e.getMessage(), e);
            return failed(request, start, "Run failed: " + e.getMessage());
        } finally {
            restoreIdle(agentId);
            MdcContext.clear();
        }
    }

    String buildPrompt(RunRequest request) {
        String objective = request.objective() == null ? "" : request.objective();
        if (request.inputData().isEmpty()) {
            return objective;
        }
        return objective + "\n\nInput data:\n" + serialize(request.inputData());
    }

    private String serialize(Map<String, Object> inputData) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(inputData);
        } catch (JsonProcessingException e) {
            log.debug("input_data not serialisable as JSON, using toString: {}", e.getMessage());
            return String.valueOf(inputData);
        }
    }

    private RunResult failed(RunRequest request, long start, String message) {
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        metrics.recordRun(request.agentId(), "error", elapsedMs);
        eventBus.publish(HivemindEvent.RUN_FAILED, request.agentId(), request.taskId(), Map.of("message", message));
        return RunResult.error(request, message);
    }

    private void restoreIdle(String agentId) {
        try {
            registry.releaseToIdle(agentId);
        } catch (RuntimeException e) {
            log.error("Could not return agent {} to idle: {}", agentId, e.getMessage());
        }
    }
}
