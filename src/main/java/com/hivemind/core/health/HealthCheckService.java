package com.hivemind.core.health;

import com.hivemind.core.llm.InferenceGateway;
import com.hivemind.core.memory.MemoryStore;
import com.hivemind.core.registry.AgentRegistry;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private final AgentRegistry registry;
    private final MemoryStore memoryStore;
    private final InferenceGateway inference;

    public HealthCheckService(AgentRegistry registry, MemoryStore memoryStore, InferenceGateway inference) {
        this.registry = registry;
        this.memoryStore = memoryStore;
        this.inference = inference;
    }

    public List<HealthStatus> checkAll() {
        return List.of(checkRegistry(), checkMemory(), checkInference());
    }

    /**
     * UP when every component is UP, DOWN when any is DOWN, DEGRADED otherwise.
     */
    public static HealthStatus.Status rollUp(Collection<HealthStatus> checks) {
        var statuses = checks.stream().map(HealthStatus::status).toList();
        if (statuses.contains(HealthStatus.Status.DOWN)) {
            return HealthStatus.Status.DOWN;
        }
        if (statuses.contains(HealthStatus.Status.DEGRADED)) {
            return HealthStatus.Status.DEGRADED;
        }
        return HealthStatus.Status.UP;
    }

    private HealthStatus checkRegistry() {
        var metadata = Map.of("store", registry.describe(), "agents", String.valueOf(registry.size()));
        if (!registry.isPersistHealthy()) {
            return new HealthStatus("registry", HealthStatus.Status.DOWN,
                    "Last registry write failed", metadata);
        }
        if (registry.isRecoveredFromDefaults()) {
            return new HealthStatus("registry", HealthStatus.Status.DEGRADED,
                    "Registry was unreadable at startup; running on built-in agents", metadata);
        }
        return new HealthStatus("registry", HealthStatus.Status.UP,
                registry.size() + " agents registered", metadata);
    }

    private HealthStatus checkMemory() {
        var metadata = Map.of("log", memoryStore.describe(), "entries", String.valueOf(memoryStore.size()));
        if (!memoryStore.isHealthy()) {
            return new HealthStatus("memory", HealthStatus.Status.DOWN,
                    "Memory log unavailable", metadata);
        }
        return new HealthStatus("memory", HealthStatus.Status.UP,
                memoryStore.size() + " entries", metadata);
    }

    private HealthStatus checkInference() {
        return new HealthStatus("inference", HealthStatus.Status.UP,
                "Provider available (" + inference.providerName() + ")", Map.of());
    }
}
