package com.hivemind.core.health;

import com.hivemind.core.llm.InferenceGateway;
import com.hivemind.core.memory.MemoryStore;
import com.hivemind.core.registry.AgentRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class HealthCheckServiceTest {

    private AgentRegistry registry;
    private MemoryStore memoryStore;
    private InferenceGateway inference;
    private HealthCheckService service;

    @BeforeEach
    void setUp() {
        registry = mock(AgentRegistry.class);
        memoryStore = mock(MemoryStore.class);
        inference = mock(InferenceGateway.class);

        when(registry.describe()).thenReturn("in-memory");
        when(registry.size()).thenReturn(3);
        when(registry.isPersistHealthy()).thenReturn(true);
        when(memoryStore.describe()).thenReturn("in-memory");
        when(memoryStore.size()).thenReturn(12);
        when(memoryStore.isHealthy()).thenReturn(true);
        when(inference.providerName()).thenReturn("OfflineInferenceProvider");

        service = new HealthCheckService(registry, memoryStore, inference);
    }

    private HealthStatus component(String name) {
        return service.checkAll().stream()
                .filter(s -> s.component().equals(name))
                .findFirst()
                .orElseThrow();
    }

    @Test
    @DisplayName("all components UP when stores are healthy")
    void allUp() {
        var results = service.checkAll();
        assertEquals(3, results.size());
        assertTrue(results.stream().allMatch(HealthStatus::isUp));
        assertEquals(HealthStatus.Status.UP, HealthCheckService.rollUp(service.checkAll()));
        assertEquals("3", component("registry").metadata().get("agents"));
        assertEquals("12", component("memory").metadata().get("entries"));
        assertTrue(component("inference").detail().contains("OfflineInferenceProvider"));
    }

    @Test
    @DisplayName("registry recovered from defaults is DEGRADED")
    void registryDegraded() {
        when(registry.isRecoveredFromDefaults()).thenReturn(true);

        assertEquals(HealthStatus.Status.DEGRADED, component("registry").status());
        assertEquals(HealthStatus.Status.DEGRADED, HealthCheckService.rollUp(service.checkAll()));
    }

    @Test
    @DisplayName("failed registry write is DOWN")
    void registryDown() {
        when(registry.isPersistHealthy()).thenReturn(false);
        when(registry.isRecoveredFromDefaults()).thenReturn(true);

        assertEquals(HealthStatus.Status.DOWN, component("registry").status());
        assertEquals(HealthStatus.Status.DOWN, HealthCheckService.rollUp(service.checkAll()));
    }

    @Test
    @DisplayName("unhealthy memory log is DOWN")
    void memoryDown() {
        when(memoryStore.isHealthy()).thenReturn(false);

        assertEquals(HealthStatus.Status.DOWN, component("memory").status());
        assertEquals(HealthStatus.Status.DOWN, HealthCheckService.rollUp(service.checkAll()));
    }

    @Test
    @DisplayName("roll-up: DOWN outranks DEGRADED, which outranks UP")
    void rollUpPrecedence() {
        var up = new HealthStatus("a", HealthStatus.Status.UP, "", Map.of());
        var degraded = new HealthStatus("b", HealthStatus.Status.DEGRADED, "", Map.of());
        var down = new HealthStatus("c", HealthStatus.Status.DOWN, "", Map.of());

        assertEquals(HealthStatus.Status.UP, HealthCheckService.rollUp(List.of(up)));
        assertEquals(HealthStatus.Status.DEGRADED, HealthCheckService.rollUp(List.of(up, degraded)));
        assertEquals(HealthStatus.Status.DOWN, HealthCheckService.rollUp(List.of(degraded, down, up)));
    }
}
