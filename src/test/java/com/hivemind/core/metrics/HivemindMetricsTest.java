package com.hivemind.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HivemindMetricsTest {

    private SimpleMeterRegistry registry;
    private HivemindMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new HivemindMetrics(registry);
    }

    @Test
    @DisplayName("recordRun creates a timer tagged by agent and outcome")
    void recordRun() {
        metrics.recordRun("HAL", "success", 1500);
        var timer = registry.find("hivemind.run.duration").tag("agent", "HAL").tag("outcome", "success").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
        assertEquals(1500.0, timer.totalTime(TimeUnit.MILLISECONDS));
    }

    @Test
    @DisplayName("recordRun tolerates a missing agent id")
    void recordRunUnknownAgent() {
        metrics.recordRun(null, "not_found", 0);
        assertNotNull(registry.find("hivemind.run.duration").tag("agent", "unknown").timer());
    }

    @Test
    @DisplayName("recordLoop counts by type and outcome")
    void recordLoop() {
        metrics.recordLoop("reflective", "ok");
        metrics.recordLoop("reflective", "ok");
        metrics.recordLoop("planning", "capped");

        assertEquals(2.0, registry.find("hivemind.loop.total")
                .tag("type", "reflective").tag("outcome", "ok").counter().count());
        assertEquals(1.0, registry.find("hivemind.loop.total")
                .tag("type", "planning").tag("outcome", "capped").counter().count());
    }

    @Test
    @DisplayName("recordDelegation increments the matching outcome")
    void recordDelegation() {
        metrics.recordDelegation("delegated");
        metrics.recordDelegation("capped");
        metrics.recordDelegation("capped");

        assertEquals(1.0, registry.find("hivemind.delegation.total").tag("outcome", "delegated").counter().count());
        assertEquals(2.0, registry.find("hivemind.delegation.total").tag("outcome", "capped").counter().count());
    }

    @Test
    @DisplayName("recordMemoryAppend counts by entry type")
    void recordMemoryAppend() {
        metrics.recordMemoryAppend("system_halt");
        var counter = registry.find("hivemind.memory.appends").tag("type", "system_halt").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }
}
