package com.hivemind.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for agent runs, loops, delegations and memory writes.
 */
@Service
public class HivemindMetrics {

    private final MeterRegistry registry;

    public HivemindMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRun(String agentId, String outcome, long ms) {
        Timer.builder("hivemind.run.duration")
                .tag("agent", agentId == null ? "unknown" : agentId)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordLoop(String loopType, String outcome) {
        Counter.builder("hivemind.loop.total")
                .tag("type", loopType)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordDelegation(String outcome) {
        Counter.builder("hivemind.delegation.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Counts memory writes by entry type.
     *
     * @param type memory type, e.g. task_execution or system_halt
     */
    public void recordMemoryAppend(String type) {
        Counter.builder("hivemind.memory.appends")
                .description("Entries appended to the memory log")
                .tag("type", type)
                .register(registry)
                .increment();
    }
}
