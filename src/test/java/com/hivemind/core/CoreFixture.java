package com.hivemind.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.hivemind.core.caps.CapsPolicy;
import com.hivemind.core.delegation.DelegationManager;
import com.hivemind.core.engine.RunEngine;
import com.hivemind.core.events.EventBus;
import com.hivemind.core.llm.CountingInferenceProvider;
import com.hivemind.core.llm.InferenceGateway;
import com.hivemind.core.llm.InferenceProperties;
import com.hivemind.core.loop.LoopProperties;
import com.hivemind.core.loop.LoopScheduler;
import com.hivemind.core.memory.MemoryLog;
import com.hivemind.core.memory.MemoryStore;
import com.hivemind.core.metrics.HivemindMetrics;
import com.hivemind.core.persistence.InMemoryAgentRegistryStore;
import com.hivemind.core.persistence.InMemoryMemoryLog;
import com.hivemind.core.registry.AgentRegistry;
import com.hivemind.core.registry.AgentRegistryStore;
import com.hivemind.core.supervision.SupervisionService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * The orchestration core wired by hand over in-memory stores, a controllable clock
 * and a {@link CountingInferenceProvider}.
 */
public class CoreFixture {

    public final MutableClock clock = MutableClock.at("2026-01-01T00:00:00Z");
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final HivemindMetrics metrics = new HivemindMetrics(meterRegistry);
    public final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    public final CountingInferenceProvider provider = new CountingInferenceProvider();
    public final EventBus eventBus = new EventBus(clock);
    public final CapsPolicy caps;
    public final MemoryStore memoryStore;
    public final AgentRegistry registry;
    public final InferenceGateway gateway;
    public final RunEngine runEngine;
    public final LoopScheduler loopScheduler;
    public final DelegationManager delegationManager;
    public final SupervisionService supervision;

    public CoreFixture() {
        this(CapsPolicy.defaults());
    }

    public CoreFixture(CapsPolicy caps) {
        this(caps, new InMemoryMemoryLog(), new InMemoryAgentRegistryStore());
    }

    public CoreFixture(CapsPolicy caps, MemoryLog memoryLog, AgentRegistryStore registryStore) {
        this.caps = caps;
        this.memoryStore = new MemoryStore(memoryLog, metrics, clock);
        this.registry = new AgentRegistry(registryStore, memoryStore, clock);
        var inferenceProperties = new InferenceProperties();
        inferenceProperties.setTimeoutSeconds(2);
        this.gateway = new InferenceGateway(provider, inferenceProperties);
        this.runEngine = new RunEngine(registry, memoryStore, gateway, eventBus, metrics, objectMapper);
        this.loopScheduler = new LoopScheduler(registry, memoryStore, gateway, caps, new LoopProperties(),
                eventBus, metrics);
        this.delegationManager = new DelegationManager(registry, memoryStore, runEngine, caps, eventBus,
                metrics, objectMapper);
        this.supervision = new SupervisionService(eventBus, caps, registry);
    }
}
