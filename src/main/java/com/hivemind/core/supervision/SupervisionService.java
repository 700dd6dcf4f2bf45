package com.hivemind.core.supervision;

import com.hivemind.core.caps.CapsPolicy;
import com.hivemind.core.events.EventBus;
import com.hivemind.core.events.HivemindEvent;
import com.hivemind.core.model.AgentRecord;
import com.hivemind.core.model.AgentState;
import com.hivemind.core.registry.AgentRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Watches agent activity on the {@link EventBus} and summarises it for operators:
 * event counts by type, the last event seen, and which agents are currently halted.
 */
@Service
public class SupervisionService {

    private static final Logger log = LoggerFactory.getLogger(SupervisionService.class);

    private final CapsPolicy caps;
    private final AgentRegistry registry;
    private final ConcurrentHashMap<String, AtomicLong> counts = new ConcurrentHashMap<>();
    private final EventBus.Subscription subscription;
    private volatile HivemindEvent lastEvent;

    public SupervisionService(EventBus eventBus, CapsPolicy caps, AgentRegistry registry) {
        this.caps = caps;
        this.registry = registry;
        this.subscription = eventBus.subscribeAll(this::onEvent);
    }

    void onEvent(HivemindEvent event) {
        counts.computeIfAbsent(event.eventType(), k -> new AtomicLong()).incrementAndGet();
        lastEvent = event;
        if (HivemindEvent.LOOP_CAPPED.equals(event.eventType())
                || HivemindEvent.DELEGATION_REFUSED.equals(event.eventType())) {
            log.info("Supervision: {} for agent {}", event.eventType(), event.agentId());
        }
    }

    public SupervisionStatus status() {
        var snapshot = new TreeMap<String, Long>();
        counts.forEach((type, count) -> snapshot.put(type, count.get()));
        var halted = registry.list().stream()
                .filter(a -> a.agentState() == AgentState.SYSTEM_HALT)
                .map(AgentRecord::agentId)
                .toList();
        HivemindEvent last = lastEvent;
        return new SupervisionStatus(caps, snapshot, halted,
                last == null ? null : last.eventType(),
                last == null ? null : last.timestamp());
    }

    public long count(String eventType) {
        AtomicLong count = counts.get(eventType);
        return count == null ? 0 : count.get();
    }

    @PreDestroy
    void stop() {
        subscription.unsubscribe();
    }

    /**
     * @param eventCounts  events seen since startup, keyed by type
     * @param haltedAgents agents currently in system_halt
     */
    public record SupervisionStatus(
        CapsPolicy caps,
        Map<String, Long> eventCounts,
        List<String> haltedAgents,
        String lastEventType,
        Instant lastEventAt
    ) {}
}
