package com.hivemind.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for agent activity events.
 * <p>
 * Supports per-agent subscriptions and global subscriptions that receive all events.
 * Publishing never fails the caller: a subscriber that throws is logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<HivemindEvent>>> agentSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<HivemindEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    private final Clock clock;

    public EventBus(Clock clock) {
        this.clock = clock;
    }

    public void publish(HivemindEvent event) {
        log.debug("Publishing event: {} for agent {}", event.eventType(), event.agentId());

        List<Consumer<HivemindEvent>> agentSubs =
                event.agentId() == null ? null : agentSubscribers.get(event.agentId());
        if (agentSubs != null) {
            for (Consumer<HivemindEvent> subscriber : agentSubs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<HivemindEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Convenience for publishing with the current time.
     */
    public void publish(String eventType, String agentId, String taskId, Map<String, Object> payload) {
        publish(new HivemindEvent(eventType, agentId, taskId, payload, clock.instant()));
    }

    public Subscription subscribe(String agentId, Consumer<HivemindEvent> consumer) {
        agentSubscribers.computeIfAbsent(agentId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<HivemindEvent>> subs = agentSubscribers.get(agentId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    public Subscription subscribeAll(Consumer<HivemindEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<HivemindEvent> subscriber, HivemindEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
