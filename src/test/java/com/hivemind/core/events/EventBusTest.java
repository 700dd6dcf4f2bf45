package com.hivemind.core.events;

import com.hivemind.core.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private final MutableClock clock = MutableClock.at("2026-01-01T00:00:00Z");
    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus(clock);
    }

    private static HivemindEvent event(String type, String agentId) {
        return new HivemindEvent(type, agentId, null, Map.of(), Instant.parse("2026-01-01T00:00:00Z"));
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublish {

        @Test
        @DisplayName("delivers to the agent's subscribers only")
        void agentScoped() {
            List<HivemindEvent> hal = new ArrayList<>();
            List<HivemindEvent> muse = new ArrayList<>();
            eventBus.subscribe("HAL", hal::add);
            eventBus.subscribe("MUSE", muse::add);

            eventBus.publish(event(HivemindEvent.LOOP_COMPLETED, "HAL"));

            assertEquals(1, hal.size());
            assertTrue(muse.isEmpty());
        }

        @Test
        @DisplayName("global subscribers see every event")
        void global() {
            List<HivemindEvent> all = new ArrayList<>();
            eventBus.subscribeAll(all::add);

            eventBus.publish(event(HivemindEvent.RUN_COMPLETED, "HAL"));
            eventBus.publish(event(HivemindEvent.DELEGATION_REFUSED, "MUSE"));

            assertEquals(List.of(HivemindEvent.RUN_COMPLETED, HivemindEvent.DELEGATION_REFUSED),
                    all.stream().map(HivemindEvent::eventType).toList());
        }

        @Test
        @DisplayName("events without an agent reach global subscribers")
        void nullAgent() {
            List<HivemindEvent> all = new ArrayList<>();
            eventBus.subscribeAll(all::add);

            assertDoesNotThrow(() -> eventBus.publish(event(HivemindEvent.DELEGATION_REFUSED, null)));
            assertEquals(1, all.size());
        }

        @Test
        @DisplayName("convenience publish stamps the clock time")
        void stampsClock() {
            List<HivemindEvent> all = new ArrayList<>();
            eventBus.subscribeAll(all::add);

            eventBus.publish(HivemindEvent.LOOP_CAPPED, "HAL", "t-1", Map.of("loop_count", 5));

            var received = all.get(0);
            assertEquals(clock.instant(), received.timestamp());
            assertEquals("t-1", received.taskId());
            assertEquals(5, received.payload().get("loop_count"));
        }
    }

    @Nested
    @DisplayName("unsubscribe")
    class Unsubscribe {

        @Test
        @DisplayName("stops delivery")
        void stops() {
            List<HivemindEvent> received = new ArrayList<>();
            var agentSub = eventBus.subscribe("HAL", received::add);
            var globalSub = eventBus.subscribeAll(received::add);

            agentSub.unsubscribe();
            globalSub.unsubscribe();
            eventBus.publish(event(HivemindEvent.RUN_COMPLETED, "HAL"));

            assertTrue(received.isEmpty());
        }
    }

    @Nested
    @DisplayName("error isolation")
    class ErrorIsolation {

        @Test
        @DisplayName("a throwing subscriber does not block the others or the publisher")
        void throwingSubscriber() {
            List<HivemindEvent> received = new ArrayList<>();
            eventBus.subscribe("HAL", e -> {
                throw new IllegalStateException("boom");
            });
            eventBus.subscribe("HAL", received::add);

            assertDoesNotThrow(() -> eventBus.publish(event(HivemindEvent.RUN_FAILED, "HAL")));
            assertEquals(1, received.size());
        }
    }

    @Test
    @DisplayName("concurrent publishers all deliver")
    void concurrentPublish() throws InterruptedException {
        List<HivemindEvent> received = new CopyOnWriteArrayList<>();
        eventBus.subscribeAll(received::add);
        int threads = 8;
        var done = new CountDownLatch(threads);

        for (int i = 0; i < threads; i++) {
            String agent = "A" + i;
            new Thread(() -> {
                for (int j = 0; j < 25; j++) {
                    eventBus.publish(event(HivemindEvent.LOOP_COMPLETED, agent));
                }
                done.countDown();
            }).start();
        }

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals(threads * 25, received.size());
    }
}
