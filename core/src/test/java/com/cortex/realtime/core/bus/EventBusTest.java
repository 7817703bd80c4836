package com.cortex.realtime.core.bus;

import com.cortex.realtime.core.model.Event;
import com.cortex.realtime.core.util.JsonUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventBusTest {

    private EventBus bus;

    @BeforeEach
    void setUp() {
        bus = new EventBus();
    }

    private static Event event(String topic) {
        return Event.of(topic, JsonUtils.toTree(Map.of("k", "v")), "test");
    }

    // ========== Routing Tests ==========

    @Test
    void testPublish_DeliversToMatchingSubscriptionsOnly() {
        List<String> received = new ArrayList<>();
        bus.subscribe("conversation.*", e -> received.add("conv:" + e.getTopic()));
        bus.subscribe("workspace.*", e -> received.add("ws:" + e.getTopic()));

        int handlers = bus.publish(event("conversation.message_received"));

        assertEquals(1, handlers);
        assertEquals(List.of("conv:conversation.message_received"), received);
    }

    @Test
    void testUserLogin_ReachesWildcardButNotOtherExactTopic() {
        List<Event> h1 = new ArrayList<>();
        List<Event> h2 = new ArrayList<>();
        bus.subscribe("user.*", h1::add);
        bus.subscribe("user.logout", h2::add);

        Event login = Event.of("user.login", JsonUtils.toTree(Map.of("id", "u1")), "auth");
        bus.publish(login);

        assertEquals(1, h1.size());
        assertEquals("u1", h1.get(0).getPayload().get("id").asText());
        assertEquals("auth", h1.get(0).getSource());
        assertTrue(h2.isEmpty());
    }

    @Test
    void testPublish_NoSubscribers_ReturnsZero() {
        assertEquals(0, bus.publish(event("nobody.listens")));
        assertEquals(1, bus.stats().getPublished());
    }

    @Test
    void testPublish_EachSubscriptionAtMostOncePerPublish() {
        AtomicInteger calls = new AtomicInteger();
        EventHandler handler = e -> calls.incrementAndGet();
        bus.subscribe("*", handler);
        bus.subscribe("user.*", handler);

        int handlers = bus.publish(event("user.updated"));

        // Same handler object, two subscriptions: once each
        assertEquals(2, handlers);
        assertEquals(2, calls.get());
    }

    @Test
    void testUnsubscribe_StopsDelivery() {
        AtomicInteger calls = new AtomicInteger();
        String id = bus.subscribe("user.*", e -> calls.incrementAndGet());

        assertTrue(bus.unsubscribe(id));
        bus.publish(event("user.updated"));

        assertEquals(0, calls.get());
        assertEquals(0, bus.stats().getSubscriptions());
    }

    @Test
    void testUnsubscribe_UnknownId_ReturnsFalse() {
        assertFalse(bus.unsubscribe("missing"));
    }

    @Test
    void testSubscribe_BlankPattern_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> bus.subscribe("", e -> { }));
    }

    // ========== Failure Isolation Tests ==========

    @Test
    @DisplayName("A throwing handler neither aborts the publish nor affects other subscribers")
    void testHandlerFailure_IsolatedAndCounted() {
        AtomicInteger healthy = new AtomicInteger();
        String failingId = bus.subscribe("job.*", e -> {
            throw new IllegalStateException("boom");
        });
        String healthyId = bus.subscribe("job.*", e -> healthy.incrementAndGet());

        for (int i = 0; i < 100; i++) {
            assertEquals(2, bus.publish(event("job.done")));
        }

        assertEquals(100, healthy.get());
        BusStats stats = bus.stats();
        assertEquals(100, stats.getPublished());
        assertEquals(200, stats.getMatched());
        assertEquals(100, stats.getDelivered());
        assertEquals(100, stats.getErrors());

        SubscriptionStats failing = bus.subscriptionStats(failingId).orElseThrow();
        assertEquals(100, failing.getMatched());
        assertEquals(0, failing.getDelivered());
        assertEquals(100, failing.getErrors());

        SubscriptionStats ok = bus.subscriptionStats(healthyId).orElseThrow();
        assertEquals(100, ok.getDelivered());
        assertEquals(0, ok.getErrors());
    }

    @Test
    void testCheckedExceptionFromHandler_Counted() {
        bus.subscribe("job.*", e -> {
            throw new Exception("checked");
        });

        assertEquals(1, bus.publish(event("job.failed")));
        assertEquals(1, bus.stats().getErrors());
    }

    @Test
    void testHandler_SeesTraceIdInMdc() {
        List<String> traceIds = new ArrayList<>();
        bus.subscribe("trace.*", e -> traceIds.add(MDC.get(EventBus.MDC_TRACE_ID)));

        Event event = event("trace.me");
        bus.publish(event);

        assertEquals(List.of(event.getTraceId()), traceIds);
        assertNull(MDC.get(EventBus.MDC_TRACE_ID));
    }

    // ========== Async Handler Tests ==========

    @Test
    void testAsyncHandler_DeliveredCountedOnCompletion() {
        Sinks.One<Void> completion = Sinks.one();
        bus.subscribeAsync("async.*", e -> completion.asMono());

        assertEquals(1, bus.publish(event("async.work")));
        assertEquals(0, bus.stats().getDelivered());

        completion.tryEmitEmpty();

        assertEquals(1, bus.stats().getDelivered());
        assertEquals(0, bus.stats().getErrors());
    }

    @Test
    void testAsyncHandler_ErrorCountedLikeSyncFailure() {
        AtomicInteger other = new AtomicInteger();
        bus.subscribeAsync("async.*", e -> Mono.error(new IllegalStateException("async boom")));
        bus.subscribe("async.*", e -> other.incrementAndGet());

        assertEquals(2, bus.publish(event("async.work")));

        assertEquals(1, other.get());
        assertEquals(1, bus.stats().getErrors());
        assertEquals(1, bus.stats().getDelivered());
    }

    @Test
    void testAsyncHandler_ThrowingBeforeReturningMono_Counted() {
        bus.subscribeAsync("async.*", e -> {
            throw new IllegalArgumentException("no mono");
        });

        assertEquals(1, bus.publish(event("async.work")));
        assertEquals(1, bus.stats().getErrors());
    }

    // ========== Concurrency Tests ==========

    @Test
    void testConcurrentSubscribeAndPublish() throws InterruptedException {
        List<String> seen = new CopyOnWriteArrayList<>();
        bus.subscribe("load.*", e -> seen.add(e.getTraceId()));

        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch done = new CountDownLatch(4);
        for (int t = 0; t < 4; t++) {
            final int thread = t;
            executor.submit(() -> {
                try {
                    for (int i = 0; i < 250; i++) {
                        if (thread == 0 && i % 10 == 0) {
                            String id = bus.subscribe("other.*", e -> { });
                            bus.unsubscribe(id);
                        }
                        bus.publish(event("load.tick"));
                    }
                } finally {
                    done.countDown();
                }
            });
        }

        assertTrue(done.await(10, TimeUnit.SECONDS));
        executor.shutdownNow();

        assertEquals(1000, seen.size());
        assertEquals(1000, bus.stats().getPublished());
        assertEquals(1, bus.stats().getSubscriptions());
    }
}
