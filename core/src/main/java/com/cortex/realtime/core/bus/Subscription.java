package com.cortex.realtime.core.bus;

import com.cortex.realtime.core.model.Event;
import lombok.Getter;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A registered handler together with its compiled pattern and counters.
 * Owned by {@link EventBus}; callers only ever see the id and {@link SubscriptionStats}.
 */
final class Subscription {
    @Getter
    private final String id;
    @Getter
    private final TopicPattern pattern;
    @Getter
    private final Instant createdAt;

    private final EventHandler handler;
    private final AsyncEventHandler asyncHandler;

    private final AtomicLong matched = new AtomicLong();
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();

    private Subscription(String id, TopicPattern pattern, Instant createdAt,
                         EventHandler handler, AsyncEventHandler asyncHandler) {
        this.id = id;
        this.pattern = pattern;
        this.createdAt = createdAt;
        this.handler = handler;
        this.asyncHandler = asyncHandler;
    }

    static Subscription sync(String id, TopicPattern pattern, Instant createdAt, EventHandler handler) {
        return new Subscription(id, pattern, createdAt, handler, null);
    }

    static Subscription async(String id, TopicPattern pattern, Instant createdAt, AsyncEventHandler handler) {
        return new Subscription(id, pattern, createdAt, null, handler);
    }

    boolean matches(List<String> topicSegments) {
        return pattern.matches(topicSegments);
    }

    boolean isAsync() {
        return asyncHandler != null;
    }

    void invoke(Event event) throws Exception {
        handler.onEvent(event);
    }

    Mono<Void> invokeAsync(Event event) {
        return Mono.defer(() -> asyncHandler.onEvent(event));
    }

    void recordMatched() {
        matched.incrementAndGet();
    }

    void recordDelivered() {
        delivered.incrementAndGet();
    }

    void recordError() {
        errors.incrementAndGet();
    }

    SubscriptionStats snapshot() {
        return SubscriptionStats.builder()
            .subscriptionId(id)
            .pattern(pattern.toString())
            .createdAt(createdAt)
            .matched(matched.get())
            .delivered(delivered.get())
            .errors(errors.get())
            .build();
    }
}
