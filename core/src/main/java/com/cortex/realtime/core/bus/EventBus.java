package com.cortex.realtime.core.bus;

import com.cortex.realtime.core.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.Exceptions;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory event bus.
 * <p>
 * Subscriptions live in an immutable list snapshot. {@link #subscribe} and {@link #unsubscribe}
 * replace the snapshot under {@code subscriptionLock}; {@link #publish} reads the current snapshot
 * without locking, so a slow handler never blocks subscription changes and vice versa.
 * </p>
 * <p>
 * Each published topic is split once; every subscription then runs its precompiled matcher
 * against the same segment list.
 * </p>
 */
public class EventBus implements IEventBus {
    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    static final String MDC_TRACE_ID = "traceId";

    private final Clock clock;
    private final Object subscriptionLock = new Object();
    private volatile List<Subscription> subscriptions = List.of();

    private final AtomicLong published = new AtomicLong();
    private final AtomicLong matched = new AtomicLong();
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();

    public EventBus() {
        this(Clock.systemUTC());
    }

    public EventBus(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String subscribe(String pattern, EventHandler handler) {
        if (handler == null) {
            throw new IllegalArgumentException("Handler must not be null");
        }
        return add(Subscription.sync(newId(), TopicPattern.compile(pattern), clock.instant(), handler));
    }

    @Override
    public String subscribeAsync(String pattern, AsyncEventHandler handler) {
        if (handler == null) {
            throw new IllegalArgumentException("Handler must not be null");
        }
        return add(Subscription.async(newId(), TopicPattern.compile(pattern), clock.instant(), handler));
    }

    private String add(Subscription subscription) {
        synchronized (subscriptionLock) {
            List<Subscription> next = new ArrayList<>(subscriptions.size() + 1);
            next.addAll(subscriptions);
            next.add(subscription);
            subscriptions = List.copyOf(next);
        }
        log.debug("Added subscription {} for pattern {}", subscription.getId(), subscription.getPattern());
        return subscription.getId();
    }

    @Override
    public boolean unsubscribe(String subscriptionId) {
        synchronized (subscriptionLock) {
            List<Subscription> next = new ArrayList<>(subscriptions);
            boolean removed = next.removeIf(s -> s.getId().equals(subscriptionId));
            if (!removed) {
                return false;
            }
            subscriptions = List.copyOf(next);
        }
        log.debug("Removed subscription {}", subscriptionId);
        return true;
    }

    @Override
    public int publish(Event event) {
        published.incrementAndGet();
        List<String> segments = TopicPattern.split(event.getTopic());
        List<Subscription> snapshot = subscriptions;

        int invoked = 0;
        for (Subscription subscription : snapshot) {
            if (!subscription.matches(segments)) {
                continue;
            }
            subscription.recordMatched();
            matched.incrementAndGet();
            invoked++;

            if (subscription.isAsync()) {
                dispatchAsync(subscription, event);
            } else {
                dispatch(subscription, event);
            }
        }

        log.debug("Published {} (traceId={}, source={}) to {} handlers",
            event.getTopic(), event.getTraceId(), event.getSource(), invoked);
        return invoked;
    }

    private void dispatch(Subscription subscription, Event event) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_TRACE_ID, event.getTraceId())) {
            subscription.invoke(event);
            subscription.recordDelivered();
            delivered.incrementAndGet();
        } catch (Throwable t) {
            Exceptions.throwIfJvmFatal(t);
            recordFailure(subscription, event, t);
        }
    }

    private void dispatchAsync(Subscription subscription, Event event) {
        try {
            subscription.invokeAsync(event)
                .contextWrite(ctx -> ctx.put(MDC_TRACE_ID, event.getTraceId()))
                .subscribe(
                    ignored -> { },
                    err -> recordFailure(subscription, event, err),
                    () -> {
                        subscription.recordDelivered();
                        delivered.incrementAndGet();
                    }
                );
        } catch (Throwable t) {
            Exceptions.throwIfJvmFatal(t);
            recordFailure(subscription, event, t);
        }
    }

    private void recordFailure(Subscription subscription, Event event, Throwable err) {
        subscription.recordError();
        errors.incrementAndGet();
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_TRACE_ID, event.getTraceId())) {
            log.error("Handler {} (pattern {}) failed for event {} traceId={}",
                subscription.getId(), subscription.getPattern(), event.getTopic(), event.getTraceId(), err);
        }
    }

    @Override
    public BusStats stats() {
        return BusStats.builder()
            .published(published.get())
            .matched(matched.get())
            .delivered(delivered.get())
            .errors(errors.get())
            .subscriptions(subscriptions.size())
            .build();
    }

    @Override
    public Optional<SubscriptionStats> subscriptionStats(String subscriptionId) {
        return subscriptions.stream()
            .filter(s -> s.getId().equals(subscriptionId))
            .findFirst()
            .map(Subscription::snapshot);
    }

    @Override
    public List<SubscriptionStats> allSubscriptionStats() {
        return subscriptions.stream().map(Subscription::snapshot).toList();
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
