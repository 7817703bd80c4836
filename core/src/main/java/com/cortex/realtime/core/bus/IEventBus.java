package com.cortex.realtime.core.bus;

import com.cortex.realtime.core.model.Event;

import java.util.List;
import java.util.Optional;

/**
 * In-process publish/subscribe bus with pattern-based routing (Dependency Inversion Principle).
 * <p>
 * <b>Delivery:</b> at most once per subscription per {@link #publish} call. A failing handler
 * is isolated: it is logged with the event's trace id, counted, and never stops delivery to the
 * remaining subscriptions nor fails the publish.
 * </p>
 */
public interface IEventBus {
    /**
     * Registers a synchronous handler.
     *
     * @param pattern topic pattern, see {@link TopicPattern}
     * @param handler handler invoked on the publishing thread
     * @return subscription id
     */
    String subscribe(String pattern, EventHandler handler);

    /**
     * Registers a reactive handler. Publishing subscribes to the handler's result without
     * waiting for it.
     *
     * @param pattern topic pattern, see {@link TopicPattern}
     * @param handler reactive handler
     * @return subscription id
     */
    String subscribeAsync(String pattern, AsyncEventHandler handler);

    /**
     * Removes a subscription.
     *
     * @param subscriptionId id returned by subscribe
     * @return true if a subscription was removed, false if it was unknown
     */
    boolean unsubscribe(String subscriptionId);

    /**
     * Delivers an event to every matching subscription.
     *
     * @param event event to deliver
     * @return number of handlers invoked or scheduled
     */
    int publish(Event event);

    BusStats stats();

    Optional<SubscriptionStats> subscriptionStats(String subscriptionId);

    List<SubscriptionStats> allSubscriptionStats();
}
