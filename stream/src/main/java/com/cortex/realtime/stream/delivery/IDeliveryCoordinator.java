package com.cortex.realtime.stream.delivery;

import com.cortex.realtime.core.model.ChannelKey;

/**
 * Single entry point for publishers (Dependency Inversion Principle).
 * <p>
 * Every call publishes an event on the bus. With a channel key and {@code republish=true} the
 * event's wire view is also pushed to that channel's streaming connections. With
 * {@code republish=false} the caller has arranged delivery to streams itself; the event only
 * goes to the bus.
 * </p>
 * <p>
 * Delivery problems never surface as exceptions. Null or blank topic and source are rejected
 * with {@link IllegalArgumentException}.
 * </p>
 */
public interface IDeliveryCoordinator {
    /**
     * Bus-only publish.
     *
     * @param payload JSON-like value: a Jackson tree, map, list or any bean Jackson can convert
     */
    DeliveryReport notify(String topic, Object payload, String source);

    DeliveryReport notify(String topic, Object payload, String source, ChannelKey channelKey, boolean republish);

    DeliveryReport notify(String topic, Object payload, String source, ChannelKey channelKey, boolean republish,
                          String correlationId);
}
