package com.cortex.realtime.stream.delivery;

import com.cortex.realtime.core.bus.IEventBus;
import com.cortex.realtime.core.model.ChannelKey;
import com.cortex.realtime.core.model.Event;
import com.cortex.realtime.core.msg.StreamFrame;
import com.cortex.realtime.core.util.JsonUtils;
import com.cortex.realtime.stream.cluster.ClusterBroadcaster;
import com.cortex.realtime.stream.metrics.DeliveryPath;
import com.cortex.realtime.stream.metrics.MetricsService;
import com.cortex.realtime.stream.registry.IConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Publishes on the bus and, when asked to, pushes straight to a channel's streams and to the
 * other nodes.
 * <p>
 * Events addressed to a channel key are marked {@code channelRouted}; {@link ChannelEventRelay}
 * leaves those alone, so a connection receives each event at most once whichever way it was
 * published.
 * </p>
 */
public class DeliveryCoordinator implements IDeliveryCoordinator {
    private static final Logger log = LoggerFactory.getLogger(DeliveryCoordinator.class);

    private final IEventBus eventBus;
    private final IConnectionRegistry registry;
    private final ClusterBroadcaster clusterBroadcaster;
    private final MetricsService metricsService;
    private final Clock clock;

    public DeliveryCoordinator(IEventBus eventBus, IConnectionRegistry registry,
                               ClusterBroadcaster clusterBroadcaster, MetricsService metricsService, Clock clock) {
        this.eventBus = eventBus;
        this.registry = registry;
        this.clusterBroadcaster = clusterBroadcaster;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    @Override
    public DeliveryReport notify(String topic, Object payload, String source) {
        return notify(topic, payload, source, null, false, null);
    }

    @Override
    public DeliveryReport notify(String topic, Object payload, String source, ChannelKey channelKey,
                                 boolean republish) {
        return notify(topic, payload, source, channelKey, republish, null);
    }

    @Override
    public DeliveryReport notify(String topic, Object payload, String source, ChannelKey channelKey,
                                 boolean republish, String correlationId) {
        requireText(topic, "topic");
        requireText(source, "source");

        Event event = Event.builder()
            .topic(topic)
            .payload(JsonUtils.toTree(payload))
            .source(source)
            .correlationId(correlationId)
            .timestamp(clock.instant())
            .channelRouted(channelKey != null)
            .build();

        int busHandlers = eventBus.publish(event);

        int direct = 0;
        if (channelKey != null && republish) {
            direct = pushDirect(event, channelKey);
        }

        log.debug("Notified {} from {} (traceId={}): {} bus handlers, {} direct deliveries",
            topic, source, event.getTraceId(), busHandlers, direct);

        return DeliveryReport.builder()
            .traceId(event.getTraceId())
            .busHandlers(busHandlers)
            .directDeliveries(direct)
            .build();
    }

    private int pushDirect(Event event, ChannelKey channelKey) {
        StreamFrame frame = WireFrames.fromEvent(event, channelKey);

        int delivered = 0;
        try {
            delivered = registry.push(channelKey, frame);
            metricsService.recordFramesDelivered(DeliveryPath.DIRECT, delivered);
        } catch (RuntimeException e) {
            log.error("Direct push of {} to {} failed (traceId={})",
                event.getTopic(), channelKey, event.getTraceId(), e);
        }

        clusterBroadcaster.broadcast(channelKey, frame).subscribe();
        return delivered;
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
