package com.cortex.realtime.stream.delivery;

import com.cortex.realtime.core.bus.IEventBus;
import com.cortex.realtime.core.model.ChannelKey;
import com.cortex.realtime.core.model.ChannelType;
import com.cortex.realtime.core.model.Event;
import com.cortex.realtime.core.msg.StreamFrame;
import com.cortex.realtime.core.msg.Topics;
import com.cortex.realtime.stream.cluster.ClusterBroadcaster;
import com.cortex.realtime.stream.metrics.DeliveryPath;
import com.cortex.realtime.stream.metrics.MetricsService;
import com.cortex.realtime.stream.registry.IConnectionRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Streams bus events to the channel their payload names.
 * <p>
 * Listens on {@code conversation.*}, {@code workspace.*}, {@code user.*} and {@code global.*}.
 * An event is routed to the channel of the topic's first segment, identified by the payload's
 * {@code <channelType>_id} field; global events go to the global channel. Events without the
 * field, and events already addressed to a channel by their publisher, are ignored.
 * </p>
 * <p>
 * Routed frames go to the local registry and to the other nodes through the
 * {@link ClusterBroadcaster}, the same way {@link DeliveryCoordinator} handles direct pushes.
 * </p>
 */
public class ChannelEventRelay {
    private static final Logger log = LoggerFactory.getLogger(ChannelEventRelay.class);

    private final IEventBus eventBus;
    private final IConnectionRegistry registry;
    private final ClusterBroadcaster clusterBroadcaster;
    private final MetricsService metricsService;

    private final List<String> subscriptionIds = new ArrayList<>();

    public ChannelEventRelay(IEventBus eventBus, IConnectionRegistry registry,
                             ClusterBroadcaster clusterBroadcaster, MetricsService metricsService) {
        this.eventBus = eventBus;
        this.registry = registry;
        this.clusterBroadcaster = clusterBroadcaster;
        this.metricsService = metricsService;
    }

    public synchronized void start() {
        if (!subscriptionIds.isEmpty()) {
            return;
        }
        subscriptionIds.add(eventBus.subscribe(Topics.CONVERSATION_EVENTS, e -> route(e, ChannelType.CONVERSATION)));
        subscriptionIds.add(eventBus.subscribe(Topics.WORKSPACE_EVENTS, e -> route(e, ChannelType.WORKSPACE)));
        subscriptionIds.add(eventBus.subscribe(Topics.USER_EVENTS, e -> route(e, ChannelType.USER)));
        subscriptionIds.add(eventBus.subscribe(Topics.GLOBAL_EVENTS, e -> route(e, ChannelType.GLOBAL)));
        log.info("Channel relay started");
    }

    public synchronized void stop() {
        subscriptionIds.forEach(eventBus::unsubscribe);
        subscriptionIds.clear();
        log.info("Channel relay stopped");
    }

    /**
     * @return connections the event was enqueued for
     */
    int route(Event event, ChannelType channelType) {
        if (event.isChannelRouted()) {
            return 0;
        }

        ChannelKey channelKey;
        if (channelType == ChannelType.GLOBAL) {
            channelKey = ChannelKey.global();
        } else {
            JsonNode resourceId = event.getPayload().get(channelType.resourceField());
            if (resourceId == null || resourceId.isNull() || !resourceId.isValueNode() || resourceId.asText().isBlank()) {
                log.debug("Event {} has no {}, not relayed", event.getTopic(), channelType.resourceField());
                return 0;
            }
            channelKey = ChannelKey.of(channelType, resourceId.asText());
        }

        StreamFrame frame = WireFrames.fromEvent(event, channelKey);
        int delivered = registry.push(channelKey, frame);
        metricsService.recordFramesDelivered(DeliveryPath.RELAY, delivered);

        clusterBroadcaster.broadcast(channelKey, frame).subscribe();
        return delivered;
    }
}
