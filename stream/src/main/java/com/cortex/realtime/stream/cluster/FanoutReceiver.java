package com.cortex.realtime.stream.cluster;

import com.cortex.realtime.core.model.ChannelKey;
import com.cortex.realtime.core.msg.FanoutEnvelope;
import com.cortex.realtime.stream.metrics.DeliveryPath;
import com.cortex.realtime.stream.metrics.MetricsService;
import com.cortex.realtime.stream.registry.IConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies fan-out envelopes from peer nodes to the local registry.
 */
class FanoutReceiver {
    private static final Logger log = LoggerFactory.getLogger(FanoutReceiver.class);

    private final String nodeId;
    private final IConnectionRegistry registry;
    private final MetricsService metricsService;

    FanoutReceiver(String nodeId, IConnectionRegistry registry, MetricsService metricsService) {
        this.nodeId = nodeId;
        this.registry = registry;
        this.metricsService = metricsService;
    }

    /**
     * @return local deliveries, 0 for envelopes this node published
     */
    int apply(FanoutEnvelope envelope) {
        if (nodeId.equals(envelope.getOriginNodeId())) {
            return 0;
        }
        metricsService.recordFanoutReceived();

        ChannelKey channelKey = ChannelKey.of(envelope.getChannelType(), envelope.getResourceId());
        int delivered = registry.push(channelKey, envelope.getFrame());
        metricsService.recordFramesDelivered(DeliveryPath.CLUSTER, delivered);
        log.debug("Fan-out from {} on {}: {} local deliveries", envelope.getOriginNodeId(), channelKey, delivered);
        return delivered;
    }
}
