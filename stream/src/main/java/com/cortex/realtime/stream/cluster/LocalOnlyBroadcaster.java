package com.cortex.realtime.stream.cluster;

import com.cortex.realtime.core.model.ChannelKey;
import com.cortex.realtime.core.msg.StreamFrame;
import reactor.core.publisher.Mono;

/**
 * Single-node deployments: nothing to forward.
 */
public class LocalOnlyBroadcaster implements ClusterBroadcaster {
    @Override
    public Mono<Void> start() {
        return Mono.empty();
    }

    @Override
    public Mono<Void> broadcast(ChannelKey channelKey, StreamFrame frame) {
        return Mono.empty();
    }

    @Override
    public Mono<Void> stop() {
        return Mono.empty();
    }
}
