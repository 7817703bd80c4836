package com.cortex.realtime.stream.cluster;

import com.cortex.realtime.core.model.ChannelKey;
import com.cortex.realtime.core.msg.StreamFrame;
import reactor.core.publisher.Mono;

/**
 * Forwards channel pushes to the other stream nodes, and applies theirs to the local registry.
 */
public interface ClusterBroadcaster {
    /**
     * @return Mono completing once the node is able to receive pushes from peers
     */
    Mono<Void> start();

    /**
     * Sends a frame to every other node. Failures are logged; the returned Mono never errors.
     */
    Mono<Void> broadcast(ChannelKey channelKey, StreamFrame frame);

    Mono<Void> stop();
}
