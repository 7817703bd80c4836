package com.cortex.realtime.stream.metrics;

/**
 * How a frame reached the registry.
 */
public enum DeliveryPath {
    /** Pushed by the delivery coordinator for an explicit channel key. */
    DIRECT,
    /** Routed by the channel relay from a bus event. */
    RELAY,
    /** Received from another node. */
    CLUSTER;

    public String tagValue() {
        return name().toLowerCase();
    }
}
