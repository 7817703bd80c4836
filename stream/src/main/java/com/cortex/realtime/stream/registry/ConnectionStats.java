package com.cortex.realtime.stream.registry;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Point-in-time view of the registry.
 */
@Value
@Builder
public class ConnectionStats {
    int totalConnections;

    /**
     * Keyed by channel type wire name.
     */
    Map<String, Integer> connectionsByType;

    /**
     * Keyed by {@code type:resourceId}.
     */
    Map<String, Integer> connectionsByChannel;

    Map<String, Integer> connectionsByUser;

    long framesDelivered;
    long framesDropped;
    long evictions;
}
