package com.cortex.realtime.stream.stats;

import com.cortex.realtime.core.bus.BusStats;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Body of {@code GET /v1/stats}.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StatsSnapshot {
    String nodeId;
    int totalConnections;
    Map<String, Integer> connectionsByType;
    Map<String, Integer> connectionsByChannel;
    Map<String, Integer> connectionsByUser;
    long framesDelivered;
    long framesDropped;
    long evictions;
    BusStats bus;

    /**
     * Node id to per-type connection counts; only present when presence is enabled.
     */
    Map<String, Map<String, Long>> cluster;

    Instant generatedAt;
}
