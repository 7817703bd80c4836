package com.cortex.realtime.stream.stats;

import com.cortex.realtime.core.bus.IEventBus;
import com.cortex.realtime.stream.config.StreamConfig;
import com.cortex.realtime.stream.presence.PresenceService;
import com.cortex.realtime.stream.registry.ConnectionStats;
import com.cortex.realtime.stream.registry.IConnectionRegistry;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Combines registry, bus and (optionally) cluster presence figures.
 */
public class StatsService {
    private final StreamConfig config;
    private final IConnectionRegistry registry;
    private final IEventBus eventBus;
    private final PresenceService presenceService;
    private final Clock clock;

    /**
     * @param presenceService may be null when Redis is disabled
     */
    public StatsService(StreamConfig config, IConnectionRegistry registry, IEventBus eventBus,
                        PresenceService presenceService, Clock clock) {
        this.config = config;
        this.registry = registry;
        this.eventBus = eventBus;
        this.presenceService = presenceService;
        this.clock = clock;
    }

    public Mono<StatsSnapshot> snapshot() {
        ConnectionStats connections = registry.stats();
        StatsSnapshot.StatsSnapshotBuilder builder = StatsSnapshot.builder()
            .nodeId(config.getNodeId())
            .totalConnections(connections.getTotalConnections())
            .connectionsByType(connections.getConnectionsByType())
            .connectionsByChannel(connections.getConnectionsByChannel())
            .connectionsByUser(connections.getConnectionsByUser())
            .framesDelivered(connections.getFramesDelivered())
            .framesDropped(connections.getFramesDropped())
            .evictions(connections.getEvictions())
            .bus(eventBus.stats())
            .generatedAt(clock.instant());

        if (presenceService == null) {
            return Mono.just(builder.build());
        }
        return presenceService.clusterCounts()
            .map(cluster -> builder.cluster(cluster).build());
    }
}
