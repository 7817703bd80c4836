package com.cortex.realtime.stream;

import com.cortex.realtime.core.bus.EventBus;
import com.cortex.realtime.core.bus.IEventBus;
import com.cortex.realtime.stream.cluster.ClusterBroadcaster;
import com.cortex.realtime.stream.cluster.KafkaClusterBroadcaster;
import com.cortex.realtime.stream.cluster.LocalOnlyBroadcaster;
import com.cortex.realtime.stream.config.StreamConfig;
import com.cortex.realtime.stream.delivery.ChannelEventRelay;
import com.cortex.realtime.stream.delivery.DeliveryCoordinator;
import com.cortex.realtime.stream.delivery.IDeliveryCoordinator;
import com.cortex.realtime.stream.heartbeat.HeartbeatMonitor;
import com.cortex.realtime.stream.http.HttpServer;
import com.cortex.realtime.stream.http.SseStreamHandler;
import com.cortex.realtime.stream.metrics.MetricsService;
import com.cortex.realtime.stream.metrics.PrometheusMetricsExporter;
import com.cortex.realtime.stream.presence.PresenceService;
import com.cortex.realtime.stream.redis.RedisService;
import com.cortex.realtime.stream.registry.ConnectionRegistry;
import com.cortex.realtime.stream.registry.IConnectionRegistry;
import com.cortex.realtime.stream.security.AccessPolicy;
import com.cortex.realtime.stream.security.DefaultAccessPolicy;
import com.cortex.realtime.stream.security.RedisMembershipDirectory;
import com.cortex.realtime.stream.security.TokenAuthenticator;
import com.cortex.realtime.stream.session.SessionFactory;
import com.cortex.realtime.stream.stats.StatsService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Composition root of one stream node: builds every service explicitly and owns their lifecycle.
 * <p>
 * Kafka fan-out and Redis presence/membership are only wired when enabled in the config.
 * Without Redis the default access policy has no membership directory, so workspace and
 * conversation streams are refused unless a policy is supplied.
 * </p>
 */
@Getter
public class StreamNode {
    private static final Logger log = LoggerFactory.getLogger(StreamNode.class);

    private final StreamConfig config;
    private final MetricsService metricsService;
    private final IEventBus eventBus;
    private final IConnectionRegistry registry;
    private final IDeliveryCoordinator deliveryCoordinator;
    private final ChannelEventRelay relay;
    private final HeartbeatMonitor heartbeatMonitor;
    private final ClusterBroadcaster clusterBroadcaster;
    private final HttpServer httpServer;
    private final RedisService redisService;
    private final PresenceService presenceService;

    public StreamNode(StreamConfig config, Clock clock, MeterRegistry meterRegistry,
                      PrometheusMetricsExporter metricsExporter, AccessPolicy accessPolicy) {
        this.config = config;
        this.metricsService = new MetricsService(meterRegistry, config);
        this.eventBus = new EventBus(clock);

        this.redisService = config.isRedisEnabled() ? new RedisService(config) : null;
        AccessPolicy policy = accessPolicy != null
            ? accessPolicy
            : new DefaultAccessPolicy(redisService != null ? new RedisMembershipDirectory(redisService) : null);

        this.registry = new ConnectionRegistry(new SessionFactory(config, clock), policy, metricsService);
        metricsService.bindConnectionGauges(registry);
        metricsService.bindBusStats(eventBus);

        this.presenceService = redisService != null ? new PresenceService(redisService, config, clock) : null;
        if (presenceService != null) {
            registry.addListener(presenceService);
        }

        this.clusterBroadcaster = config.isClusterEnabled()
            ? new KafkaClusterBroadcaster(config, registry, metricsService)
            : new LocalOnlyBroadcaster();

        this.deliveryCoordinator = new DeliveryCoordinator(eventBus, registry, clusterBroadcaster, metricsService, clock);
        this.relay = new ChannelEventRelay(eventBus, registry, clusterBroadcaster, metricsService);
        this.heartbeatMonitor = new HeartbeatMonitor(registry, config, metricsService, clock);

        SseStreamHandler streamHandler = new SseStreamHandler(
            config, registry, new TokenAuthenticator(config, clock), metricsService
        );
        StatsService statsService = new StatsService(config, registry, eventBus, presenceService, clock);
        this.httpServer = new HttpServer(config, registry, streamHandler, statsService, metricsExporter);
    }

    public void start() {
        clusterBroadcaster.start().block(Duration.ofSeconds(30));
        if (presenceService != null) {
            presenceService.start();
        }
        if (config.isRelayEnabled()) {
            relay.start();
        }
        heartbeatMonitor.start();
        httpServer.start();
        log.info("Stream node {} is ready", config.getNodeId());
    }

    /**
     * Stops accepting streams, closes every session immediately and releases external connections.
     */
    public void stop() {
        heartbeatMonitor.stop();
        relay.stop();
        registry.shutdown();
        httpServer.stop();
        clusterBroadcaster.stop().block(Duration.ofSeconds(10));
        if (presenceService != null) {
            presenceService.stop().block(Duration.ofSeconds(5));
        }
        if (redisService != null) {
            redisService.close();
        }
        log.info("Stream node {} stopped", config.getNodeId());
    }
}
