package com.cortex.realtime.stream.metrics;

import com.cortex.realtime.core.bus.IEventBus;
import com.cortex.realtime.core.metrics.MetricsNames;
import com.cortex.realtime.core.metrics.MetricsTags;
import com.cortex.realtime.core.model.ChannelType;
import com.cortex.realtime.stream.config.StreamConfig;
import com.cortex.realtime.stream.registry.IConnectionRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;

import java.util.EnumMap;
import java.util.Map;

/**
 * Centralized metrics service for a stream node.
 */
public class MetricsService {

    private final MeterRegistry registry;
    private final String nodeId;

    // Connection lifecycle
    private final Counter sessionsOpened;
    private final Counter sessionsClosed;
    private final Counter evictions;
    private final Counter reclaimed;
    private final Counter heartbeats;
    private final Map<ChannelType, Counter> authDenied = new EnumMap<>(ChannelType.class);

    // Delivery
    private final Map<DeliveryPath, Counter> framesDelivered = new EnumMap<>(DeliveryPath.class);
    private final Counter dropsQueueFull;

    // Network traffic (bytes)
    private final Counter networkOutboundSse;
    private final DistributionSummary frameSizeOutbound;

    // Cluster fan-out
    private final Counter fanoutPublished;
    private final Counter fanoutReceived;

    public MetricsService(MeterRegistry registry, StreamConfig config) {
        this.registry = registry;
        this.nodeId = config.getNodeId();

        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);

        sessionsOpened = Counter.builder(MetricsNames.SESSIONS_OPENED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Streaming sessions registered")
            .register(registry);

        sessionsClosed = Counter.builder(MetricsNames.SESSIONS_CLOSED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Streaming sessions unregistered")
            .register(registry);

        evictions = Counter.builder(MetricsNames.EVICTIONS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Connections removed after a failed enqueue")
            .register(registry);

        reclaimed = Counter.builder(MetricsNames.RECLAIMED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Connections reclaimed by the heartbeat monitor")
            .register(registry);

        heartbeats = Counter.builder(MetricsNames.HEARTBEATS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .register(registry);

        for (ChannelType type : ChannelType.values()) {
            authDenied.put(type, Counter.builder(MetricsNames.AUTH_DENIED_TOTAL)
                .tag(MetricsTags.NODE_ID, nodeId)
                .tag(MetricsTags.CHANNEL_TYPE, type.wireName())
                .description("Stream registrations refused by the access policy")
                .register(registry));
        }

        for (DeliveryPath path : DeliveryPath.values()) {
            framesDelivered.put(path, Counter.builder(MetricsNames.FRAMES_DELIVERED_TOTAL)
                .tag(MetricsTags.NODE_ID, nodeId)
                .tag(MetricsTags.PATH, path.tagValue())
                .description("Frames enqueued for streaming connections")
                .register(registry));
        }

        dropsQueueFull = Counter.builder(MetricsNames.DROPS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.REASON, "queue_full")
            .description("Frames dropped because a connection queue was full")
            .register(registry);

        networkOutboundSse = Counter.builder(MetricsNames.NETWORK_OUTBOUND_SSE_BYTES)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Total bytes sent to stream clients")
            .baseUnit("bytes")
            .register(registry);

        frameSizeOutbound = DistributionSummary.builder(MetricsNames.NETWORK_OUTBOUND_SSE_BYTES + ".size")
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Outbound frame size distribution")
            .baseUnit("bytes")
            .register(registry);

        fanoutPublished = Counter.builder(MetricsNames.FANOUT_PUBLISHED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .register(registry);

        fanoutReceived = Counter.builder(MetricsNames.FANOUT_RECEIVED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .register(registry);
    }

    /**
     * Registers one active-connection gauge per channel type, read from the registry on scrape.
     */
    public void bindConnectionGauges(IConnectionRegistry connectionRegistry) {
        for (ChannelType type : ChannelType.values()) {
            Gauge.builder(MetricsNames.CONNECTIONS_ACTIVE, connectionRegistry, r -> r.countByType(type))
                .tag(MetricsTags.NODE_ID, nodeId)
                .tag(MetricsTags.CHANNEL_TYPE, type.wireName())
                .description("Open streaming connections")
                .strongReference(true)
                .register(registry);
        }
    }

    /**
     * Mirrors the bus counters as function counters.
     */
    public void bindBusStats(IEventBus bus) {
        FunctionCounter.builder(MetricsNames.BUS_PUBLISHED_TOTAL, bus, b -> b.stats().getPublished())
            .tag(MetricsTags.NODE_ID, nodeId)
            .register(registry);
        FunctionCounter.builder(MetricsNames.BUS_DELIVERED_TOTAL, bus, b -> b.stats().getDelivered())
            .tag(MetricsTags.NODE_ID, nodeId)
            .register(registry);
        FunctionCounter.builder(MetricsNames.BUS_ERRORS_TOTAL, bus, b -> b.stats().getErrors())
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Subscriber handler failures")
            .register(registry);
        Gauge.builder(MetricsNames.BUS_SUBSCRIPTIONS, bus, b -> b.stats().getSubscriptions())
            .tag(MetricsTags.NODE_ID, nodeId)
            .strongReference(true)
            .register(registry);
    }

    public void recordSessionOpened() {
        sessionsOpened.increment();
    }

    public void recordSessionClosed() {
        sessionsClosed.increment();
    }

    public void recordEviction() {
        evictions.increment();
    }

    public void recordReclaimed() {
        reclaimed.increment();
    }

    public void recordHeartbeat() {
        heartbeats.increment();
    }

    public void recordAuthDenied(ChannelType channelType) {
        authDenied.get(channelType).increment();
    }

    public void recordFramesDelivered(DeliveryPath path, int count) {
        if (count > 0) {
            framesDelivered.get(path).increment(count);
        }
    }

    public void recordDropQueueFull() {
        dropsQueueFull.increment();
    }

    /**
     * Records bytes written to a stream client.
     *
     * @param bytes encoded frame size
     */
    public void recordNetworkOutboundSse(long bytes) {
        networkOutboundSse.increment(bytes);
        frameSizeOutbound.record(bytes);
    }

    public void recordFanoutPublished() {
        fanoutPublished.increment();
    }

    public void recordFanoutReceived() {
        fanoutReceived.increment();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
