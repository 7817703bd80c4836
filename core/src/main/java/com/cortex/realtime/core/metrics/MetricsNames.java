package com.cortex.realtime.core.metrics;

/**
 * Micrometer metric names used across the system.
 * <p>
 * <b>Naming convention:</b> {@code rtc.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Gauge: open streaming connections.
     * <p>
     * Tags: channel_type
     * </p>
     */
    public static final String CONNECTIONS_ACTIVE = "rtc.stream.connections.active";

    /**
     * Counter: sessions opened / closed.
     */
    public static final String SESSIONS_OPENED_TOTAL = "rtc.stream.sessions.opened.total";
    public static final String SESSIONS_CLOSED_TOTAL = "rtc.stream.sessions.closed.total";

    /**
     * Counter: frames enqueued for connections.
     * <p>
     * Tags: path (direct/relay/cluster)
     * </p>
     */
    public static final String FRAMES_DELIVERED_TOTAL = "rtc.stream.frames.delivered.total";

    /**
     * Counter: frames dropped for one recipient.
     * <p>
     * Tags: reason (queue_full)
     * </p>
     */
    public static final String DROPS_TOTAL = "rtc.stream.drops.total";

    /**
     * Counter: connections removed because their queue overflowed or their session was closing.
     */
    public static final String EVICTIONS_TOTAL = "rtc.stream.evictions.total";

    /**
     * Counter: heartbeat frames enqueued.
     */
    public static final String HEARTBEATS_TOTAL = "rtc.stream.heartbeats.total";

    /**
     * Counter: sessions reclaimed by the heartbeat monitor (client gone or heartbeat failed).
     */
    public static final String RECLAIMED_TOTAL = "rtc.stream.reclaimed.total";

    /**
     * Counter: registrations refused by the access policy.
     */
    public static final String AUTH_DENIED_TOTAL = "rtc.stream.auth.denied.total";

    /**
     * Counter: bytes written to stream clients.
     */
    public static final String NETWORK_OUTBOUND_SSE_BYTES = "rtc.stream.network.outbound.sse.bytes";

    /**
     * Function counters mirroring the event bus statistics.
     */
    public static final String BUS_PUBLISHED_TOTAL = "rtc.bus.published.total";
    public static final String BUS_DELIVERED_TOTAL = "rtc.bus.delivered.total";
    public static final String BUS_ERRORS_TOTAL = "rtc.bus.errors.total";

    /**
     * Gauge: current bus subscriptions.
     */
    public static final String BUS_SUBSCRIPTIONS = "rtc.bus.subscriptions";

    /**
     * Counter: fan-out envelopes published to / received from Kafka.
     */
    public static final String FANOUT_PUBLISHED_TOTAL = "rtc.cluster.fanout.published.total";
    public static final String FANOUT_RECEIVED_TOTAL = "rtc.cluster.fanout.received.total";
}
