package com.cortex.realtime.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    public static final String NODE_ID = "node_id";

    public static final String CHANNEL_TYPE = "channel_type";

    /**
     * Delivery path (direct/relay/cluster).
     */
    public static final String PATH = "path";

    public static final String REASON = "reason";
}
