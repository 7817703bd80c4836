package com.cortex.realtime.stream;

import com.cortex.realtime.stream.config.StreamConfig;
import com.cortex.realtime.stream.metrics.PrometheusMetricsExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;

/**
 * Main entry point for a stream node.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Serve SSE streams at /v1/global and /v1/{channelType}/{resourceId} (query: token)</li>
 *   <li>Route bus events to channel streams</li>
 *   <li>Keep idle streams alive with heartbeats</li>
 *   <li>Optionally fan channel pushes out to other nodes over Kafka</li>
 *   <li>Expose /v1/stats, /healthz, /readyz and /metrics endpoints</li>
 * </ul>
 * </p>
 */
public class StreamApp {
    private static final Logger log = LoggerFactory.getLogger(StreamApp.class);

    public static void main(String[] args) {
        StreamConfig config = StreamConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        log.info("Starting stream node: {}", config.getNodeId());
        log.info("  Cluster fan-out: {}", config.isClusterEnabled() ? config.getKafkaBootstrap() : "disabled");
        log.info("  Redis: {}", config.isRedisEnabled() ? config.getRedisUrl() : "disabled");

        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());
        StreamNode node = new StreamNode(config, Clock.systemUTC(), metricsExporter.getRegistry(), metricsExporter, null);
        node.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            MDC.put("nodeId", config.getNodeId());
            log.info("Shutdown signal received, closing all streams...");
            node.stop();
            log.info("Shutdown complete");
        }));

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }
}
