package com.cortex.realtime.stream.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for a stream node, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class StreamConfig {

    String nodeId;
    int httpPort;

    // Per-connection delivery queue
    int queueCapacity;

    // Heartbeats: a frame is sent once a stream was idle for heartbeatInterval,
    // the monitor checks every heartbeatCheckPeriod
    Duration heartbeatInterval;
    Duration heartbeatCheckPeriod;

    // Upper bound for a single write to a client
    Duration writeTimeout;

    // Stream token verification
    String tokenSecret;
    Duration tokenTtl;

    // Routes bus events carrying a resource id to the matching channel
    boolean relayEnabled;

    // Cross-node fan-out over Kafka
    boolean clusterEnabled;
    String kafkaBootstrap;

    // Presence and membership lookups in Redis
    boolean redisEnabled;
    String redisUrl;
    Duration presenceTtl;

    public static StreamConfig fromEnv() {
        return StreamConfig.builder()
            .nodeId(getEnv("NODE_ID", "stream-node-1"))
            .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8080")))
            .queueCapacity(Integer.parseInt(getEnv("QUEUE_CAPACITY", "256")))
            .heartbeatInterval(Duration.ofSeconds(Integer.parseInt(getEnv("HEARTBEAT_INTERVAL_SEC", "25"))))
            .heartbeatCheckPeriod(Duration.ofSeconds(Integer.parseInt(getEnv("HEARTBEAT_CHECK_SEC", "5"))))
            .writeTimeout(Duration.ofSeconds(Integer.parseInt(getEnv("WRITE_TIMEOUT_SEC", "10"))))
            .tokenSecret(getEnv("TOKEN_SECRET", "dev-stream-secret"))
            .tokenTtl(Duration.ofSeconds(Integer.parseInt(getEnv("TOKEN_TTL_SEC", "3600"))))
            .relayEnabled(Boolean.parseBoolean(getEnv("RELAY_ENABLED", "true")))
            .clusterEnabled(Boolean.parseBoolean(getEnv("CLUSTER_ENABLED", "false")))
            .kafkaBootstrap(getEnv("KAFKA_BOOTSTRAP", "localhost:9092"))
            .redisEnabled(Boolean.parseBoolean(getEnv("REDIS_ENABLED", "false")))
            .redisUrl(getEnv("REDIS_URL", "redis://localhost:6379"))
            .presenceTtl(Duration.ofSeconds(Integer.parseInt(getEnv("PRESENCE_TTL_SEC", "30"))))
            .build();
    }

    /**
     * Defaults suitable for tests: random HTTP port, no Kafka, no Redis.
     */
    public static StreamConfig.StreamConfigBuilder defaults() {
        return StreamConfig.builder()
            .nodeId("stream-test")
            .httpPort(0)
            .queueCapacity(256)
            .heartbeatInterval(Duration.ofSeconds(25))
            .heartbeatCheckPeriod(Duration.ofSeconds(5))
            .writeTimeout(Duration.ofSeconds(10))
            .tokenSecret("test-secret")
            .tokenTtl(Duration.ofHours(1))
            .relayEnabled(true)
            .clusterEnabled(false)
            .kafkaBootstrap("localhost:9092")
            .redisEnabled(false)
            .redisUrl("redis://localhost:6379")
            .presenceTtl(Duration.ofSeconds(30));
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
