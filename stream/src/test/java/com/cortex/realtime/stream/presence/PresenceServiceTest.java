package com.cortex.realtime.stream.presence;

import com.cortex.realtime.core.model.ChannelKey;
import com.cortex.realtime.core.redis.Keys;
import com.cortex.realtime.stream.MutableClock;
import com.cortex.realtime.stream.config.StreamConfig;
import com.cortex.realtime.stream.metrics.MetricsService;
import com.cortex.realtime.stream.registry.ConnectionRegistry;
import com.cortex.realtime.stream.session.SessionFactory;
import com.cortex.realtime.stream.session.StreamingSession;
import io.lettuce.core.KeyValue;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PresenceServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private InMemoryHashes redis;
    private MutableClock clock;
    private StreamConfig config;
    private PresenceService presence;

    @BeforeEach
    void setUp() {
        redis = new InMemoryHashes();
        clock = new MutableClock(NOW);
        config = StreamConfig.defaults().nodeId("node-a").presenceTtl(Duration.ofSeconds(30)).build();
        presence = new PresenceService(redis.commands(), config, clock);
    }

    // ========== Connection Count Tests ==========

    @Test
    void testRegisterAndUnregister_AdjustCountsByOne() {
        ConnectionRegistry registry = new ConnectionRegistry(new SessionFactory(config, clock),
            (user, type, resource) -> Mono.just(true), new MetricsService(new SimpleMeterRegistry(), config));
        registry.addListener(presence);

        StreamingSession first = registry.register(ChannelKey.workspace("w1"), "u1").block();
        registry.register(ChannelKey.workspace("w2"), "u2").block();
        registry.register(ChannelKey.global(), "u1").block();

        assertEquals("2", redis.field(Keys.presence("node-a"), "workspace"));
        assertEquals("1", redis.field(Keys.presence("node-a"), "global"));

        registry.unregister(first.getId());
        registry.unregister(first.getId());

        assertEquals("1", redis.field(Keys.presence("node-a"), "workspace"));
    }

    // ========== Cluster Count Tests ==========

    @Test
    void testClusterCounts_LeavesOutStaleAndMalformedNodes() {
        redis.put(Keys.nodes(), "node-a", String.valueOf(NOW.toEpochMilli()));
        redis.put(Keys.nodes(), "node-b", String.valueOf(NOW.minusSeconds(10).toEpochMilli()));
        redis.put(Keys.nodes(), "node-c", String.valueOf(NOW.minusSeconds(31).toEpochMilli()));
        redis.put(Keys.nodes(), "node-d", "not-a-number");
        redis.put(Keys.presence("node-a"), "conversation", "3");
        redis.put(Keys.presence("node-b"), "global", "7");
        redis.put(Keys.presence("node-c"), "global", "100");

        StepVerifier.create(presence.clusterCounts())
            .assertNext(cluster -> {
                assertEquals(List.of("node-a", "node-b"), List.copyOf(cluster.keySet()));
                assertEquals(Map.of("conversation", 3L), cluster.get("node-a"));
                assertEquals(Map.of("global", 7L), cluster.get("node-b"));
            })
            .verifyComplete();
    }

    @Test
    void testClusterCounts_NodeTurnsStaleAsClockAdvances() {
        redis.put(Keys.nodes(), "node-b", String.valueOf(NOW.toEpochMilli()));
        redis.put(Keys.presence("node-b"), "user", "1");

        clock.advance(Duration.ofSeconds(31));

        StepVerifier.create(presence.clusterCounts())
            .assertNext(cluster -> assertTrue(cluster.isEmpty()))
            .verifyComplete();
    }

    @Test
    void testClusterCounts_RedisFailure_EmptyResult() {
        redis.failing = true;

        StepVerifier.create(presence.clusterCounts())
            .assertNext(cluster -> assertTrue(cluster.isEmpty()))
            .verifyComplete();
    }

    // ========== Lifecycle Tests ==========

    @Test
    void testStop_RemovesOwnEntries() {
        redis.put(Keys.nodes(), "node-a", String.valueOf(NOW.toEpochMilli()));
        redis.put(Keys.nodes(), "node-b", String.valueOf(NOW.toEpochMilli()));
        redis.put(Keys.presence("node-a"), "global", "2");

        presence.stop().block();

        assertFalse(redis.hashes.containsKey(Keys.presence("node-a")));
        assertNull(redis.field(Keys.nodes(), "node-a"));
        assertEquals(String.valueOf(NOW.toEpochMilli()), redis.field(Keys.nodes(), "node-b"));
    }

    /**
     * Hash commands over in-memory maps; any other command fails the test.
     */
    private static class InMemoryHashes implements InvocationHandler {
        private final Map<String, Map<String, String>> hashes = new ConcurrentHashMap<>();
        private volatile boolean failing;

        @SuppressWarnings("unchecked")
        RedisReactiveCommands<String, String> commands() {
            return (RedisReactiveCommands<String, String>) Proxy.newProxyInstance(
                getClass().getClassLoader(), new Class<?>[]{RedisReactiveCommands.class}, this);
        }

        void put(String key, String field, String value) {
            hashes.computeIfAbsent(key, k -> new ConcurrentHashMap<>()).put(field, value);
        }

        String field(String key, String field) {
            return hashes.getOrDefault(key, Map.of()).get(field);
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) {
            if (method.getDeclaringClass() == Object.class) {
                switch (method.getName()) {
                    case "equals":
                        return proxy == args[0];
                    case "hashCode":
                        return System.identityHashCode(proxy);
                    default:
                        return "InMemoryHashes";
                }
            }
            if (failing) {
                RuntimeException error = new IllegalStateException("redis down");
                return method.getReturnType() == Flux.class ? Flux.error(error) : Mono.error(error);
            }

            String name = method.getName();
            if (name.equals("hincrby")) {
                Map<String, String> hash = hashes.computeIfAbsent((String) args[0], k -> new ConcurrentHashMap<>());
                String updated = hash.merge((String) args[1], String.valueOf(args[2]),
                    (old, delta) -> String.valueOf(Long.parseLong(old) + Long.parseLong(delta)));
                return Mono.just(Long.parseLong(updated));
            }
            if (name.equals("hset") && args.length == 3) {
                put((String) args[0], (String) args[1], (String) args[2]);
                return Mono.just(true);
            }
            if (name.equals("hgetall") && args.length == 1) {
                return Flux.fromIterable(Map.copyOf(hashes.getOrDefault((String) args[0], Map.of())).entrySet())
                    .map(entry -> KeyValue.just(entry.getKey(), entry.getValue()));
            }
            if (name.equals("del")) {
                long removed = 0;
                for (String key : (String[]) args[0]) {
                    removed += hashes.remove(key) != null ? 1 : 0;
                }
                return Mono.just(removed);
            }
            if (name.equals("hdel")) {
                Map<String, String> hash = hashes.get((String) args[0]);
                long removed = 0;
                for (String field : (String[]) args[1]) {
                    removed += hash != null && hash.remove(field) != null ? 1 : 0;
                }
                return Mono.just(removed);
            }
            throw new UnsupportedOperationException(name);
        }
    }
}
