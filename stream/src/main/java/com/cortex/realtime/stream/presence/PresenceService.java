package com.cortex.realtime.stream.presence;

import com.cortex.realtime.core.redis.Keys;
import com.cortex.realtime.stream.config.StreamConfig;
import com.cortex.realtime.stream.redis.RedisService;
import com.cortex.realtime.stream.registry.ConnectionListener;
import com.cortex.realtime.stream.session.StreamingSession;
import io.lettuce.core.KeyValue;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;

/**
 * Publishes this node's connection counts to Redis so that any node can report cluster-wide
 * presence.
 * <p>
 * <b>Keys:</b> {@code rtc:presence:{nodeId}} holds one counter per channel type, adjusted on
 * every register/unregister; {@code rtc:nodes} maps node ids to their last heartbeat. Nodes whose
 * heartbeat is older than the presence TTL are left out of {@link #clusterCounts()}.
 * </p>
 * <p>
 * Redis failures are logged and never affect streaming.
 * </p>
 */
public class PresenceService implements ConnectionListener {
    private static final Logger log = LoggerFactory.getLogger(PresenceService.class);

    private final RedisReactiveCommands<String, String> commands;
    private final String nodeId;
    private final Duration presenceTtl;
    private final Clock clock;

    private volatile Disposable heartbeats;

    public PresenceService(RedisService redisService, StreamConfig config, Clock clock) {
        this(redisService.commands(), config, clock);
    }

    PresenceService(RedisReactiveCommands<String, String> commands, StreamConfig config, Clock clock) {
        this.commands = commands;
        this.nodeId = config.getNodeId();
        this.presenceTtl = config.getPresenceTtl();
        this.clock = clock;
    }

    @Override
    public void onRegistered(StreamingSession session) {
        adjust(session, 1);
    }

    @Override
    public void onUnregistered(StreamingSession session) {
        adjust(session, -1);
    }

    private void adjust(StreamingSession session, long delta) {
        String field = Keys.presenceField(session.getChannelKey().getChannelType());
        commands.hincrby(Keys.presence(nodeId), field, delta)
            .subscribe(
                count -> log.trace("Presence {} on {} now {}", field, nodeId, count),
                err -> log.warn("Failed to update presence {} by {}: {}", field, delta, err.getMessage())
            );
    }

    /**
     * Clears counts left by a previous run of this node and starts the liveness heartbeat.
     */
    public Disposable start() {
        Duration period = presenceTtl.dividedBy(3);
        heartbeats = commands.del(Keys.presence(nodeId))
            .thenMany(Flux.interval(Duration.ZERO, period))
            .concatMap(tick -> commands.hset(Keys.nodes(), nodeId, String.valueOf(clock.millis()))
                .onErrorResume(err -> {
                    log.warn("Presence heartbeat failed: {}", err.getMessage());
                    return Mono.empty();
                }))
            .subscribe(
                ok -> {
                },
                err -> log.error("Presence heartbeat stopped", err)
            );
        log.info("Presence heartbeat started for node {} every {}", nodeId, period);
        return heartbeats;
    }

    /**
     * Connection counts per live node and channel type.
     */
    public Mono<Map<String, Map<String, Long>>> clusterCounts() {
        long cutoff = clock.millis() - presenceTtl.toMillis();

        return commands.hgetall(Keys.nodes())
            .filter(node -> isAlive(node, cutoff))
            .map(KeyValue::getKey)
            .concatMap(node -> commands.hgetall(Keys.presence(node))
                .collectMap(KeyValue::getKey, kv -> Long.parseLong(kv.getValue()))
                .map(counts -> Map.entry(node, counts)))
            .collectMap(Map.Entry::getKey, Map.Entry::getValue, TreeMap::new)
            .onErrorResume(err -> {
                log.warn("Failed to read cluster presence: {}", err.getMessage());
                return Mono.just(Map.of());
            });
    }

    private static boolean isAlive(KeyValue<String, String> node, long cutoff) {
        try {
            return Long.parseLong(node.getValue()) >= cutoff;
        } catch (NumberFormatException e) {
            log.warn("Ignoring node {} with malformed heartbeat {}", node.getKey(), node.getValue());
            return false;
        }
    }

    /**
     * Stops the heartbeat and removes this node's presence entries.
     */
    public Mono<Void> stop() {
        Disposable current = heartbeats;
        if (current != null) {
            current.dispose();
        }
        return commands.del(Keys.presence(nodeId))
            .then(commands.hdel(Keys.nodes(), nodeId))
            .then()
            .doOnSuccess(v -> log.info("Presence removed for node {}", nodeId))
            .onErrorResume(err -> {
                log.warn("Failed to remove presence for node {}: {}", nodeId, err.getMessage());
                return Mono.empty();
            });
    }
}
