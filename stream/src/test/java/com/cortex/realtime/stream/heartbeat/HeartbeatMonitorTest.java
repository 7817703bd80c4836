package com.cortex.realtime.stream.heartbeat;

import com.cortex.realtime.core.model.ChannelKey;
import com.cortex.realtime.core.msg.StreamFrame;
import com.cortex.realtime.core.msg.Topics;
import com.cortex.realtime.core.util.JsonUtils;
import com.cortex.realtime.stream.MutableClock;
import com.cortex.realtime.stream.config.StreamConfig;
import com.cortex.realtime.stream.metrics.MetricsService;
import com.cortex.realtime.stream.registry.ConnectionRegistry;
import com.cortex.realtime.stream.registry.ConnectionState;
import com.cortex.realtime.stream.session.SessionFactory;
import com.cortex.realtime.stream.session.StreamingSession;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HeartbeatMonitorTest {

    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

    private MutableClock clock;
    private ConnectionRegistry registry;
    private HeartbeatMonitor monitor;

    @BeforeEach
    void setUp() {
        StreamConfig config = StreamConfig.defaults()
            .queueCapacity(2)
            .heartbeatInterval(Duration.ofSeconds(25))
            .heartbeatCheckPeriod(Duration.ofSeconds(5))
            .build();
        clock = new MutableClock(START);
        MetricsService metricsService = new MetricsService(new SimpleMeterRegistry(), config);
        registry = new ConnectionRegistry(new SessionFactory(config, clock),
            (user, type, resource) -> Mono.just(true), metricsService);
        monitor = new HeartbeatMonitor(registry, config, metricsService, clock);
    }

    private StreamingSession open(ChannelKey key) {
        StreamingSession session = registry.register(key, "u1").block();
        session.bindTransport(Disposables.composite());
        return session;
    }

    @Test
    void testTick_NothingDueBeforeInterval() {
        StreamingSession session = open(ChannelKey.user("u1"));
        clock.advance(Duration.ofSeconds(24));

        HeartbeatMonitor.TickSummary summary = monitor.tick();

        assertEquals(0, summary.getHeartbeats());
        assertEquals(0, session.pendingCount());
    }

    @Test
    void testTick_IdleSessionGetsHeartbeat() {
        StreamingSession session = open(ChannelKey.user("u1"));
        clock.advance(Duration.ofSeconds(25));

        HeartbeatMonitor.TickSummary summary = monitor.tick();

        assertEquals(1, summary.getHeartbeats());
        StreamFrame heartbeat = session.pendingFrames().get(0);
        assertEquals(Topics.HEARTBEAT, heartbeat.getEvent());
        assertEquals(START.plusSeconds(25).toString(), heartbeat.getData().get("timestamp_utc").asText());
        assertEquals(START.plusSeconds(25), session.getConnection().getLastActiveAt());
    }

    @Test
    void testTick_StalledTransport_OneQueuedHeartbeat() {
        StreamingSession session = open(ChannelKey.user("u1"));
        clock.advance(Duration.ofSeconds(25));
        assertEquals(1, monitor.tick().getHeartbeats());

        clock.advance(Duration.ofSeconds(5));
        assertEquals(0, monitor.tick().getHeartbeats());
        clock.advance(Duration.ofSeconds(25));
        assertEquals(0, monitor.tick().getHeartbeats());

        assertEquals(1, session.pendingCount());
        assertTrue(session.isOpen());
    }

    @Test
    void testTick_HeartbeatAgainAfterPreviousOneWritten() {
        StreamingSession session = open(ChannelKey.user("u1"));
        clock.advance(Duration.ofSeconds(25));
        assertEquals(1, monitor.tick().getHeartbeats());

        session.frames().subscribe();
        clock.advance(Duration.ofSeconds(25));

        assertEquals(1, monitor.tick().getHeartbeats());
    }

    @Test
    void testTick_RecentWriteSkipsHeartbeat() {
        StreamingSession session = open(ChannelKey.user("u1"));
        session.frames().subscribe();
        clock.advance(Duration.ofSeconds(20));
        registry.push(ChannelKey.user("u1"), StreamFrame.of("user.updated", JsonUtils.objectNode()));
        clock.advance(Duration.ofSeconds(10));

        // 30s since connect but only 10s since the last write
        assertEquals(0, monitor.tick().getHeartbeats());
    }

    @Test
    void testTick_ClientGoneReclaimed() {
        StreamingSession session = open(ChannelKey.conversation("c1"));
        Disposable transport = Disposables.composite();
        session.bindTransport(transport);
        transport.dispose();

        HeartbeatMonitor.TickSummary summary = monitor.tick();

        assertEquals(1, summary.getReclaimed());
        assertEquals(ConnectionState.CLOSED, session.getState());
        assertEquals(0, registry.stats().getTotalConnections());
    }

    @Test
    void testTick_RefusedHeartbeatTreatedAsWriteFailure() {
        StreamingSession stuck = open(ChannelKey.conversation("c1"));
        StreamingSession healthy = open(ChannelKey.conversation("c2"));
        healthy.frames().subscribe();
        registry.push(ChannelKey.conversation("c1"), StreamFrame.of("a", null));
        registry.push(ChannelKey.conversation("c1"), StreamFrame.of("b", null));
        clock.advance(Duration.ofSeconds(30));

        HeartbeatMonitor.TickSummary summary = monitor.tick();

        assertEquals(1, summary.getHeartbeats());
        assertEquals(1, summary.getReclaimed());
        assertEquals(ConnectionState.CLOSED, stuck.getState());
        assertTrue(healthy.isOpen());
    }

    @Test
    void testStartStop() {
        monitor.start();
        assertTrue(monitor.isRunning());

        monitor.stop();
        assertFalse(monitor.isRunning());
    }
}
