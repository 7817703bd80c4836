package com.cortex.realtime.stream.delivery;

import com.cortex.realtime.core.bus.EventBus;
import com.cortex.realtime.core.model.ChannelKey;
import com.cortex.realtime.core.model.Event;
import com.cortex.realtime.core.msg.StreamFrame;
import com.cortex.realtime.core.util.JsonUtils;
import com.cortex.realtime.stream.cluster.ClusterBroadcaster;
import com.cortex.realtime.stream.config.StreamConfig;
import com.cortex.realtime.stream.metrics.MetricsService;
import com.cortex.realtime.stream.registry.ConnectionRegistry;
import com.cortex.realtime.stream.session.SessionFactory;
import com.cortex.realtime.stream.session.StreamingSession;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ChannelEventRelayTest {

    private EventBus bus;
    private ConnectionRegistry registry;
    private ChannelEventRelay relay;
    private final List<ChannelKey> broadcasts = new ArrayList<>();

    @BeforeEach
    void setUp() {
        StreamConfig config = StreamConfig.defaults().build();
        MetricsService metricsService = new MetricsService(new SimpleMeterRegistry(), config);
        bus = new EventBus();
        registry = new ConnectionRegistry(new SessionFactory(config, Clock.systemUTC()),
            (user, type, resource) -> Mono.just(true), metricsService);
        ClusterBroadcaster broadcaster = new ClusterBroadcaster() {
            @Override
            public Mono<Void> start() {
                return Mono.empty();
            }

            @Override
            public Mono<Void> broadcast(ChannelKey channelKey, StreamFrame frame) {
                return Mono.fromRunnable(() -> broadcasts.add(channelKey));
            }

            @Override
            public Mono<Void> stop() {
                return Mono.empty();
            }
        };
        relay = new ChannelEventRelay(bus, registry, broadcaster, metricsService);
        relay.start();
    }

    private StreamingSession open(ChannelKey key) {
        return registry.register(key, "u1").block();
    }

    private static Event event(String topic, Map<String, ?> payload) {
        return Event.of(topic, JsonUtils.toTree(payload), "test");
    }

    @Test
    void testRoutesByPayloadResourceId() {
        StreamingSession c1 = open(ChannelKey.conversation("c1"));
        StreamingSession c2 = open(ChannelKey.conversation("c2"));

        bus.publish(event("conversation.message_received", Map.of("conversation_id", "c1", "text", "hi")));

        assertEquals(1, c1.pendingCount());
        assertEquals(0, c2.pendingCount());
        assertEquals("conversation.message_received", c1.pendingFrames().get(0).getEvent());
        assertEquals(List.of(ChannelKey.conversation("c1")), broadcasts);
    }

    @Test
    void testEventWithoutResourceId_Ignored() {
        StreamingSession c1 = open(ChannelKey.conversation("c1"));

        bus.publish(event("conversation.message_received", Map.of("text", "hi")));

        assertEquals(0, c1.pendingCount());
        assertEquals(List.of(), broadcasts);
    }

    @Test
    void testNonTextualResourceId_UsesItsTextForm() {
        StreamingSession w = open(ChannelKey.workspace("42"));

        bus.publish(event("workspace.renamed", Map.of("workspace_id", 42)));

        assertEquals(1, w.pendingCount());
    }

    @Test
    void testGlobalEvents_GoToGlobalChannel() {
        StreamingSession global = open(ChannelKey.global());
        StreamingSession user = open(ChannelKey.user("u1"));

        bus.publish(event("global.maintenance", Map.of("at", "tonight")));

        assertEquals(1, global.pendingCount());
        assertEquals(0, user.pendingCount());
    }

    @Test
    void testChannelRoutedEvents_Skipped() {
        StreamingSession user = open(ChannelKey.user("u1"));
        Event routed = event("user.updated", Map.of("user_id", "u1")).toBuilder().channelRouted(true).build();

        bus.publish(routed);

        assertEquals(0, user.pendingCount());
        assertEquals(List.of(), broadcasts);
    }

    @Test
    void testDeeperTopics_NotRelayed() {
        StreamingSession user = open(ChannelKey.user("u1"));

        bus.publish(event("user.profile.updated", Map.of("user_id", "u1")));

        assertEquals(0, user.pendingCount());
    }

    @Test
    void testStop_Unsubscribes() {
        StreamingSession user = open(ChannelKey.user("u1"));

        relay.stop();
        bus.publish(event("user.updated", Map.of("user_id", "u1")));

        assertEquals(0, user.pendingCount());
        assertEquals(0, bus.stats().getSubscriptions());
    }
}
