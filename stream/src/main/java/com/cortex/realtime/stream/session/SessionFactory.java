package com.cortex.realtime.stream.session;

import com.cortex.realtime.core.model.ChannelKey;
import com.cortex.realtime.core.msg.StreamFrame;
import com.cortex.realtime.stream.config.StreamConfig;
import com.cortex.realtime.stream.registry.Connection;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * Factory for creating Connection + StreamingSession pairs (Single Responsibility Principle).
 * <p>
 * Separated from the registry to isolate queue sizing and id issuing.
 * </p>
 */
public class SessionFactory {
    private final int queueCapacity;
    private final Clock clock;

    public SessionFactory(StreamConfig config, Clock clock) {
        this(config.getQueueCapacity(), clock);
    }

    public SessionFactory(int queueCapacity, Clock clock) {
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("Queue capacity must be positive: " + queueCapacity);
        }
        this.queueCapacity = queueCapacity;
        this.clock = clock;
    }

    /**
     * Creates a new session in state CONNECTING.
     *
     * @param channelKey  delivery scope
     * @param ownerUserId authenticated owner
     * @return session with a fresh connection id
     */
    public StreamingSession createSession(ChannelKey channelKey, String ownerUserId) {
        Connection connection = new Connection(
            UUID.randomUUID().toString(), channelKey, ownerUserId, clock.instant()
        );

        // Bounded queue: overflow is reported to the caller instead of blocking it
        BlockingQueue<StreamFrame> queue = new ArrayBlockingQueue<>(queueCapacity);
        Sinks.Many<StreamFrame> sink = Sinks.many().unicast().onBackpressureBuffer(queue);

        return new StreamingSession(connection, sink, queue, clock);
    }
}
