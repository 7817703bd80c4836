package com.cortex.realtime.stream.session;

import com.cortex.realtime.core.model.ChannelKey;
import com.cortex.realtime.core.msg.StreamFrame;
import com.cortex.realtime.stream.registry.Connection;
import com.cortex.realtime.stream.registry.ConnectionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;

/**
 * One client's stream: a bounded delivery queue bridging registry pushes to the transport.
 * <p>
 * <b>Queue:</b> a unicast sink backed by a fixed-capacity queue. The single subscriber is the
 * transport's drain loop ({@link #frames()}); frames wait in the queue while the transport applies
 * backpressure, and {@link #offer} reports {@link OfferResult#QUEUE_FULL} instead of blocking once
 * it is full.
 * </p>
 * <p>
 * <b>Threading:</b> {@link #offer} and {@link #close} are called by {@code ConnectionRegistry}
 * inside the channel bucket's lock, which serializes all emissions into the sink.
 * </p>
 * <p>
 * State lives on the {@link Connection} record; the session only drives transitions.
 * </p>
 */
public class StreamingSession {
    private static final Logger log = LoggerFactory.getLogger(StreamingSession.class);

    private final Connection connection;
    private final Sinks.Many<StreamFrame> sink;
    private final BlockingQueue<StreamFrame> queue;
    private final Clock clock;

    private volatile Instant lastWriteAt;
    private volatile boolean heartbeatPending;
    private volatile Disposable transport;

    public StreamingSession(Connection connection, Sinks.Many<StreamFrame> sink,
                            BlockingQueue<StreamFrame> queue, Clock clock) {
        this.connection = connection;
        this.sink = sink;
        this.queue = queue;
        this.clock = clock;
        this.lastWriteAt = connection.getConnectedAt();
    }

    public String getId() {
        return connection.getId();
    }

    public ChannelKey getChannelKey() {
        return connection.getChannelKey();
    }

    public String getOwnerUserId() {
        return connection.getOwnerUserId();
    }

    public ConnectionState getState() {
        return connection.getState();
    }

    public Connection getConnection() {
        return connection;
    }

    public boolean isOpen() {
        return connection.getState() == ConnectionState.OPEN;
    }

    /**
     * CONNECTING -> OPEN, once the registry stored the session.
     */
    public boolean open() {
        return connection.transitionTo(ConnectionState.OPEN);
    }

    /**
     * Enqueues a frame without blocking.
     */
    public OfferResult offer(StreamFrame frame) {
        if (!isOpen()) {
            return OfferResult.NOT_OPEN;
        }

        Sinks.EmitResult result = sink.tryEmitNext(frame);
        if (result.isSuccess()) {
            connection.touch(clock.instant());
            return OfferResult.ACCEPTED;
        }
        if (result == Sinks.EmitResult.FAIL_OVERFLOW) {
            log.debug("Queue full for connection {} ({} pending), dropping {}",
                getId(), queue.size(), frame.getEvent());
            return OfferResult.QUEUE_FULL;
        }

        // FAIL_CANCELLED / FAIL_TERMINATED: the drain loop is gone
        log.debug("Connection {} no longer accepts frames: {}", getId(), result);
        markClosing();
        return OfferResult.NOT_OPEN;
    }

    /**
     * Enqueues a heartbeat frame. Until the transport takes it, {@link #isHeartbeatDue} stays
     * false so a stalled client gets at most one queued heartbeat.
     */
    public OfferResult offerHeartbeat(StreamFrame frame) {
        heartbeatPending = true;
        OfferResult result = offer(frame);
        if (result != OfferResult.ACCEPTED) {
            heartbeatPending = false;
        }
        return result;
    }

    /**
     * The transport's view of the queue. Each frame handed downstream counts as a write and
     * touches the connection.
     */
    public Flux<StreamFrame> frames() {
        return sink.asFlux()
            .doOnNext(frame -> {
                Instant now = clock.instant();
                lastWriteAt = now;
                connection.touch(now);
                if (frame.isHeartbeat()) {
                    heartbeatPending = false;
                }
            });
    }

    /**
     * Binds the network connection serving this session so that disconnects can be detected
     * and {@link #close()} can tear the transport down.
     */
    public void bindTransport(Disposable transport) {
        this.transport = transport;
    }

    /**
     * True once the bound transport was disposed (client went away).
     */
    public boolean isClientGone() {
        Disposable current = transport;
        return current != null && current.isDisposed();
    }

    /**
     * True if nothing was written to the client for at least {@code interval} and no heartbeat
     * is still waiting in the queue.
     */
    public boolean isHeartbeatDue(Instant now, Duration interval) {
        return !heartbeatPending && !lastWriteAt.plus(interval).isAfter(now);
    }

    public Instant getLastWriteAt() {
        return lastWriteAt;
    }

    /**
     * Write failure or disconnect detected: stop accepting frames.
     */
    public boolean markClosing() {
        return connection.transitionTo(ConnectionState.CLOSING);
    }

    /**
     * Discards pending frames, completes the stream and tears down the transport. Terminal.
     */
    public void close() {
        markClosing();
        if (!connection.transitionTo(ConnectionState.CLOSED)) {
            return;
        }

        int discarded = queue.size();
        queue.clear();
        sink.tryEmitComplete();

        Disposable current = transport;
        if (current != null && !current.isDisposed()) {
            current.dispose();
        }
        if (discarded > 0) {
            log.debug("Closed connection {} discarding {} pending frames", getId(), discarded);
        }
    }

    public int pendingCount() {
        return queue.size();
    }

    /**
     * Copy of the frames waiting for the transport, oldest first.
     */
    public List<StreamFrame> pendingFrames() {
        return new ArrayList<>(queue);
    }

    @Override
    public String toString() {
        return "StreamingSession{" + connection + ", pending=" + queue.size() + "}";
    }
}
