package com.cortex.realtime.stream.registry;

import com.cortex.realtime.core.model.ChannelKey;
import com.cortex.realtime.core.model.ChannelType;
import com.cortex.realtime.core.msg.StreamFrame;
import com.cortex.realtime.stream.session.StreamingSession;
import reactor.core.publisher.Mono;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Interface for the per-process table of live streaming connections, grouped by channel key
 * (Dependency Inversion Principle).
 */
public interface IConnectionRegistry {
    /**
     * Authorizes and registers a new streaming connection.
     *
     * @param channelKey  channel the client subscribes to
     * @param ownerUserId authenticated user
     * @return Mono of the OPEN session; errors with {@code AuthorizationDeniedException} when the
     * access policy refuses, or {@link IllegalStateException} after {@link #shutdown()}
     */
    Mono<StreamingSession> register(ChannelKey channelKey, String ownerUserId);

    /**
     * Closes and removes a connection. Idempotent.
     *
     * @return true if this call removed it
     */
    boolean unregister(String connectionId);

    /**
     * Enqueues a frame for every open connection on the channel. Never blocks on slow clients.
     *
     * @return number of connections the frame was enqueued for
     */
    int push(ChannelKey channelKey, StreamFrame frame);

    /**
     * Visits every OPEN session while holding its channel's lock.
     */
    void forEachOpenSession(Consumer<StreamingSession> visitor);

    Optional<StreamingSession> getSession(String connectionId);

    int countByType(ChannelType channelType);

    ConnectionStats stats();

    void addListener(ConnectionListener listener);

    /**
     * Closes every session immediately and refuses further registrations.
     */
    void shutdown();

    boolean isShutdown();
}
