package com.cortex.realtime.stream.registry;

import com.cortex.realtime.core.model.ChannelKey;
import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Registry record of one streaming client.
 * <p>
 * Owned by {@link ConnectionRegistry}. The session that serves it only updates
 * {@code lastActiveAt} and drives the state transitions.
 * </p>
 */
public class Connection {
    @Getter
    private final String id;
    @Getter
    private final ChannelKey channelKey;
    @Getter
    private final String ownerUserId;
    @Getter
    private final Instant connectedAt;

    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);
    private volatile Instant lastActiveAt;

    public Connection(String id, ChannelKey channelKey, String ownerUserId, Instant connectedAt) {
        this.id = id;
        this.channelKey = channelKey;
        this.ownerUserId = ownerUserId;
        this.connectedAt = connectedAt;
        this.lastActiveAt = connectedAt;
    }

    public ConnectionState getState() {
        return state.get();
    }

    public Instant getLastActiveAt() {
        return lastActiveAt;
    }

    /**
     * Moves to {@code next} if that is a legal step from the current state.
     *
     * @return true if this call performed the transition
     */
    public boolean transitionTo(ConnectionState next) {
        while (true) {
            ConnectionState current = state.get();
            if (!current.canTransitionTo(next)) {
                return false;
            }
            if (state.compareAndSet(current, next)) {
                return true;
            }
        }
    }

    public void touch(Instant now) {
        lastActiveAt = now;
    }

    @Override
    public String toString() {
        return "Connection{" + id + ", " + channelKey + ", owner=" + ownerUserId + ", " + state.get() + "}";
    }
}
