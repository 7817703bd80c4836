package com.cortex.realtime.stream.registry;

/**
 * Lifecycle of a streaming connection.
 * <pre>
 * CONNECTING -> OPEN -> CLOSING -> CLOSED
 *      \_________________^
 * </pre>
 * CLOSED is terminal.
 */
public enum ConnectionState {
    CONNECTING,
    OPEN,
    CLOSING,
    CLOSED;

    boolean canTransitionTo(ConnectionState next) {
        return switch (this) {
            case CONNECTING -> next == OPEN || next == CLOSING;
            case OPEN -> next == CLOSING;
            case CLOSING -> next == CLOSED;
            case CLOSED -> false;
        };
    }
}
