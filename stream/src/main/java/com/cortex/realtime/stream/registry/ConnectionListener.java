package com.cortex.realtime.stream.registry;

import com.cortex.realtime.stream.session.StreamingSession;

/**
 * Callbacks fired after a session entered or left the registry. Invoked on the thread that
 * performed the change; implementations must not block.
 */
public interface ConnectionListener {
    default void onRegistered(StreamingSession session) {
    }

    default void onUnregistered(StreamingSession session) {
    }
}
