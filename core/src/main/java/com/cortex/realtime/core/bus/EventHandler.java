package com.cortex.realtime.core.bus;

import com.cortex.realtime.core.model.Event;

/**
 * Synchronous bus subscriber. Runs on the publishing thread.
 */
@FunctionalInterface
public interface EventHandler {
    void onEvent(Event event) throws Exception;
}
