package com.cortex.realtime.core.bus;

import com.cortex.realtime.core.model.Event;
import reactor.core.publisher.Mono;

/**
 * Reactive bus subscriber. The bus subscribes to the returned {@link Mono} and
 * does not wait for it to complete.
 */
@FunctionalInterface
public interface AsyncEventHandler {
    Mono<Void> onEvent(Event event);
}
