package com.cortex.realtime.core.bus;

import lombok.Builder;
import lombok.Value;

/**
 * Read-only snapshot of the bus-wide counters.
 */
@Value
@Builder
public class BusStats {
    /**
     * Number of {@code publish} calls.
     */
    long published;

    /**
     * Subscription matches across all publishes.
     */
    long matched;

    /**
     * Handler invocations that completed (sync) or were scheduled and completed without error (async).
     */
    long delivered;

    /**
     * Handler invocations that threw or signalled an error.
     */
    long errors;

    int subscriptions;
}
