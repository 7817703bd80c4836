package com.cortex.realtime.core.bus;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Read-only snapshot of one subscription's counters.
 */
@Value
@Builder
public class SubscriptionStats {
    String subscriptionId;
    String pattern;
    Instant createdAt;
    long matched;
    long delivered;
    long errors;
}
