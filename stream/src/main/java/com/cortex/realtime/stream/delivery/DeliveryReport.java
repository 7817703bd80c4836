package com.cortex.realtime.stream.delivery;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one notify call.
 */
@Value
@Builder
public class DeliveryReport {
    /**
     * Trace id of the published event.
     */
    String traceId;

    /**
     * Bus handlers invoked or scheduled.
     */
    int busHandlers;

    /**
     * Local connections the wire frame was enqueued for; 0 unless a direct push was requested.
     */
    int directDeliveries;
}
