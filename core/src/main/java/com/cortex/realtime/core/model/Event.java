package com.cortex.realtime.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable description of something that happened, published on the event bus.
 * <p>
 * <b>Topic:</b> dot-segmented subject such as {@code conversation.message_received}.
 * </p>
 * <p>
 * <b>Payload:</b> opaque JSON tree. The event keeps its own copy of the tree it was built with,
 * and {@link #getPayload()} hands out a fresh copy on every call.
 * </p>
 */
@Value
public class Event {
    String topic;

    JsonNode payload;

    String source;

    /**
     * Trace id carried into logs of every handler invocation.
     */
    String traceId;

    /**
     * Optional id linking this event to a request or an earlier event.
     */
    String correlationId;

    Instant timestamp;

    /**
     * True when the publisher addressed this event to an explicit channel key.
     * The channel relay never routes such events, so a connection sees them at most once.
     */
    boolean channelRouted;

    /**
     * Missing payload becomes JSON null, missing trace id a random UUID, missing timestamp now.
     */
    @Builder(toBuilder = true)
    private Event(@NonNull String topic, JsonNode payload, @NonNull String source, String traceId,
                  String correlationId, Instant timestamp, boolean channelRouted) {
        this.topic = topic;
        this.payload = payload == null ? NullNode.getInstance() : payload.deepCopy();
        this.source = source;
        this.traceId = traceId == null ? UUID.randomUUID().toString() : traceId;
        this.correlationId = correlationId;
        this.timestamp = timestamp == null ? Instant.now() : timestamp;
        this.channelRouted = channelRouted;
    }

    public static Event of(String topic, JsonNode payload, String source) {
        return Event.builder()
            .topic(topic)
            .payload(payload)
            .source(source)
            .build();
    }

    /**
     * Copy of the payload; changes to it are not seen by other handlers or by queued frames.
     */
    public JsonNode getPayload() {
        return payload.deepCopy();
    }
}
