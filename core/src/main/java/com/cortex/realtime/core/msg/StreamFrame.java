package com.cortex.realtime.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.Value;

/**
 * Wire view of an event as queued for a streaming connection.
 * <p>
 * Encoded by {@link SseFrames} as {@code event: <event>\ndata: <json data>\n\n}.
 * </p>
 */
@Value
public class StreamFrame {
    /**
     * Frame name, normally the event topic ({@code heartbeat} and {@code connect} for synthetic frames).
     */
    @JsonProperty("event")
    String event;

    /**
     * JSON payload written on the {@code data:} line.
     */
    @JsonProperty("data")
    JsonNode data;

    /**
     * Creation time (epoch millis).
     */
    @JsonProperty("ts")
    long ts;

    @JsonCreator
    public StreamFrame(
        @JsonProperty("event") String event,
        @JsonProperty("data") JsonNode data,
        @JsonProperty("ts") long ts
    ) {
        this.event = event;
        this.data = data == null ? NullNode.getInstance() : data;
        this.ts = ts;
    }

    public static StreamFrame of(String event, JsonNode data) {
        return new StreamFrame(event, data, System.currentTimeMillis());
    }

    @JsonIgnore
    public boolean isHeartbeat() {
        return Topics.HEARTBEAT.equals(event);
    }
}
