package com.cortex.realtime.stream.delivery;

import com.cortex.realtime.core.model.ChannelKey;
import com.cortex.realtime.core.model.ChannelType;
import com.cortex.realtime.core.model.Event;
import com.cortex.realtime.core.msg.StreamFrame;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Builds the frame streamed to clients for an event.
 */
final class WireFrames {
    private WireFrames() {
    }

    /**
     * Frame named after the event topic, carrying its own copy of the payload. Object payloads on
     * non-global channels gain a {@code <channelType>_id} field naming the resource unless they
     * already carry one.
     */
    static StreamFrame fromEvent(Event event, ChannelKey channelKey) {
        return new StreamFrame(event.getTopic(), wirePayload(event.getPayload(), channelKey),
            event.getTimestamp().toEpochMilli());
    }

    /**
     * Enriches {@code payload} in place; callers pass a tree nobody else holds.
     */
    private static JsonNode wirePayload(JsonNode payload, ChannelKey channelKey) {
        if (!payload.isObject() || channelKey.getChannelType() == ChannelType.GLOBAL) {
            return payload;
        }
        ObjectNode object = (ObjectNode) payload;
        String field = channelKey.getChannelType().resourceField();
        if (!object.has(field)) {
            object.put(field, channelKey.getResourceId());
        }
        return object;
    }
}
