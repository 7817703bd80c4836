package com.cortex.realtime.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Delivery scope of a streaming connection.
 */
public enum ChannelType {
    GLOBAL("global"),
    USER("user"),
    WORKSPACE("workspace"),
    CONVERSATION("conversation");

    private final String wireName;

    ChannelType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Payload field naming the resource for this channel type, e.g. {@code conversation_id}.
     * GLOBAL has no resource field.
     */
    public String resourceField() {
        return this == GLOBAL ? null : wireName + "_id";
    }

    /**
     * Parses a channel type from its wire name (case-insensitive).
     *
     * @param name wire name such as {@code "conversation"}
     * @return channel type
     * @throws IllegalArgumentException for null or unknown names
     */
    @JsonCreator
    public static ChannelType fromWireName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Channel type must not be null");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (ChannelType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown channel type: " + name);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
