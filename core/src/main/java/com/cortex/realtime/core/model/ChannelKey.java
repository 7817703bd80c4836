package com.cortex.realtime.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Identifies a streaming delivery scope: a channel type plus the resource it is about.
 * <p>
 * A GLOBAL key always carries the single resource id {@link #GLOBAL_RESOURCE_ID}, so all
 * global connections share one bucket no matter what resource id a caller passes.
 * </p>
 */
@Value
public class ChannelKey {
    public static final String GLOBAL_RESOURCE_ID = "global";

    private static final ChannelKey GLOBAL = new ChannelKey(ChannelType.GLOBAL, GLOBAL_RESOURCE_ID);

    ChannelType channelType;
    String resourceId;

    private ChannelKey(ChannelType channelType, String resourceId) {
        this.channelType = channelType;
        this.resourceId = resourceId;
    }

    @JsonCreator
    public static ChannelKey of(@JsonProperty("channelType") ChannelType channelType,
                                @JsonProperty("resourceId") String resourceId) {
        if (channelType == null) {
            throw new IllegalArgumentException("Channel type must not be null");
        }
        if (channelType == ChannelType.GLOBAL) {
            return GLOBAL;
        }
        if (resourceId == null || resourceId.isBlank()) {
            throw new IllegalArgumentException("Resource id is required for channel type " + channelType);
        }
        return new ChannelKey(channelType, resourceId);
    }

    public static ChannelKey global() {
        return GLOBAL;
    }

    public static ChannelKey user(String userId) {
        return of(ChannelType.USER, userId);
    }

    public static ChannelKey workspace(String workspaceId) {
        return of(ChannelType.WORKSPACE, workspaceId);
    }

    public static ChannelKey conversation(String conversationId) {
        return of(ChannelType.CONVERSATION, conversationId);
    }

    /**
     * @return {@code type:resourceId}, used as a stats label and Kafka record key
     */
    @Override
    public String toString() {
        return channelType.wireName() + ":" + resourceId;
    }
}
