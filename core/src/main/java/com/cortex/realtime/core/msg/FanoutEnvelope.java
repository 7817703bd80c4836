package com.cortex.realtime.core.msg;

import com.cortex.realtime.core.model.ChannelType;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * A channel push relayed between stream nodes.
 * <p>
 * Published by the node that received the {@code notify} call; consumed by every other node,
 * which pushes {@link #frame} into its own local connections for the channel. The origin node
 * ignores its own envelopes since it already delivered locally.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class FanoutEnvelope {
    @JsonProperty("originNodeId")
    String originNodeId;

    @JsonProperty("channelType")
    ChannelType channelType;

    @JsonProperty("resourceId")
    String resourceId;

    @JsonProperty("frame")
    StreamFrame frame;

    @JsonCreator
    public FanoutEnvelope(
        @JsonProperty("originNodeId") String originNodeId,
        @JsonProperty("channelType") ChannelType channelType,
        @JsonProperty("resourceId") String resourceId,
        @JsonProperty("frame") StreamFrame frame
    ) {
        this.originNodeId = originNodeId;
        this.channelType = channelType;
        this.resourceId = resourceId;
        this.frame = frame;
    }
}
