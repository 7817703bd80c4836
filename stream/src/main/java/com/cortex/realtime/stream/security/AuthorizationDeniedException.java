package com.cortex.realtime.stream.security;

import com.cortex.realtime.core.model.ChannelKey;
import lombok.Getter;

/**
 * Registration refused by the {@link AccessPolicy}. Raised before any session exists.
 */
@Getter
public class AuthorizationDeniedException extends RuntimeException {
    private final String ownerUserId;
    private final ChannelKey channelKey;

    public AuthorizationDeniedException(String ownerUserId, ChannelKey channelKey) {
        super("User " + ownerUserId + " may not stream " + channelKey);
        this.ownerUserId = ownerUserId;
        this.channelKey = channelKey;
    }
}
