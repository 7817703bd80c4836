package com.cortex.realtime.stream.security;

import com.cortex.realtime.core.model.ChannelType;
import reactor.core.publisher.Mono;

/**
 * Access check consulted before a streaming connection is registered.
 */
@FunctionalInterface
public interface AccessPolicy {
    /**
     * @param ownerUserId  authenticated user opening the stream
     * @param channelType  requested channel type
     * @param resourceId   requested resource
     * @return true to allow; false or empty denies
     */
    Mono<Boolean> verifyAccess(String ownerUserId, ChannelType channelType, String resourceId);
}
