package com.cortex.realtime.stream.security;

import com.cortex.realtime.core.redis.Keys;
import com.cortex.realtime.stream.redis.RedisService;
import reactor.core.publisher.Mono;

/**
 * Membership lookups against the keys written by the workspace and conversation services.
 */
public class RedisMembershipDirectory implements MembershipDirectory {
    private final RedisService redisService;

    public RedisMembershipDirectory(RedisService redisService) {
        this.redisService = redisService;
    }

    @Override
    public Mono<Boolean> isWorkspaceMember(String workspaceId, String userId) {
        return redisService.commands().sismember(Keys.workspaceMembers(workspaceId), userId);
    }

    @Override
    public Mono<String> workspaceOfConversation(String conversationId) {
        return redisService.commands().get(Keys.conversationWorkspace(conversationId));
    }
}
