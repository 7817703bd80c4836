package com.cortex.realtime.stream.security;

import reactor.core.publisher.Mono;

/**
 * Read-only view of workspace membership, maintained by the services that own workspaces
 * and conversations.
 */
public interface MembershipDirectory {
    Mono<Boolean> isWorkspaceMember(String workspaceId, String userId);

    /**
     * @return owning workspace id, or empty for unknown conversations
     */
    Mono<String> workspaceOfConversation(String conversationId);
}
