package com.cortex.realtime.stream.security;

import com.cortex.realtime.core.model.ChannelType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Channel access rules:
 * <ul>
 *   <li>global: any authenticated user</li>
 *   <li>user: only the user's own channel</li>
 *   <li>workspace: members of the workspace</li>
 *   <li>conversation: members of the conversation's workspace</li>
 * </ul>
 * Without a membership directory workspace and conversation channels are denied.
 * Lookup errors deny as well.
 */
public class DefaultAccessPolicy implements AccessPolicy {
    private static final Logger log = LoggerFactory.getLogger(DefaultAccessPolicy.class);

    private final MembershipDirectory directory;

    public DefaultAccessPolicy(MembershipDirectory directory) {
        this.directory = directory;
    }

    @Override
    public Mono<Boolean> verifyAccess(String ownerUserId, ChannelType channelType, String resourceId) {
        if (ownerUserId == null || ownerUserId.isBlank()) {
            return Mono.just(false);
        }

        return switch (channelType) {
            case GLOBAL -> Mono.just(true);
            case USER -> Mono.just(ownerUserId.equals(resourceId));
            case WORKSPACE -> workspaceAccess(ownerUserId, resourceId);
            case CONVERSATION -> conversationAccess(ownerUserId, resourceId);
        };
    }

    private Mono<Boolean> workspaceAccess(String userId, String workspaceId) {
        if (directory == null) {
            log.warn("No membership directory for workspace {} access check - denying access by default", workspaceId);
            return Mono.just(false);
        }
        return directory.isWorkspaceMember(workspaceId, userId)
            .defaultIfEmpty(false)
            .onErrorResume(err -> {
                log.error("Membership lookup failed for workspace {} user {}", workspaceId, userId, err);
                return Mono.just(false);
            });
    }

    private Mono<Boolean> conversationAccess(String userId, String conversationId) {
        if (directory == null) {
            log.warn("No membership directory for conversation {} access check - denying access by default",
                conversationId);
            return Mono.just(false);
        }
        return directory.workspaceOfConversation(conversationId)
            .flatMap(workspaceId -> workspaceAccess(userId, workspaceId))
            .defaultIfEmpty(false)
            .onErrorResume(err -> {
                log.error("Conversation lookup failed for {} user {}", conversationId, userId, err);
                return Mono.just(false);
            });
    }
}
