package com.cortex.realtime.stream.security;

import com.cortex.realtime.core.model.ChannelType;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.Map;
import java.util.Set;

class DefaultAccessPolicyTest {

    private final AccessPolicy policy = new DefaultAccessPolicy(new StubDirectory(
        Map.of("w1", Set.of("alice")),
        Map.of("c1", "w1")
    ));

    @Test
    void testGlobal_AllowedForAnyAuthenticatedUser() {
        StepVerifier.create(policy.verifyAccess("bob", ChannelType.GLOBAL, "global"))
            .expectNext(true)
            .verifyComplete();
    }

    @Test
    void testUserChannel_OnlyOwner() {
        StepVerifier.create(policy.verifyAccess("alice", ChannelType.USER, "alice"))
            .expectNext(true)
            .verifyComplete();
        StepVerifier.create(policy.verifyAccess("alice", ChannelType.USER, "bob"))
            .expectNext(false)
            .verifyComplete();
    }

    @Test
    void testWorkspace_RequiresMembership() {
        StepVerifier.create(policy.verifyAccess("alice", ChannelType.WORKSPACE, "w1"))
            .expectNext(true)
            .verifyComplete();
        StepVerifier.create(policy.verifyAccess("bob", ChannelType.WORKSPACE, "w1"))
            .expectNext(false)
            .verifyComplete();
    }

    @Test
    void testConversation_RequiresMembershipOfOwningWorkspace() {
        StepVerifier.create(policy.verifyAccess("alice", ChannelType.CONVERSATION, "c1"))
            .expectNext(true)
            .verifyComplete();
        StepVerifier.create(policy.verifyAccess("bob", ChannelType.CONVERSATION, "c1"))
            .expectNext(false)
            .verifyComplete();
    }

    @Test
    void testUnknownConversation_Denied() {
        StepVerifier.create(policy.verifyAccess("alice", ChannelType.CONVERSATION, "missing"))
            .expectNext(false)
            .verifyComplete();
    }

    @Test
    void testNoDirectory_DeniesMembershipChannels() {
        AccessPolicy bare = new DefaultAccessPolicy(null);

        StepVerifier.create(bare.verifyAccess("alice", ChannelType.WORKSPACE, "w1"))
            .expectNext(false)
            .verifyComplete();
        StepVerifier.create(bare.verifyAccess("alice", ChannelType.GLOBAL, "global"))
            .expectNext(true)
            .verifyComplete();
    }

    @Test
    void testDirectoryFailure_Denies() {
        AccessPolicy failing = new DefaultAccessPolicy(new MembershipDirectory() {
            @Override
            public Mono<Boolean> isWorkspaceMember(String workspaceId, String userId) {
                return Mono.error(new IllegalStateException("redis down"));
            }

            @Override
            public Mono<String> workspaceOfConversation(String conversationId) {
                return Mono.error(new IllegalStateException("redis down"));
            }
        });

        StepVerifier.create(failing.verifyAccess("alice", ChannelType.WORKSPACE, "w1"))
            .expectNext(false)
            .verifyComplete();
        StepVerifier.create(failing.verifyAccess("alice", ChannelType.CONVERSATION, "c1"))
            .expectNext(false)
            .verifyComplete();
    }

    /**
     * In-memory membership directory.
     */
    private static class StubDirectory implements MembershipDirectory {
        private final Map<String, Set<String>> members;
        private final Map<String, String> conversations;

        StubDirectory(Map<String, Set<String>> members, Map<String, String> conversations) {
            this.members = members;
            this.conversations = conversations;
        }

        @Override
        public Mono<Boolean> isWorkspaceMember(String workspaceId, String userId) {
            return Mono.just(members.getOrDefault(workspaceId, Set.of()).contains(userId));
        }

        @Override
        public Mono<String> workspaceOfConversation(String conversationId) {
            return Mono.justOrEmpty(conversations.get(conversationId));
        }
    }
}
