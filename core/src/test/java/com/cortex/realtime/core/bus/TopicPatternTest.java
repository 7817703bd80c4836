package com.cortex.realtime.core.bus;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TopicPatternTest {

    @Test
    void testExactPattern_MatchesOnlySameTopic() {
        TopicPattern pattern = TopicPattern.compile("conversation.message_received");

        assertTrue(pattern.matches("conversation.message_received"));
        assertFalse(pattern.matches("conversation.message_sent"));
        assertFalse(pattern.matches("conversation"));
    }

    @Test
    void testWildcardSegment_MatchesExactlyOneSegment() {
        TopicPattern pattern = TopicPattern.compile("conversation.*");

        assertTrue(pattern.matches("conversation.message_received"));
        assertTrue(pattern.matches("conversation.deleted"));
        assertFalse(pattern.matches("conversation.message.received"));
        assertFalse(pattern.matches("conversation"));
        assertFalse(pattern.matches("workspace.updated"));
    }

    @Test
    void testWildcardInMiddle() {
        TopicPattern pattern = TopicPattern.compile("workspace.*.created");

        assertTrue(pattern.matches("workspace.member.created"));
        assertFalse(pattern.matches("workspace.member.deleted"));
        assertFalse(pattern.matches("workspace.created"));
    }

    @Test
    void testLoneStar_MatchesEveryTopic() {
        TopicPattern pattern = TopicPattern.compile("*");

        assertTrue(pattern.isMatchAll());
        assertTrue(pattern.matches("a"));
        assertTrue(pattern.matches("a.b.c.d"));
    }

    @Test
    void testMatching_IsCaseSensitive() {
        TopicPattern pattern = TopicPattern.compile("User.*");

        assertFalse(pattern.matches("user.updated"));
        assertTrue(pattern.matches("User.updated"));
    }

    @Test
    void testRegexCharacters_AreLiterals() {
        TopicPattern pattern = TopicPattern.compile("job.[a-z]+");

        assertTrue(pattern.matches("job.[a-z]+"));
        assertFalse(pattern.matches("job.done"));
    }

    @Test
    void testBlankPattern_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> TopicPattern.compile(""));
        assertThrows(IllegalArgumentException.class, () -> TopicPattern.compile("  "));
        assertThrows(IllegalArgumentException.class, () -> TopicPattern.compile(null));
    }
}
