package com.cortex.realtime.core.bus;

import com.google.common.base.Splitter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Subscription pattern compiled once into per-segment matchers.
 * <p>
 * <b>Syntax:</b> dot-separated segments; {@code *} matches exactly one arbitrary segment.
 * A pattern that is exactly {@code *} matches every topic, whatever its segment count.
 * Any other pattern requires the topic to have the same number of segments, with every
 * literal segment equal (case-sensitive) to the topic's segment at that position.
 * </p>
 * <pre>
 *   conversation.*   matches conversation.updated, conversation.message_received
 *                    does not match conversation, workspace.updated, conversation.a.b
 *   *                matches everything
 * </pre>
 */
public final class TopicPattern {
    static final String WILDCARD = "*";

    private static final Splitter SEGMENTS = Splitter.on('.');
    private static final TopicPattern MATCH_ALL = new TopicPattern(WILDCARD, Collections.emptyList(), true);

    private final String source;
    private final List<Segment> segments;
    private final boolean matchAll;

    private TopicPattern(String source, List<Segment> segments, boolean matchAll) {
        this.source = source;
        this.segments = segments;
        this.matchAll = matchAll;
    }

    /**
     * Compiles a pattern.
     *
     * @param pattern dot-segmented pattern
     * @return compiled pattern
     * @throws IllegalArgumentException if the pattern is null or blank
     */
    public static TopicPattern compile(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("Pattern must not be blank");
        }
        if (WILDCARD.equals(pattern)) {
            return MATCH_ALL;
        }

        List<Segment> compiled = new ArrayList<>();
        for (String part : SEGMENTS.split(pattern)) {
            compiled.add(WILDCARD.equals(part) ? Segment.ANY : Segment.exact(part));
        }
        return new TopicPattern(pattern, List.copyOf(compiled), false);
    }

    /**
     * Splits a topic into its segments. The bus splits each published topic once and
     * hands the result to every subscription's matcher.
     */
    public static List<String> split(String topic) {
        return SEGMENTS.splitToList(topic);
    }

    public boolean matches(String topic) {
        return matchAll || matches(split(topic));
    }

    public boolean matches(List<String> topicSegments) {
        if (matchAll) {
            return true;
        }
        if (topicSegments.size() != segments.size()) {
            return false;
        }
        for (int i = 0; i < segments.size(); i++) {
            if (!segments.get(i).matches(topicSegments.get(i))) {
                return false;
            }
        }
        return true;
    }

    public boolean isMatchAll() {
        return matchAll;
    }

    @Override
    public String toString() {
        return source;
    }

    /**
     * One compiled position of a pattern: a literal or a single-segment wildcard.
     */
    private static final class Segment {
        private static final Segment ANY = new Segment(null);

        private final String literal;

        private Segment(String literal) {
            this.literal = literal;
        }

        static Segment exact(String literal) {
            return new Segment(literal);
        }

        boolean matches(String topicSegment) {
            return literal == null || literal.equals(topicSegment);
        }
    }
}
