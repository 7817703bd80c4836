package com.cortex.realtime.core.msg;

import com.cortex.realtime.core.util.JsonUtils;

/**
 * Server-Sent Events text encoding of {@link StreamFrame}s.
 * <p>
 * Jackson writes compact JSON, so {@code data} is always a single line and no
 * multi-line {@code data:} splitting is needed. Line breaks in the event name are
 * replaced to keep the frame well-formed.
 * </p>
 */
public final class SseFrames {
    private SseFrames() {
    }

    public static String encode(StreamFrame frame) {
        return "event: " + sanitize(frame.getEvent()) + "\n"
            + "data: " + JsonUtils.writeValueAsString(frame.getData()) + "\n\n";
    }

    private static String sanitize(String value) {
        if (value == null) {
            return "message";
        }
        return value.replace('\r', ' ').replace('\n', ' ');
    }
}
