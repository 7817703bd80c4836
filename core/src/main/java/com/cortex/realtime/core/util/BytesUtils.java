package com.cortex.realtime.core.util;

import java.nio.charset.StandardCharsets;

public final class BytesUtils {
    private BytesUtils() {
    }

    /**
     * @return number of bytes {@code str} occupies on the wire as UTF-8, 0 for null
     */
    public static long getBytesLength(String str) {
        return str == null ? 0 : str.getBytes(StandardCharsets.UTF_8).length;
    }
}
