package com.cortex.realtime.core.msg;

public final class Topics {
    private Topics() {
    }

    /**
     * Synthetic keep-alive frame written to idle streams.
     */
    public static final String HEARTBEAT = "heartbeat";

    /**
     * First frame written to every stream once its registration succeeded.
     */
    public static final String CONNECT = "connect";

    /**
     * Kafka topic carrying channel pushes between stream nodes (FanoutEnvelope messages).
     * Every node consumes it with its own group id.
     */
    public static final String STREAM_FANOUT = "rtc.stream.fanout";

    /**
     * Bus topic patterns the channel relay listens on, one per routed channel type.
     */
    public static final String CONVERSATION_EVENTS = "conversation.*";
    public static final String WORKSPACE_EVENTS = "workspace.*";
    public static final String USER_EVENTS = "user.*";
    public static final String GLOBAL_EVENTS = "global.*";
}
