package com.cortex.realtime.stream.session;

/**
 * Outcome of enqueueing a frame into a session's delivery queue.
 */
public enum OfferResult {
    /**
     * Frame queued (or handed straight to the transport).
     */
    ACCEPTED,

    /**
     * Queue at capacity; the frame was dropped for this session.
     */
    QUEUE_FULL,

    /**
     * Session is not OPEN (closing, closed, or its transport cancelled the stream).
     */
    NOT_OPEN
}
