package com.questrail.pubsub.observability;

import java.time.Instant;

/**
 * Record representing a notable protocol step on a channel.
 *
 * @param detail free-form diagnostic text, may be empty
 */
public record ChannelProtocolEvent(
    Instant timestamp,
    String topic,
    Kind kind,
    String detail
) {
    public enum Kind {
        JOIN_SENT,
        JOIN_OK,
        JOIN_ERROR,
        JOIN_TIMEOUT,
        REJOIN_SCHEDULED,
        REJOIN_CANCELLED,
        PUSH_BUFFERED,
        BUFFER_FLUSHED,
        LEAVE_SENT,
        LEAVE_COMPLETED,
        STALE_MESSAGE_DROPPED,
        WAITER_REPLACED,
        CLOSED
    }
}
