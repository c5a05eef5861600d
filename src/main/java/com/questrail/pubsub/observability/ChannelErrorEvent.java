package com.questrail.pubsub.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly on a channel.
 */
public record ChannelErrorEvent(
    Instant timestamp,
    String topic,
    String message,
    Throwable cause
) {
}
