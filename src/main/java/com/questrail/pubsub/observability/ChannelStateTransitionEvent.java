package com.questrail.pubsub.observability;

import com.questrail.pubsub.channel.ChannelState;

import java.time.Instant;

/**
 * Record representing a state transition of a single channel.
 */
public record ChannelStateTransitionEvent(
    Instant timestamp,
    String topic,
    ChannelState oldState,
    ChannelState newState
) {
    /**
     * Checks whether the state actually changed (re-entering JOINING on a rejoin does not).
     */
    public boolean isChange() {
        return oldState != newState;
    }
}
