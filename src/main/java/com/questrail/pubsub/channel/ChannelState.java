package com.questrail.pubsub.channel;

/**
 * The states a {@link Channel} can be in. Exactly one is active at a time.
 */
public enum ChannelState {
    /** Not joined: before the first join, or terminally after a leave or close. */
    CLOSED,

    /** Join was refused, timed out, or the transport failed; a rejoin may be pending. */
    ERRORED,

    /** Joined and able to push. */
    JOINED,

    /** Waiting for the reply to a join request. */
    JOINING,

    /** Waiting for the reply to a leave request. */
    LEAVING
}
