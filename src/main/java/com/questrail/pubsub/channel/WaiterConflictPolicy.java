package com.questrail.pubsub.channel;

/**
 * What {@link Channel#onPushReply(String)} does when a waiter for the same event kind
 * is already pending.
 */
public enum WaiterConflictPolicy {
    /**
     * The new waiter replaces the old one. The previous future is abandoned and never completes.
     */
    REPLACE,

    /**
     * The new waiter replaces the old one and the previous future fails with a
     * {@link ChannelException}.
     */
    FAIL_PREVIOUS
}
