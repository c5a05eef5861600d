package com.questrail.pubsub.channel;

import java.util.Objects;
import java.util.Set;

/**
 * Reserved event kinds of the channel protocol.
 *
 * <p>Any other string is a custom event kind. Replies to a push are addressed to the
 * per-reference kind returned by {@link #replyFor(String)}.</p>
 */
public final class ChannelEvents {

    public static final String JOIN = "phx_join";
    public static final String LEAVE = "phx_leave";
    public static final String CLOSE = "phx_close";
    public static final String ERROR = "phx_error";
    public static final String REPLY = "phx_reply";

    static final String REPLY_PREFIX = "chan_reply_";

    /**
     * Lifecycle and status kinds; these are subject to join-epoch filtering.
     */
    public static final Set<String> STATUSES = Set.of(CLOSE, ERROR, JOIN, REPLY, LEAVE);

    private ChannelEvents() {}

    /**
     * Event kind under which the reply to the push with the given reference is delivered.
     */
    public static String replyFor(String ref) {
        Objects.requireNonNull(ref, "ref");
        return REPLY_PREFIX + ref;
    }

    public static boolean isStatus(String event) {
        return STATUSES.contains(event);
    }

    public static boolean isReplyFor(String event) {
        return event != null && event.startsWith(REPLY_PREFIX);
    }
}
