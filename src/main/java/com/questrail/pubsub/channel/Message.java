package com.questrail.pubsub.channel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable protocol message as seen by the channel layer.
 *
 * <p>The payload is opaque beyond routing; only reply payloads are inspected, for
 * their {@code status} and {@code response} entries.</p>
 *
 * @param topic   topic the message belongs to, may be {@code null} for locally synthesized messages
 * @param event   event kind, never {@code null}
 * @param payload payload map, never {@code null}
 * @param ref     correlation reference, may be {@code null}
 * @param joinRef join-epoch reference, may be {@code null}
 */
public record Message(
        String topic,
        String event,
        Map<String, Object> payload,
        String ref,
        String joinRef
) {
    public Message {
        Objects.requireNonNull(event, "event");
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static Message of(String event, Map<String, Object> payload) {
        return new Message(null, event, payload, null, null);
    }

    public boolean isReply() {
        return ChannelEvents.REPLY.equals(event);
    }

    /**
     * Re-addresses a {@code phx_reply} to the reply kind of the push it answers.
     *
     * @throws IllegalStateException if this is not a reply carrying a reference
     */
    public Message asReplyEvent() {
        if (!isReply() || ref == null) {
            throw new IllegalStateException("Not a correlated reply: " + event);
        }
        return new Message(topic, ChannelEvents.replyFor(ref), payload, ref, joinRef);
    }
}
