package com.questrail.pubsub.channel;

import com.questrail.pubsub.transport.TransportEvent;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Asynchronous failure of a channel.
 *
 * <p>Transport failures are wrapped into this exception and handed to
 * {@link Channel#triggerError(ChannelException)}; they are never thrown. Futures of
 * pending waiters and pushes complete exceptionally with it.</p>
 */
public class ChannelException extends RuntimeException {

    private final transient TransportEvent transportEvent;
    private final String channelEvent;

    private ChannelException(String message, Throwable cause, TransportEvent transportEvent, String channelEvent) {
        super(message, cause);
        this.transportEvent = transportEvent;
        this.channelEvent = channelEvent;
    }

    public static ChannelException transportClosed(TransportEvent.Close close) {
        return new ChannelException(
                "Transport closed (" + close.code() + (close.reason() == null ? "" : ", " + close.reason()) + ")",
                null, close, null);
    }

    public static ChannelException transportError(TransportEvent.Error error) {
        return new ChannelException("Transport error", error.cause(), error, null);
    }

    /**
     * Failure reported by a channel event rather than by the transport.
     */
    public static ChannelException channelEvent(String event, String detail) {
        return new ChannelException(detail, null, null, event);
    }

    public Optional<TransportEvent> transportEvent() {
        return Optional.ofNullable(transportEvent);
    }

    public Optional<String> channelEvent() {
        return Optional.ofNullable(channelEvent);
    }

    /**
     * Generic {@code phx_error} message published on the channel stream for this failure.
     */
    public Message message() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("reason", getMessage());
        if (transportEvent instanceof TransportEvent.Close close) {
            payload.put("code", close.code());
        }
        return Message.of(ChannelEvents.ERROR, payload);
    }
}
