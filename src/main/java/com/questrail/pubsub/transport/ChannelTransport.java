package com.questrail.pubsub.transport;

import com.questrail.pubsub.channel.Channel;
import com.questrail.pubsub.channel.Message;
import com.questrail.pubsub.internal.time.Cancellable;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * ChannelTransport
 * -----------------------------------------------------------------------------
 * The shared connection as seen by a {@link Channel}.
 *
 * <p>One transport serves many channels. Channels only read from it, enqueue
 * outbound messages, and deregister themselves on close.</p>
 *
 * <p>Listener callbacks may arrive on any thread; channels re-enter their own
 * executor before acting on them.</p>
 */
public interface ChannelTransport
{
    boolean isConnected();

    /**
     * Timeout used by channels created without an explicit one.
     */
    Duration defaultTimeout();

    /**
     * Allocates a reference unique for the lifetime of this transport.
     */
    String nextRef();

    /**
     * Subscribes to inbound messages for one topic.
     */
    Cancellable subscribeTopic(String topic, Consumer<Message> listener);

    /**
     * Subscribes to connection error broadcasts.
     */
    Cancellable subscribeErrors(Consumer<TransportEvent.Error> listener);

    /**
     * Subscribes to connection open broadcasts.
     */
    Cancellable subscribeOpen(Consumer<TransportEvent.Open> listener);

    /**
     * Called exactly once by a channel when it closes.
     */
    void removeChannel(Channel channel);

    /**
     * Fire-and-forget transmit. Implementations may drop the message while disconnected.
     */
    void send(Message message);
}
