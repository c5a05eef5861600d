package com.questrail.pubsub.transport;

import com.questrail.pubsub.channel.Message;

/**
 * MessageConnection
 * -----------------------------------------------------------------------------
 * Minimal port for the physical connection underneath a {@link ChannelMultiplexer}.
 *
 * <p>Implementations own the socket, the wire encoding and any heartbeat or
 * reconnection policy. Above this port everything sees decoded {@link Message}s
 * and lifecycle notifications only.</p>
 */
public interface MessageConnection
{
    /**
     * Start connecting.
     *
     * <p>Once the connection is usable the implementation MUST call
     * {@link MessageConnectionListener#onConnectionOpen()}.</p>
     */
    void start();

    /**
     * Close the connection and release its resources.
     *
     * <p>The implementation MUST report the closure via
     * {@link MessageConnectionListener#onConnectionClosed(int, String)}.</p>
     */
    void stop();

    /**
     * Encode and transmit a message. Messages sent while not open may be dropped.
     */
    void send(Message message);

    /**
     * Register the listener that receives inbound messages and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(MessageConnectionListener listener);
}
