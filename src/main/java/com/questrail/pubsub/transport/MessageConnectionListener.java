package com.questrail.pubsub.transport;

import com.questrail.pubsub.channel.Message;

/**
 * MessageConnectionListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link MessageConnection}.
 *
 * <p>Callbacks may arrive on the connection's I/O thread. Listeners must not block.</p>
 */
public interface MessageConnectionListener
{
    void onConnectionOpen();

    /**
     * @param cause diagnostic cause, may be {@code null}
     */
    void onConnectionError(Throwable cause);

    /**
     * @param code   close code reported by the connection
     * @param reason close reason, may be {@code null}
     */
    void onConnectionClosed(int code, String reason);

    /**
     * A decoded inbound message.
     */
    void onMessage(Message message);
}
