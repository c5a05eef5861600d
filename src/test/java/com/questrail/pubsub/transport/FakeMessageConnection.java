package com.questrail.pubsub.transport;

import com.questrail.pubsub.channel.Message;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * FakeMessageConnection
 * -----------------------------------------------------------------------------
 * Test-only {@link MessageConnection} implementation.
 *
 * <p>Records outbound messages and lets tests drive the listener with inbound
 * messages and lifecycle callbacks.</p>
 */
public final class FakeMessageConnection implements MessageConnection {

    private MessageConnectionListener listener;
    private final List<Message> sent = new ArrayList<>();
    private boolean started;

    @Override
    public void setListener(MessageConnectionListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start() {
        started = true;
        requireListener().onConnectionOpen();
    }

    @Override
    public void stop() {
        started = false;
        requireListener().onConnectionClosed(1000, "stopped");
    }

    @Override
    public synchronized void send(Message message) {
        sent.add(Objects.requireNonNull(message, "message"));
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public boolean isStarted() {
        return started;
    }

    public void injectMessage(Message message) {
        requireListener().onMessage(message);
    }

    public void injectOpen() {
        requireListener().onConnectionOpen();
    }

    public void injectError(Throwable cause) {
        requireListener().onConnectionError(cause);
    }

    public void injectClose(int code, String reason) {
        requireListener().onConnectionClosed(code, reason);
    }

    public synchronized List<Message> sent() {
        return Collections.unmodifiableList(new ArrayList<>(sent));
    }

    public synchronized List<Message> sent(String event) {
        return sent.stream().filter(m -> m.event().equals(event)).collect(Collectors.toList());
    }

    private MessageConnectionListener requireListener() {
        if (listener == null) {
            throw new IllegalStateException("No listener installed");
        }
        return listener;
    }
}
