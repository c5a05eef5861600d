package com.questrail.pubsub.channel;

import com.questrail.pubsub.internal.time.Cancellable;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Broadcast stream of the messages a channel publishes.
 *
 * <p>Listeners are invoked synchronously on the channel's executor, in subscription
 * order. A listener that throws is reported through the failure handler and does
 * not prevent delivery to the others. Once closed, the stream drops its listeners
 * and ignores further publications and subscriptions.</p>
 */
public final class ChannelEventStream {

    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final Consumer<RuntimeException> failureHandler;
    private volatile boolean closed;

    ChannelEventStream(Consumer<RuntimeException> failureHandler) {
        this.failureHandler = Objects.requireNonNull(failureHandler, "failureHandler");
    }

    public Cancellable subscribe(Consumer<Message> listener) {
        Objects.requireNonNull(listener, "listener");
        Subscription subscription = new Subscription(listener);
        if (closed) {
            return subscription;
        }
        subscriptions.add(subscription);
        return subscription;
    }

    public boolean isClosed() {
        return closed;
    }

    void publish(Message message) {
        if (closed) {
            return;
        }
        for (Subscription subscription : subscriptions) {
            try {
                subscription.listener.accept(message);
            } catch (RuntimeException e) {
                failureHandler.accept(e);
            }
        }
    }

    void close() {
        closed = true;
        subscriptions.clear();
    }

    private final class Subscription implements Cancellable {
        private final Consumer<Message> listener;

        private Subscription(Consumer<Message> listener) {
            this.listener = listener;
        }

        @Override
        public boolean cancel() {
            return subscriptions.remove(this);
        }
    }
}
