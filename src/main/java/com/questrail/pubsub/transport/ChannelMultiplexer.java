package com.questrail.pubsub.transport;

import com.questrail.pubsub.channel.Channel;
import com.questrail.pubsub.channel.ChannelException;
import com.questrail.pubsub.channel.Message;
import com.questrail.pubsub.config.ChannelRuntimeConfig;
import com.questrail.pubsub.internal.exec.EventExecutorChannelExecutor;
import com.questrail.pubsub.internal.time.Cancellable;
import com.questrail.pubsub.internal.time.MonotonicClock;
import com.questrail.pubsub.internal.time.MonotonicScheduler;
import com.questrail.pubsub.internal.time.WallClock;
import com.questrail.pubsub.observability.ChannelErrorEvent;
import com.questrail.pubsub.observability.ChannelObservabilitySink;

import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.EventExecutorGroup;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * ChannelMultiplexer
 * =============================================================================
 * Shares one {@link MessageConnection} between many {@link Channel}s.
 *
 * <h2>Inbound path</h2>
 * <pre>
 *   MessageConnection
 *        → ChannelMultiplexer.onMessage  (route by topic)
 *            → Channel executor          (epoch filter, dispatch)
 * </pre>
 *
 * <h2>Outbound path</h2>
 * <pre>
 *   Push.send → ChannelMultiplexer.send → MessageConnection.send
 * </pre>
 *
 * <h2>Lifecycle</h2>
 * Connection errors and closes are wrapped into a {@link ChannelException} and
 * handed to every channel via {@link Channel#triggerError(ChannelException)} before
 * the matching broadcast goes out, so a rejoin timer armed by the error is cancelled
 * by the broadcast that follows it on the same channel executor.
 *
 * <h2>Explicit non-responsibilities</h2>
 * No reconnection, heartbeat or wire encoding; those belong to the connection.
 */
public final class ChannelMultiplexer implements ChannelTransport, MessageConnectionListener
{
    private final MessageConnection connection;
    private final ChannelRuntimeConfig config;
    private final EventExecutorGroup executorGroup;
    private final Function<EventExecutor, MonotonicScheduler> schedulerFactory;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final ChannelObservabilitySink observabilitySink;

    private final ConcurrentMap<String, Channel> channels = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Listeners<Message>> topicListeners = new ConcurrentHashMap<>();
    private final Listeners<TransportEvent.Error> errorListeners = new Listeners<>();
    private final Listeners<TransportEvent.Open> openListeners = new Listeners<>();
    private final AtomicLong refCounter = new AtomicLong(0);

    private volatile boolean connected;

    /**
     * @param schedulerFactory builds the timer scheduler for a channel pinned to the given executor
     */
    public ChannelMultiplexer(MessageConnection connection,
                              ChannelRuntimeConfig config,
                              EventExecutorGroup executorGroup,
                              Function<EventExecutor, MonotonicScheduler> schedulerFactory,
                              MonotonicClock clock,
                              WallClock wallClock,
                              ChannelObservabilitySink observabilitySink)
    {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.config = Objects.requireNonNull(config, "config");
        this.executorGroup = Objects.requireNonNull(executorGroup, "executorGroup");
        this.schedulerFactory = Objects.requireNonNull(schedulerFactory, "schedulerFactory");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");

        this.connection.setListener(this);
    }

    public void start() {
        connection.start();
    }

    /**
     * Closes every channel, then the connection.
     */
    public void stop() {
        for (Channel channel : channels.values()) {
            channel.close();
        }
        connection.stop();
    }

    /**
     * Returns the live channel for the topic, creating it when there is none.
     * A disposed channel is replaced by a new instance.
     */
    public Channel channel(String topic, Map<String, Object> parameters) {
        return channel(topic, parameters, null);
    }

    public Channel channel(String topic, Map<String, Object> parameters, Duration timeout) {
        Objects.requireNonNull(topic, "topic");
        return channels.compute(topic, (t, existing) ->
                existing != null && !existing.isDisposed()
                        ? existing
                        : newChannel(t, parameters, timeout));
    }

    public List<Channel> channels() {
        return List.copyOf(channels.values());
    }

    Set<String> subscribedTopics() {
        return Set.copyOf(topicListeners.keySet());
    }

    private Channel newChannel(String topic, Map<String, Object> parameters, Duration timeout) {
        EventExecutor executor = executorGroup.next();
        return Channel.builder(this, topic)
                .withParameters(parameters)
                .withTimeout(timeout)
                .withExecutor(new EventExecutorChannelExecutor(executor, topic, observabilitySink, wallClock))
                .withScheduler(schedulerFactory.apply(executor))
                .withClock(clock)
                .withWallClock(wallClock)
                .withObservabilitySink(observabilitySink)
                .withWaiterConflictPolicy(config.waiterConflictPolicy())
                .build();
    }

    // -------------------------------------------------------------------------
    // ChannelTransport
    // -------------------------------------------------------------------------

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public Duration defaultTimeout() {
        return config.defaultTimeout();
    }

    @Override
    public String nextRef() {
        return Long.toString(refCounter.incrementAndGet());
    }

    @Override
    public Cancellable subscribeTopic(String topic, Consumer<Message> listener) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(listener, "listener");
        AtomicReference<Cancellable> registration = new AtomicReference<>();
        topicListeners.compute(topic, (t, listeners) -> {
            Listeners<Message> target = listeners != null ? listeners : new Listeners<>();
            registration.set(target.add(listener));
            return target;
        });
        return () -> {
            boolean cancelled = registration.get().cancel();
            // Drop the topic entry once its last listener is gone.
            topicListeners.computeIfPresent(topic, (t, listeners) -> listeners.isEmpty() ? null : listeners);
            return cancelled;
        };
    }

    @Override
    public Cancellable subscribeErrors(Consumer<TransportEvent.Error> listener) {
        return errorListeners.add(listener);
    }

    @Override
    public Cancellable subscribeOpen(Consumer<TransportEvent.Open> listener) {
        return openListeners.add(listener);
    }

    @Override
    public void removeChannel(Channel channel) {
        channels.remove(channel.topic(), channel);
    }

    @Override
    public void send(Message message) {
        connection.send(message);
    }

    // -------------------------------------------------------------------------
    // MessageConnectionListener
    // -------------------------------------------------------------------------

    @Override
    public void onConnectionOpen() {
        connected = true;
        openListeners.dispatch(new TransportEvent.Open(wallClock.now()));
    }

    @Override
    public void onConnectionError(Throwable cause) {
        connected = false;
        TransportEvent.Error error = new TransportEvent.Error(wallClock.now(), cause);
        ChannelException exception = ChannelException.transportError(error);
        for (Channel channel : channels.values()) {
            channel.triggerError(exception);
        }
        errorListeners.dispatch(error);
    }

    @Override
    public void onConnectionClosed(int code, String reason) {
        connected = false;
        ChannelException exception = ChannelException.transportClosed(
                new TransportEvent.Close(wallClock.now(), code, reason));
        for (Channel channel : channels.values()) {
            channel.triggerError(exception);
        }
    }

    @Override
    public void onMessage(Message message) {
        Objects.requireNonNull(message, "message");
        if (message.topic() == null) {
            observabilitySink.onError(new ChannelErrorEvent(
                    wallClock.now(), null, "Dropped inbound message without topic: " + message.event(), null));
            return;
        }
        Listeners<Message> listeners = topicListeners.get(message.topic());
        if (listeners != null) {
            listeners.dispatch(message);
        }
    }

    /**
     * Listener list whose registrations cancel by identity.
     */
    private static final class Listeners<T> {
        private final List<Registration> registrations = new CopyOnWriteArrayList<>();

        Cancellable add(Consumer<T> listener) {
            Registration registration = new Registration(Objects.requireNonNull(listener, "listener"));
            registrations.add(registration);
            return registration;
        }

        boolean isEmpty() {
            return registrations.isEmpty();
        }

        void dispatch(T event) {
            for (Registration registration : registrations) {
                registration.listener.accept(event);
            }
        }

        private final class Registration implements Cancellable {
            private final Consumer<T> listener;

            private Registration(Consumer<T> listener) {
                this.listener = listener;
            }

            @Override
            public boolean cancel() {
                return registrations.remove(this);
            }
        }
    }
}
