package com.questrail.pubsub.runtime;

import com.questrail.pubsub.channel.Channel;
import com.questrail.pubsub.config.ChannelRuntimeConfig;
import com.questrail.pubsub.internal.time.MonotonicClock;
import com.questrail.pubsub.internal.time.ScheduledExecutorScheduler;
import com.questrail.pubsub.internal.time.SystemMonotonicClock;
import com.questrail.pubsub.internal.time.SystemWallClock;
import com.questrail.pubsub.internal.time.WallClock;
import com.questrail.pubsub.observability.ChannelObservabilitySink;
import com.questrail.pubsub.observability.NullObservabilitySink;
import com.questrail.pubsub.transport.ChannelMultiplexer;
import com.questrail.pubsub.transport.MessageConnection;

import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutorGroup;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * ChannelRuntime
 * =============================================================================
 * Composition root and lifecycle owner for channels over one connection.
 *
 * <p>The runtime owns a Netty {@link EventExecutorGroup}. Each channel is pinned to
 * one executor of the group, which serializes its operations and also runs its
 * push timeouts and rejoin timer.</p>
 */
public final class ChannelRuntime {
    private final ChannelMultiplexer multiplexer;
    private final EventExecutorGroup executorGroup;

    private ChannelRuntime(ChannelMultiplexer multiplexer, EventExecutorGroup executorGroup) {
        this.multiplexer = multiplexer;
        this.executorGroup = executorGroup;
    }

    public void start() {
        multiplexer.start();
    }

    /**
     * Closes all channels, stops the connection and shuts the executor group down.
     */
    public void stop() {
        multiplexer.stop();
        executorGroup.shutdownGracefully(0, 5, TimeUnit.SECONDS);
        try {
            if (!executorGroup.awaitTermination(5, TimeUnit.SECONDS)) {
                executorGroup.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorGroup.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public Channel channel(String topic, Map<String, Object> parameters) {
        return multiplexer.channel(topic, parameters);
    }

    public Channel channel(String topic, Map<String, Object> parameters, Duration timeout) {
        return multiplexer.channel(topic, parameters, timeout);
    }

    public ChannelMultiplexer multiplexer() {
        return multiplexer;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private MessageConnection connection;
        private ChannelRuntimeConfig config = ChannelRuntimeConfig.defaults();
        private ChannelObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        public Builder withConnection(MessageConnection connection) {
            this.connection = connection;
            return this;
        }

        public Builder withConfig(ChannelRuntimeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(ChannelObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public ChannelRuntime build() {
            Objects.requireNonNull(connection, "connection");
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");

            EventExecutorGroup group = new DefaultEventExecutorGroup(
                    config.executorThreads(),
                    new DefaultThreadFactory("pubsub-channel", true));

            MonotonicClock schedulerClock = clock;
            ChannelMultiplexer multiplexer = new ChannelMultiplexer(
                    connection,
                    config,
                    group,
                    executor -> new ScheduledExecutorScheduler(executor, schedulerClock),
                    clock,
                    wallClock,
                    observabilitySink);

            return new ChannelRuntime(multiplexer, group);
        }
    }
}
