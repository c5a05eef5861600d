package com.questrail.pubsub.internal.exec;

import com.questrail.pubsub.internal.time.WallClock;
import com.questrail.pubsub.observability.ChannelErrorEvent;
import com.questrail.pubsub.observability.ChannelObservabilitySink;

import io.netty.util.concurrent.EventExecutor;

import java.util.Objects;

/**
 * EventExecutorChannelExecutor
 * =============================================================================
 * {@link ChannelExecutor} backed by a Netty {@link EventExecutor}.
 *
 * <p>A Netty event executor is single-threaded, so submission order is execution
 * order. It is also a {@code ScheduledExecutorService}; the runtime builds the
 * channel's timer scheduler on the same executor.</p>
 *
 * <p>Netty types do not escape this package except through the runtime that
 * creates the executor group.</p>
 */
public final class EventExecutorChannelExecutor implements ChannelExecutor
{
    private final EventExecutor executor;
    private final String topic;
    private final ChannelObservabilitySink observabilitySink;
    private final WallClock wallClock;

    public EventExecutorChannelExecutor(EventExecutor executor,
                                        String topic,
                                        ChannelObservabilitySink observabilitySink,
                                        WallClock wallClock)
    {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.topic = Objects.requireNonNull(topic, "topic");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    @Override
    public boolean inContext()
    {
        return executor.inEventLoop();
    }

    @Override
    public void execute(Runnable task)
    {
        Objects.requireNonNull(task, "task");
        if (executor.inEventLoop()) {
            runGuarded(task);
        }
        else {
            executor.execute(() -> runGuarded(task));
        }
    }

    private void runGuarded(Runnable task)
    {
        try {
            task.run();
        } catch (RuntimeException e) {
            observabilitySink.onError(new ChannelErrorEvent(
                    wallClock.now(),
                    topic,
                    "Channel task failed",
                    e));
        }
    }
}
