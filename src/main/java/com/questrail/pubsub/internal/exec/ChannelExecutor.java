package com.questrail.pubsub.internal.exec;

/**
 * ChannelExecutor
 * =============================================================================
 * Serialized execution context owned by one channel.
 *
 * <h2>Threading Model</h2>
 * Every public channel operation, timer firing and transport callback for a channel
 * is funneled through its executor. Tasks never run concurrently with each other,
 * so channel state needs no locking. Many channels may share one underlying
 * thread; they never share an executor's ordering guarantees across channels.
 *
 * <h2>Failure interception</h2>
 * A task that throws must not take the executor down. Implementations report the
 * failure and continue with the next task.
 */
public interface ChannelExecutor
{
    /**
     * Returns {@code true} if the calling thread is the one this executor runs tasks on.
     */
    boolean inContext();

    /**
     * Runs the task inline if already {@link #inContext() in context}, otherwise
     * enqueues it behind previously submitted tasks.
     */
    void execute(Runnable task);
}
