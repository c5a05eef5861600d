package com.questrail.pubsub.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Cancellation handle shared by scheduled timers and transport subscriptions.
 *
 * <p>
 * Channels hold several of these at once (push timeouts, the rejoin timer, the
 * three transport subscriptions) and release all of them on close. Implementations
 * include:
 * <ul>
 *   <li>a deterministic test scheduler</li>
 *   <li>a JVM {@code ScheduledExecutorService}-backed scheduler</li>
 *   <li>listener registrations on a transport</li>
 * </ul>
 * </p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task or subscription.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         was already executed or previously cancelled.
     */
    boolean cancel();
}
