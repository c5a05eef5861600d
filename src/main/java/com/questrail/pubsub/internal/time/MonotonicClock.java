package com.questrail.pubsub.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for channel timeouts and rejoin spacing.
 *
 * <h2>Binding invariant</h2>
 * Push timeouts and the rejoin timer MUST use a monotonic time source.
 * Wall-clock time (e.g. {@code Instant.now()}) is permitted only for observability.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     *
     * <p>
     * Values are only meaningful for elapsed time computations.
     * </p>
     */
    long nowNanos();
}
