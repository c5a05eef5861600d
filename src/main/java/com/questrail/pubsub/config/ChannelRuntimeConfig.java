package com.questrail.pubsub.config;

import com.questrail.pubsub.channel.WaiterConflictPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Aggregated configuration for a {@link com.questrail.pubsub.runtime.ChannelRuntime}.
 *
 * <ul>
 *   <li><b>defaultTimeout</b>: push timeout and rejoin spacing for channels created
 *       without their own timeout.</li>
 *   <li><b>executorThreads</b>: threads shared by all channel executors. Each
 *       channel is pinned to one of them.</li>
 *   <li><b>waiterConflictPolicy</b>: what happens to a reply waiter replaced by a
 *       newer one for the same event kind.</li>
 * </ul>
 */
public record ChannelRuntimeConfig(
    Duration defaultTimeout,
    int executorThreads,
    WaiterConflictPolicy waiterConflictPolicy
) {
    public ChannelRuntimeConfig {
        Objects.requireNonNull(defaultTimeout, "defaultTimeout");
        Objects.requireNonNull(waiterConflictPolicy, "waiterConflictPolicy");

        if (defaultTimeout.isNegative() || defaultTimeout.isZero()) {
            throw new IllegalArgumentException("defaultTimeout must be positive");
        }
        if (executorThreads < 1) {
            throw new IllegalArgumentException("executorThreads must be >= 1");
        }
    }

    /**
     * Defaults: 10s timeout, one executor thread, waiters replaced silently.
     */
    public static ChannelRuntimeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration defaultTimeout = Duration.ofSeconds(10);
        private int executorThreads = 1;
        private WaiterConflictPolicy waiterConflictPolicy = WaiterConflictPolicy.REPLACE;

        public Builder withDefaultTimeout(Duration timeout) {
            this.defaultTimeout = timeout;
            return this;
        }

        public Builder withExecutorThreads(int threads) {
            this.executorThreads = threads;
            return this;
        }

        public Builder withWaiterConflictPolicy(WaiterConflictPolicy policy) {
            this.waiterConflictPolicy = policy;
            return this;
        }

        public ChannelRuntimeConfig build() {
            return new ChannelRuntimeConfig(defaultTimeout, executorThreads, waiterConflictPolicy);
        }
    }
}
