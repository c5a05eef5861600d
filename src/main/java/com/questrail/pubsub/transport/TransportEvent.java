package com.questrail.pubsub.transport;

import java.time.Instant;
import java.util.Objects;

/**
 * TransportEvent
 * -----------------------------------------------------------------------------
 * Connection lifecycle events broadcast by a {@link ChannelTransport}.
 *
 * These describe the health of the shared connection, not the state of any
 * single channel.
 */
public sealed interface TransportEvent
        permits TransportEvent.Open, TransportEvent.Error, TransportEvent.Close
{
    /**
     * Time at which the event was observed. Observational only.
     */
    Instant timestamp();

    /** Connection became usable. */
    record Open(Instant timestamp) implements TransportEvent {
        public Open {
            Objects.requireNonNull(timestamp, "timestamp");
        }
    }

    /** Connection reported a failure. */
    record Error(Instant timestamp, Throwable cause) implements TransportEvent {
        public Error {
            Objects.requireNonNull(timestamp, "timestamp");
        }
    }

    /** Connection was closed, orderly or not. */
    record Close(Instant timestamp, int code, String reason) implements TransportEvent {
        public Close {
            Objects.requireNonNull(timestamp, "timestamp");
        }
    }
}
