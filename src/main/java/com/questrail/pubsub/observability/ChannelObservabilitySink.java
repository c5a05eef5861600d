package com.questrail.pubsub.observability;

/**
 * Main interface for receiving channel observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks are invoked from the channel's serialized executor and must not block.</p>
 */
public interface ChannelObservabilitySink {
    /**
     * Called when a channel changes state.
     * @param event the transition event details
     */
    void onStateTransition(ChannelStateTransitionEvent event);

    /**
     * Called when a protocol-level event occurs (e.g. join timeout, rejoin, stale reply dropped).
     * @param event the protocol event
     */
    void onProtocolEvent(ChannelProtocolEvent event);

    /**
     * Called when an error surfaces on a channel or inside its executor.
     * @param event the error event
     */
    void onError(ChannelErrorEvent event);
}
