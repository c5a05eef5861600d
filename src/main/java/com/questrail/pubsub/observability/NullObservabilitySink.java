package com.questrail.pubsub.observability;

/**
 * No-op implementation of ChannelObservabilitySink.
 */
public final class NullObservabilitySink implements ChannelObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(ChannelStateTransitionEvent event) {}

    @Override
    public void onProtocolEvent(ChannelProtocolEvent event) {}

    @Override
    public void onError(ChannelErrorEvent event) {}
}
