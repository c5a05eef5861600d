/**
 * Channel Transport Boundary
 * =============================================================================
 *
 * <p>Channels never talk to a socket. They see the shared connection only through
 * {@link com.questrail.pubsub.transport.ChannelTransport}: a connectivity flag, a
 * default timeout, a reference counter, per-topic inbound routing, and error and
 * open broadcasts.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   MessageConnection        (framing, encoding, reconnect; not in this library)
 *        → ChannelMultiplexer  (topic routing, lifecycle broadcasts)
 *            → Channel         (join state machine, pushes)
 * </pre>
 *
 * <p>The wire encoding of {@link com.questrail.pubsub.channel.Message} is left to the
 * {@link com.questrail.pubsub.transport.MessageConnection} implementation.</p>
 */
package com.questrail.pubsub.transport;
