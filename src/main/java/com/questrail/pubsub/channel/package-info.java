/**
 * Channels and pushes.
 *
 * <p>A {@link com.questrail.pubsub.channel.Channel} is one topic's membership on a
 * shared connection. A {@link com.questrail.pubsub.channel.Push} is one outbound
 * message whose reply is correlated by reference. Reserved event names live in
 * {@link com.questrail.pubsub.channel.ChannelEvents}.</p>
 */
package com.questrail.pubsub.channel;
