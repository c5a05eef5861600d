package com.questrail.pubsub.transport;

import com.questrail.pubsub.channel.Channel;
import com.questrail.pubsub.channel.ChannelEvents;
import com.questrail.pubsub.channel.Message;
import com.questrail.pubsub.channel.Push;
import com.questrail.pubsub.channel.WaiterConflictPolicy;
import com.questrail.pubsub.config.ChannelRuntimeConfig;
import com.questrail.pubsub.internal.time.SystemWallClock;
import com.questrail.pubsub.observability.RecordingObservabilitySink;
import com.questrail.pubsub.time.DeterministicScheduler;
import com.questrail.pubsub.time.ManualMonotonicClock;
import io.netty.util.concurrent.ImmediateEventExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ChannelMultiplexerTest
 * -----------------------------------------------------------------------------
 * Topic routing and connection lifecycle fan-out across several channels sharing
 * one fake connection.
 */
class ChannelMultiplexerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private RecordingObservabilitySink sink;
    private FakeMessageConnection connection;
    private ChannelMultiplexer multiplexer;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        sink = new RecordingObservabilitySink();
        connection = new FakeMessageConnection();
        multiplexer = new ChannelMultiplexer(
                connection,
                ChannelRuntimeConfig.builder()
                        .withDefaultTimeout(TIMEOUT)
                        .withWaiterConflictPolicy(WaiterConflictPolicy.FAIL_PREVIOUS)
                        .build(),
                ImmediateEventExecutor.INSTANCE,
                executor -> scheduler,
                clock,
                SystemWallClock.INSTANCE,
                sink);
        multiplexer.start();
    }

    private Channel joined(String topic) {
        Channel channel = multiplexer.channel(topic, Map.of());
        Push join = channel.join();
        connection.injectMessage(new Message(topic, ChannelEvents.REPLY,
                Map.of("status", "ok", "response", Map.of()), join.ref(), channel.joinRef()));
        assertTrue(channel.isJoined());
        return channel;
    }

    @Test
    void startOpensTheConnection() {
        assertTrue(connection.isStarted());
        assertTrue(multiplexer.isConnected());
    }

    @Test
    void channelsInheritDefaultsFromConfig() {
        Channel channel = multiplexer.channel("room:1", Map.of());

        assertEquals(TIMEOUT, channel.timeout());
        assertEquals(Duration.ofSeconds(2), multiplexer.channel("room:2", Map.of(), Duration.ofSeconds(2)).timeout());

        CompletableFuture<Message> first = channel.onPushReply("presence_state");
        channel.onPushReply("presence_state");
        assertTrue(first.isCompletedExceptionally());
    }

    @Test
    void sameTopicReturnsTheLiveChannelUntilItCloses() {
        Channel first = multiplexer.channel("room:1", Map.of());
        assertSame(first, multiplexer.channel("room:1", Map.of()));

        first.close();

        Channel second = multiplexer.channel("room:1", Map.of());
        assertNotSame(first, second);
        assertEquals(List.of(second), multiplexer.channels());
    }

    @Test
    void referencesAreUniqueAcrossChannels() {
        Push a = multiplexer.channel("room:1", Map.of()).join();
        Push b = multiplexer.channel("room:2", Map.of()).join();

        assertNotEquals(a.ref(), b.ref());
        assertEquals(2, connection.sent(ChannelEvents.JOIN).size());
    }

    @Test
    void closedChannelsReleaseTheirTopicRoute() {
        Channel first = multiplexer.channel("room:1", Map.of());
        multiplexer.channel("room:2", Map.of());
        assertEquals(Set.of("room:1", "room:2"), multiplexer.subscribedTopics());

        first.close();
        assertEquals(Set.of("room:2"), multiplexer.subscribedTopics());

        Channel again = multiplexer.channel("room:1", Map.of());
        List<Message> seen = new ArrayList<>();
        again.subscribe(seen::add);
        connection.injectMessage(new Message("room:1", "new_msg", Map.of(), null, null));

        assertEquals(1, seen.size());
        assertEquals(Set.of("room:1", "room:2"), multiplexer.subscribedTopics());
    }

    @Test
    void inboundMessagesAreRoutedByTopic() {
        Channel one = joined("room:1");
        Channel two = joined("room:2");
        List<Message> seenOne = new ArrayList<>();
        List<Message> seenTwo = new ArrayList<>();
        one.subscribe(seenOne::add);
        two.subscribe(seenTwo::add);

        connection.injectMessage(new Message("room:2", "new_msg", Map.of("body", "hi"), null, null));

        assertTrue(seenOne.isEmpty());
        assertEquals(1, seenTwo.size());
    }

    @Test
    void messageWithoutTopicIsReportedAndDropped() {
        connection.injectMessage(Message.of("new_msg", Map.of()));

        assertEquals(1, sink.getErrors().size());
    }

    @Test
    void connectionErrorThenOpenRejoinsWithoutCallerAction() {
        Channel channel = joined("room:1");

        connection.injectError(new IOException("reset"));

        assertTrue(channel.isErrored());
        assertFalse(multiplexer.isConnected());

        connection.injectOpen();

        assertTrue(channel.isJoining());
        assertEquals(2, connection.sent(ChannelEvents.JOIN).size());
    }

    @Test
    void connectionErrorDoesNotScheduleRejoin() {
        Channel channel = joined("room:1");

        connection.injectError(new IOException("reset"));
        scheduler.advanceAndRun(TIMEOUT.multipliedBy(3));

        assertTrue(channel.isErrored());
        assertEquals(1, connection.sent(ChannelEvents.JOIN).size());
    }

    @Test
    void connectionCloseErrorsEveryChannel() {
        Channel one = joined("room:1");
        Channel two = joined("room:2");
        List<Message> seen = new ArrayList<>();
        one.subscribe(seen::add);

        connection.injectClose(4000, "bye");

        assertTrue(one.isErrored());
        assertTrue(two.isErrored());
        assertEquals(ChannelEvents.ERROR, seen.get(0).event());
        assertEquals(4000, seen.get(0).payload().get("code"));
    }

    @Test
    void pushesWhileDisconnectedAreFlushedAfterRejoin() {
        Channel channel = joined("room:1");
        connection.injectClose(1006, null);

        channel.push("new_msg", Map.of("n", 1));
        assertTrue(connection.sent("new_msg").isEmpty());

        connection.injectOpen();
        Message rejoin = connection.sent(ChannelEvents.JOIN).get(1);
        connection.injectMessage(new Message("room:1", ChannelEvents.REPLY,
                Map.of("status", "ok"), rejoin.ref(), rejoin.joinRef()));

        List<Message> pushes = connection.sent("new_msg");
        assertEquals(1, pushes.size());
        assertEquals(rejoin.joinRef(), pushes.get(0).joinRef());
    }

    @Test
    void stopClosesChannelsAndTheConnection() {
        Channel channel = joined("room:1");

        multiplexer.stop();

        assertTrue(channel.isClosed());
        assertTrue(channel.isDisposed());
        assertTrue(multiplexer.channels().isEmpty());
        assertFalse(connection.isStarted());
    }
}
