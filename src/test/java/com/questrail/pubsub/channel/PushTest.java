package com.questrail.pubsub.channel;

import com.questrail.pubsub.internal.exec.EventExecutorChannelExecutor;
import com.questrail.pubsub.internal.time.SystemWallClock;
import com.questrail.pubsub.observability.NullObservabilitySink;
import com.questrail.pubsub.time.DeterministicScheduler;
import com.questrail.pubsub.time.ManualMonotonicClock;
import com.questrail.pubsub.transport.FakeChannelTransport;
import io.netty.util.concurrent.ImmediateEventExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PushTest
 * -----------------------------------------------------------------------------
 * Reply correlation and timeout behaviour of a single push on a joined channel.
 */
class PushTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final String TOPIC = "room:lobby";

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private FakeChannelTransport transport;
    private Channel channel;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        transport = new FakeChannelTransport(TIMEOUT);
        channel = Channel.builder(transport, TOPIC)
                .withExecutor(new EventExecutorChannelExecutor(
                        ImmediateEventExecutor.INSTANCE, TOPIC, NullObservabilitySink.INSTANCE, SystemWallClock.INSTANCE))
                .withScheduler(scheduler)
                .withClock(clock)
                .build();

        channel.join();
        Message join = transport.lastSent();
        transport.deliver(new Message(TOPIC, ChannelEvents.REPLY,
                Map.of("status", "ok", "response", Map.of()), join.ref(), join.joinRef()));
        assertTrue(channel.isJoined());
        transport.clear();
    }

    private void replyTo(Push push, Map<String, Object> payload) {
        transport.deliver(new Message(TOPIC, ChannelEvents.REPLY, payload, push.ref(), channel.joinRef()));
    }

    @Test
    void okReplyCompletesFutureAndInvokesCallback() {
        List<PushResponse> callbacks = new ArrayList<>();
        Push push = channel.push("new_msg", Map.of("body", "hi"))
                .onReply(PushResponse.OK, callbacks::add);

        replyTo(push, Map.of("status", "ok", "response", Map.of("id", 42)));

        PushResponse response = push.future().getNow(null);
        assertTrue(response.isOk());
        assertEquals(42, response.response().get("id"));
        assertEquals(List.of(response), callbacks);
        assertTrue(push.hasReceived(PushResponse.OK));
    }

    @Test
    void replyWithoutStatusIsTreatedAsError() {
        List<PushResponse> errors = new ArrayList<>();
        Push push = channel.push("new_msg", Map.of()).onReply(PushResponse.ERROR, errors::add);

        replyTo(push, Map.of("response", Map.of("reason", "unmatched")));

        assertEquals(1, errors.size());
        assertTrue(push.future().getNow(null).isError());
    }

    @Test
    void laterCallbackForSameStatusReplacesEarlierOne() {
        List<String> calls = new ArrayList<>();
        Push push = channel.push("new_msg", Map.of())
                .onReply(PushResponse.OK, r -> calls.add("first"))
                .onReply(PushResponse.OK, r -> calls.add("second"));

        replyTo(push, Map.of("status", "ok"));

        assertEquals(List.of("second"), calls);
    }

    @Test
    void refIsAllocatedOnceAndStampedOnTheMessage() {
        Push push = channel.push("new_msg", Map.of());

        String ref = push.ref();
        assertEquals(ref, push.ref());
        assertEquals(ChannelEvents.replyFor(ref), push.replyEvent());

        Message sent = transport.lastSent();
        assertEquals(ref, sent.ref());
        assertEquals(channel.joinRef(), sent.joinRef());
    }

    @Test
    void payloadIsCapturedAtCreation() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("body", "before");

        Push push = channel.push("new_msg", payload);
        payload.put("body", "after");

        assertEquals("before", push.payload().get("body"));
        assertEquals("before", transport.lastSent().payload().get("body"));
        assertThrows(UnsupportedOperationException.class, () -> push.payload().put("x", 1));
    }

    @Test
    void missingReplySynthesizesTimeoutVisibleOnTheStream() {
        List<Message> seen = new ArrayList<>();
        channel.subscribe(seen::add);
        List<PushResponse> timeouts = new ArrayList<>();
        Push push = channel.push("new_msg", Map.of()).onReply(PushResponse.TIMEOUT, timeouts::add);

        scheduler.advanceAndRun(TIMEOUT.minusMillis(1));
        assertFalse(push.future().isDone());

        scheduler.advanceAndRun(Duration.ofMillis(1));
        assertTrue(push.future().getNow(null).isTimeout());
        assertEquals(1, timeouts.size());

        Message synthesized = seen.get(seen.size() - 1);
        assertEquals(push.replyEvent(), synthesized.event());
        assertEquals(PushResponse.TIMEOUT, synthesized.payload().get("status"));
    }

    @Test
    void replyAfterTimeoutIsIgnored() {
        Push push = channel.push("new_msg", Map.of());
        String ref = push.ref();
        scheduler.advanceAndRun(TIMEOUT);

        transport.deliver(new Message(TOPIC, ChannelEvents.REPLY,
                Map.of("status", "ok"), ref, channel.joinRef()));

        assertTrue(push.future().getNow(null).isTimeout());
    }

    @Test
    void timedOutPushIsNotSentAgain() {
        Push push = channel.push("new_msg", Map.of());
        scheduler.advanceAndRun(TIMEOUT);
        transport.clear();

        push.send();

        assertTrue(transport.sent().isEmpty());
    }

    @Test
    void perPushTimeoutOverridesChannelTimeout() {
        Push push = channel.push("new_msg", Map.of(), Duration.ofSeconds(1));

        scheduler.advanceAndRun(Duration.ofSeconds(1));

        assertTrue(push.hasReceived(PushResponse.TIMEOUT));
    }

    @Test
    void cancelTimeoutLeavesThePushPending() {
        Push push = channel.push("new_msg", Map.of());

        push.cancelTimeout();
        scheduler.advanceAndRun(TIMEOUT.multipliedBy(2));

        assertFalse(push.future().isDone());
        replyTo(push, Map.of("status", "ok"));
        assertTrue(push.future().getNow(null).isOk());
    }

    @Test
    void resendAllocatesAFreshReference() {
        Push push = channel.push("new_msg", Map.of());
        String firstRef = push.ref();

        push.resend(Duration.ofSeconds(2));

        assertNotEquals(firstRef, push.ref());
        assertEquals(Duration.ofSeconds(2), push.timeout());
        assertEquals(2, transport.sent("new_msg").size());

        // A reply to the abandoned reference no longer matches.
        transport.deliver(new Message(TOPIC, ChannelEvents.REPLY, Map.of("status", "ok"), firstRef, channel.joinRef()));
        assertFalse(push.future().isDone());

        scheduler.advanceAndRun(Duration.ofSeconds(2));
        assertTrue(push.hasReceived(PushResponse.TIMEOUT));
    }

    @Test
    void resetClearsReferenceAndReceivedState() {
        Push push = channel.push("new_msg", Map.of());
        replyTo(push, Map.of("status", "ok"));
        assertTrue(push.received().isPresent());

        push.reset();

        assertTrue(push.received().isEmpty());
        assertFalse(push.isSent());
    }

    @Test
    void manualTriggerReleasesTheReplyWaiter() {
        List<PushResponse> callbacks = new ArrayList<>();
        Push push = channel.push("new_msg", Map.of())
                .onReply(PushResponse.OK, callbacks::add)
                .onReply(PushResponse.ERROR, callbacks::add);

        push.trigger(PushResponse.ok());
        replyTo(push, Map.of("status", "error"));

        assertEquals(1, callbacks.size());
        assertTrue(push.hasReceived(PushResponse.OK));

        scheduler.advanceAndRun(TIMEOUT);
        assertTrue(push.hasReceived(PushResponse.OK));
    }

    @Test
    void futureKeepsTheFirstResponse() {
        Push push = channel.push("new_msg", Map.of());

        push.trigger(PushResponse.ok());
        push.trigger(new PushResponse(PushResponse.ERROR, Map.of()));

        assertTrue(push.future().getNow(null).isOk());
        assertTrue(push.hasReceived(PushResponse.ERROR));
    }
}
