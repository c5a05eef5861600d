package com.questrail.pubsub.channel;

import com.questrail.pubsub.internal.time.Cancellable;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Push
 * =============================================================================
 * One outbound message on a {@link Channel}, awaiting a status-correlated reply.
 *
 * <h2>Correlation</h2>
 * On first send the push allocates a reference from the transport and registers a
 * waiter on its channel for {@link ChannelEvents#replyFor(String) the reply kind}
 * of that reference. The first matching reply, or a synthesized {@code timeout}
 * response when none arrives in time, completes {@link #future()} and invokes the
 * callback registered for the response status.
 *
 * <h2>Threading</h2>
 * All mutable state is confined to the owning channel's executor. Public mutators
 * re-enter that executor; {@link #onReply(String, Consumer)} and
 * {@link #future()} may be used from any thread.
 *
 * <h2>Abandonment</h2>
 * {@link #reset()} and {@link #cancelTimeout()} never invoke a callback. A push
 * abandoned by a channel close keeps an incomplete future.
 */
public final class Push {

    private final Channel channel;
    private final String event;
    private final Map<String, Object> payload;
    private final Map<String, Consumer<PushResponse>> receivers = new ConcurrentHashMap<>();
    private final Map<String, Consumer<PushResponse>> bindings = new ConcurrentHashMap<>();
    private final CompletableFuture<PushResponse> future = new CompletableFuture<>();

    private volatile Duration timeout;
    private volatile String ref;

    // Written only on the channel executor.
    private CompletableFuture<Message> replyWaiter;
    private volatile PushResponse received;
    private volatile boolean sent;
    private Cancellable timeoutHandle;
    private long armSequence;

    Push(Channel channel, String event, Map<String, Object> payload, Duration timeout) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.event = Objects.requireNonNull(event, "event");
        this.payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    public Channel channel() {
        return channel;
    }

    public String event() {
        return event;
    }

    public Map<String, Object> payload() {
        return payload;
    }

    public Duration timeout() {
        return timeout;
    }

    /**
     * Completes with the first response this push receives, or exceptionally with a
     * {@link ChannelException} when the channel errors while the reply is pending.
     */
    public CompletableFuture<PushResponse> future() {
        return future;
    }

    /**
     * Correlation reference, allocated from the transport on first use.
     */
    public synchronized String ref() {
        if (ref == null) {
            ref = channel.transport().nextRef();
        }
        return ref;
    }

    /**
     * Event kind the reply to this push arrives under.
     */
    public String replyEvent() {
        return ChannelEvents.replyFor(ref());
    }

    public boolean isSent() {
        return sent;
    }

    public Optional<PushResponse> received() {
        return Optional.ofNullable(received);
    }

    public boolean hasReceived(String status) {
        PushResponse r = received;
        return r != null && r.status().equals(status);
    }

    /**
     * Registers the callback for one reply status, replacing any earlier callback for
     * the same status.
     */
    public Push onReply(String status, Consumer<PushResponse> callback) {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(callback, "callback");
        receivers.put(status, callback);
        return this;
    }

    public void send() {
        channel.execute(this::sendNow);
    }

    public void resend(Duration newTimeout) {
        channel.execute(() -> resendNow(newTimeout));
    }

    public void trigger(PushResponse response) {
        Objects.requireNonNull(response, "response");
        channel.execute(() -> triggerNow(response));
    }

    public void cancelTimeout() {
        channel.execute(this::cancelTimeoutNow);
    }

    public void reset() {
        channel.execute(this::resetNow);
    }

    // -------------------------------------------------------------------------
    // Executor-confined implementation
    // -------------------------------------------------------------------------

    String currentRef() {
        return ref;
    }

    void sendNow() {
        if (hasReceived(PushResponse.TIMEOUT)) {
            return;
        }
        startTimeout();
        sent = true;
        channel.transport().send(new Message(channel.topic(), event, payload, ref(), channel.joinRef()));
    }

    void resendNow(Duration newTimeout) {
        if (newTimeout != null) {
            timeout = newTimeout;
        }
        resetNow();
        sendNow();
    }

    void triggerNow(PushResponse response) {
        cancelTimeoutNow();
        releaseReplyWaiter();
        received = response;
        future.complete(response);

        Consumer<PushResponse> binding = bindings.get(response.status());
        if (binding != null) {
            binding.accept(response);
        }
        Consumer<PushResponse> callback = receivers.get(response.status());
        if (callback != null) {
            callback.accept(response);
        }
    }

    /**
     * Channel-owned handler for a status. Kept apart from {@link #onReply} callbacks
     * so callers cannot displace the channel's own join and leave handling.
     */
    void bindReply(String status, Consumer<PushResponse> handler) {
        bindings.put(status, handler);
    }

    void cancelTimeoutNow() {
        // Bumping the sequence neutralizes a firing that already raced past cancel().
        armSequence++;
        Cancellable handle = timeoutHandle;
        if (handle != null) {
            handle.cancel();
            timeoutHandle = null;
        }
    }

    void resetNow() {
        cancelTimeoutNow();
        releaseReplyWaiter();
        synchronized (this) {
            ref = null;
        }
        received = null;
        sent = false;
    }

    /**
     * Unregisters the pending reply waiter, so a reply arriving after a manual
     * trigger or a reset finds nothing to complete.
     */
    private void releaseReplyWaiter() {
        CompletableFuture<Message> waiter = replyWaiter;
        if (waiter != null) {
            replyWaiter = null;
            channel.dropWaiter(ChannelEvents.replyFor(ref), waiter);
        }
    }

    private void startTimeout() {
        if (replyWaiter == null) {
            CompletableFuture<Message> waiter = channel.onPushReply(replyEvent());
            replyWaiter = waiter;
            waiter.whenComplete((message, error) -> onWaiterCompleted(waiter, message, error));
        }

        cancelTimeoutNow();
        long seq = armSequence;
        timeoutHandle = channel.schedule(timeout, () -> onTimeout(seq));
    }

    private void onWaiterCompleted(CompletableFuture<Message> waiter, Message message, Throwable error) {
        if (waiter != replyWaiter) {
            return;
        }
        replyWaiter = null;
        if (message != null) {
            triggerNow(PushResponse.fromMessage(message));
        }
        else {
            cancelTimeoutNow();
            future.completeExceptionally(error);
        }
    }

    private void onTimeout(long seq) {
        if (seq != armSequence || timeoutHandle == null) {
            return;
        }
        timeoutHandle = null;

        Map<String, Object> reply = new LinkedHashMap<>();
        reply.put("status", PushResponse.TIMEOUT);
        reply.put("response", Map.of());
        channel.triggerNow(new Message(channel.topic(), replyEvent(), reply, ref(), channel.joinRef()));
    }

    @Override
    public String toString() {
        return "Push[" + event + ", ref=" + ref + ", topic=" + channel.topic() + "]";
    }
}
