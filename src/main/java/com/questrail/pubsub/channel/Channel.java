package com.questrail.pubsub.channel;

import com.questrail.pubsub.internal.exec.ChannelExecutor;
import com.questrail.pubsub.internal.time.Cancellable;
import com.questrail.pubsub.internal.time.MonotonicClock;
import com.questrail.pubsub.internal.time.MonotonicScheduler;
import com.questrail.pubsub.internal.time.SystemMonotonicClock;
import com.questrail.pubsub.internal.time.SystemWallClock;
import com.questrail.pubsub.internal.time.WallClock;
import com.questrail.pubsub.observability.ChannelErrorEvent;
import com.questrail.pubsub.observability.ChannelObservabilitySink;
import com.questrail.pubsub.observability.ChannelProtocolEvent;
import com.questrail.pubsub.observability.ChannelStateTransitionEvent;
import com.questrail.pubsub.observability.NullObservabilitySink;
import com.questrail.pubsub.transport.ChannelTransport;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Channel
 * =============================================================================
 * One topic multiplexed over a shared {@link ChannelTransport}: its join/leave
 * lifecycle, its outbound pushes and its automatic recovery.
 *
 * <h2>State machine</h2>
 * <pre>
 *   CLOSED  --join()-----------------&gt; JOINING --ok reply--&gt; JOINED
 *   JOINING | JOINED --error/timeout--&gt; ERRORED
 *   ERRORED --rejoin timer / open----&gt; JOINING
 *   JOINING | JOINED | ERRORED --leave()--&gt; LEAVING --ok/timeout--&gt; CLOSED
 * </pre>
 * A channel that has been closed (by a completed leave, a {@code phx_close} for its
 * topic, or {@link #close()}) is disposed: it ignores every further state-changing
 * operation and cannot be joined again.
 *
 * <h2>Join epochs</h2>
 * Every join attempt uses a fresh join {@link Push}; the reference of the latest
 * attempt is the join epoch. Lifecycle and status messages stamped with a different
 * epoch belong to a superseded attempt and are dropped before dispatch.
 *
 * <h2>Threading Model</h2>
 * All state changes, timer firings and transport callbacks run on the channel's
 * {@link ChannelExecutor}. Public operations called from another thread are queued
 * on it; preconditions ({@link #join()} twice, pushing before join) are checked
 * synchronously on the calling thread.
 */
public final class Channel {

    private final ChannelTransport transport;
    private final String topic;
    private final Map<String, Object> parameters;
    private final ChannelExecutor executor;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final ChannelObservabilitySink observabilitySink;
    private final WaiterConflictPolicy waiterConflictPolicy;
    private final ChannelEventStream stream;

    private final AtomicBoolean joinedOnce = new AtomicBoolean(false);
    private final List<Cancellable> subscriptions = new ArrayList<>();
    private final List<Push> pushBuffer = new CopyOnWriteArrayList<>();

    private volatile Duration timeout;
    private volatile ChannelState state = ChannelState.CLOSED;
    private volatile boolean disposed;
    private volatile Push joinPush;
    private volatile String reference;

    // Confined to the channel executor.
    private final Map<String, CompletableFuture<Message>> waiters = new HashMap<>();
    private Cancellable rejoinTimer;
    private long rejoinSequence;

    private Channel(Builder builder) {
        this.transport = builder.transport;
        this.topic = builder.topic;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameters));
        this.executor = builder.executor;
        this.scheduler = builder.scheduler;
        this.clock = builder.clock;
        this.wallClock = builder.wallClock;
        this.observabilitySink = builder.observabilitySink;
        this.waiterConflictPolicy = builder.waiterConflictPolicy;
        this.timeout = builder.timeout != null ? builder.timeout : transport.defaultTimeout();
        this.stream = new ChannelEventStream(e -> reportError("Channel listener failed", e));
    }

    public static Builder builder(ChannelTransport transport, String topic) {
        return new Builder(transport, topic);
    }

    // -------------------------------------------------------------------------
    // Accessors
    // -------------------------------------------------------------------------

    public String topic() {
        return topic;
    }

    public Map<String, Object> parameters() {
        return parameters;
    }

    public Duration timeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = requireTimeout(timeout);
    }

    public ChannelState state() {
        return state;
    }

    public boolean isClosed() {
        return state == ChannelState.CLOSED;
    }

    public boolean isErrored() {
        return state == ChannelState.ERRORED;
    }

    public boolean isJoined() {
        return state == ChannelState.JOINED;
    }

    public boolean isJoining() {
        return state == ChannelState.JOINING;
    }

    public boolean isLeaving() {
        return state == ChannelState.LEAVING;
    }

    /**
     * {@code true} once the channel has been closed; a disposed channel cannot be reused.
     */
    public boolean isDisposed() {
        return disposed;
    }

    public boolean canPush() {
        return transport.isConnected() && isJoined();
    }

    /**
     * Current join epoch, or {@code null} when no join attempt is live.
     */
    public String joinRef() {
        Push current = joinPush;
        return current == null ? null : current.currentRef();
    }

    /**
     * The join push of the latest attempt, or {@code null} before {@link #join()}.
     */
    public Push joinPush() {
        return joinPush;
    }

    /**
     * Channel-level reference, allocated from the transport on first use.
     */
    public synchronized String reference() {
        if (reference == null) {
            reference = transport.nextRef();
        }
        return reference;
    }

    /**
     * Pushes created while the channel could not send, in creation order.
     */
    public List<Push> pendingPushes() {
        return List.copyOf(pushBuffer);
    }

    public ChannelTransport transport() {
        return transport;
    }

    /**
     * Subscribes to the channel's broadcast stream of inbound and derived messages.
     */
    public Cancellable subscribe(Consumer<Message> listener) {
        return stream.subscribe(listener);
    }

    public ChannelEventStream messages() {
        return stream;
    }

    // -------------------------------------------------------------------------
    // Public operations
    // -------------------------------------------------------------------------

    public Push join() {
        return join(null);
    }

    /**
     * Joins the topic. May be called once per channel.
     *
     * @param newTimeout replaces the channel timeout when non-null
     * @return the join push of the first attempt
     * @throws IllegalStateException on a second call
     */
    public Push join(Duration newTimeout) {
        if (newTimeout != null) {
            requireTimeout(newTimeout);
        }
        if (!joinedOnce.compareAndSet(false, true)) {
            throw new IllegalStateException("join() called more than once on channel " + topic);
        }
        if (newTimeout != null) {
            timeout = newTimeout;
        }

        Push attempt = newJoinPush();
        executor.execute(() -> attemptJoin(attempt));
        return attempt;
    }

    public Push push(String eventName, Map<String, Object> payload) {
        return pushEvent(eventName, payload, null);
    }

    public Push push(String eventName, Map<String, Object> payload, Duration newTimeout) {
        return pushEvent(eventName, payload, newTimeout);
    }

    /**
     * Sends an event on the channel, or buffers it until the channel is joined.
     *
     * @throws IllegalStateException if {@link #join()} was never called
     */
    public Push pushEvent(String event, Map<String, Object> payload, Duration newTimeout) {
        Objects.requireNonNull(event, "event");
        if (!joinedOnce.get()) {
            throw new IllegalStateException("Cannot push '" + event + "' before joining channel " + topic);
        }

        Push push = new Push(this, event, payload, newTimeout != null ? requireTimeout(newTimeout) : timeout);
        executor.execute(() -> {
            if (disposed) {
                push.future().completeExceptionally(
                        ChannelException.channelEvent(event, "Channel " + topic + " is closed"));
                return;
            }
            if (canPush()) {
                push.sendNow();
            }
            else {
                pushBuffer.add(push);
                protocolEvent(ChannelProtocolEvent.Kind.PUSH_BUFFERED, event);
            }
        });
        return push;
    }

    public Push leave() {
        return leave(null);
    }

    /**
     * Leaves the topic. The returned push completes {@code ok} once the server
     * acknowledges, immediately when there is nothing to leave, or {@code timeout};
     * either outcome closes the channel.
     */
    public Push leave(Duration newTimeout) {
        Push leavePush = new Push(this, ChannelEvents.LEAVE, Map.of(),
                newTimeout != null ? requireTimeout(newTimeout) : timeout);
        executor.execute(() -> leaveNow(leavePush));
        return leavePush;
    }

    /**
     * Closes the channel: cancels timers and transport subscriptions, closes the
     * broadcast stream, drops waiters and deregisters from the transport. Idempotent.
     */
    public void close() {
        executor.execute(this::closeNow);
    }

    /**
     * Publishes a message on the channel stream, which also feeds inbound dispatch.
     * Ignored once the channel is closed.
     */
    public void trigger(Message message) {
        Objects.requireNonNull(message, "message");
        executor.execute(() -> triggerNow(message));
    }

    /**
     * Moves the channel to {@code ERRORED} because of a transport failure.
     * No-op while already errored, leaving or closed.
     */
    public void triggerError(ChannelException error) {
        Objects.requireNonNull(error, "error");
        executor.execute(() -> triggerErrorNow(error));
    }

    /**
     * Returns a future completed by the next message of the given kind.
     *
     * <p>Only one waiter per kind is kept; see {@link WaiterConflictPolicy} for what
     * happens to a waiter that is replaced.</p>
     */
    public CompletableFuture<Message> onPushReply(String replyEvent) {
        Objects.requireNonNull(replyEvent, "replyEvent");
        CompletableFuture<Message> waiter = new CompletableFuture<>();
        executor.execute(() -> registerWaiter(replyEvent, waiter));
        return waiter;
    }

    // -------------------------------------------------------------------------
    // Package-private hooks used by Push
    // -------------------------------------------------------------------------

    void execute(Runnable task) {
        executor.execute(task);
    }

    Cancellable schedule(Duration delay, Runnable task) {
        return scheduler.scheduleAfter(delay, clock, () -> executor.execute(task));
    }

    void dropWaiter(String replyEvent, CompletableFuture<Message> waiter) {
        waiters.remove(replyEvent, waiter);
    }

    void triggerNow(Message message) {
        if (!disposed) {
            onMessage(message);
        }
    }

    // -------------------------------------------------------------------------
    // Transport binding
    // -------------------------------------------------------------------------

    private void bindTransport() {
        subscriptions.add(transport.subscribeTopic(topic,
                message -> executor.execute(() -> onTransportMessage(message))));
        subscriptions.add(transport.subscribeErrors(
                event -> executor.execute(this::onTransportError)));
        subscriptions.add(transport.subscribeOpen(
                event -> executor.execute(this::onTransportOpen)));
    }

    private void onTransportMessage(Message message) {
        if (disposed) {
            return;
        }
        if (!isMember(message)) {
            protocolEvent(ChannelProtocolEvent.Kind.STALE_MESSAGE_DROPPED,
                    message.event() + " joinRef=" + message.joinRef());
            return;
        }
        onMessage(message);
    }

    private void onTransportError() {
        if (!disposed) {
            // A rejoin over a dead link cannot succeed; the open broadcast restarts it.
            cancelRejoinTimer();
        }
    }

    private void onTransportOpen() {
        if (disposed) {
            return;
        }
        cancelRejoinTimer();
        if (state == ChannelState.ERRORED) {
            attemptJoin(newJoinPush());
        }
    }

    private boolean isMember(Message message) {
        String epoch = message.joinRef();
        return epoch == null
                || epoch.isEmpty()
                || !ChannelEvents.isStatus(message.event())
                || epoch.equals(joinRef());
    }

    // -------------------------------------------------------------------------
    // Inbound dispatch
    // -------------------------------------------------------------------------

    private void onMessage(Message message) {
        stream.publish(message);

        CompletableFuture<Message> waiter = waiters.remove(message.event());

        switch (message.event()) {
            case ChannelEvents.CLOSE -> {
                cancelRejoinTimer();
                closeNow();
            }
            case ChannelEvents.ERROR -> onErrorEvent();
            case ChannelEvents.REPLY -> {
                if (message.ref() != null) {
                    onMessage(message.asReplyEvent());
                }
            }
            default -> {
            }
        }

        if (waiter != null) {
            waiter.complete(message);
        }
    }

    private void onErrorEvent() {
        // Only a joining or joined channel can fail; joining stays caller-initiated.
        if (!joinedOnce.get() || (state != ChannelState.JOINING && state != ChannelState.JOINED)) {
            return;
        }
        if (state == ChannelState.JOINING && joinPush != null) {
            joinPush.resetNow();
        }
        transition(ChannelState.ERRORED);
        if (transport.isConnected()) {
            startRejoinTimer();
        }
    }

    private void registerWaiter(String replyEvent, CompletableFuture<Message> waiter) {
        if (disposed) {
            waiter.completeExceptionally(
                    ChannelException.channelEvent(replyEvent, "Channel " + topic + " is closed"));
            return;
        }

        CompletableFuture<Message> previous = waiters.put(replyEvent, waiter);
        if (previous != null && previous != waiter) {
            protocolEvent(ChannelProtocolEvent.Kind.WAITER_REPLACED, replyEvent);
            if (waiterConflictPolicy == WaiterConflictPolicy.FAIL_PREVIOUS) {
                previous.completeExceptionally(
                        ChannelException.channelEvent(replyEvent, "Waiter replaced for " + replyEvent));
            }
        }

        // A caller may complete or cancel the future itself; release the slot if so.
        waiter.whenComplete((message, error) -> executor.execute(() -> waiters.remove(replyEvent, waiter)));
    }

    // -------------------------------------------------------------------------
    // Join / leave / error
    // -------------------------------------------------------------------------

    private Push newJoinPush() {
        return new Push(this, ChannelEvents.JOIN, parameters, timeout);
    }

    private void attemptJoin(Push attempt) {
        if (disposed || state == ChannelState.LEAVING) {
            return;
        }

        transition(ChannelState.JOINING);

        Push previous = joinPush;
        if (previous != null && previous != attempt) {
            previous.resetNow();
        }
        joinPush = attempt;

        attempt.bindReply(PushResponse.OK, response -> {
            if (attempt == joinPush) {
                onJoinOk();
            }
        });
        attempt.bindReply(PushResponse.ERROR, response -> {
            if (attempt == joinPush) {
                onJoinError(response);
            }
        });
        attempt.bindReply(PushResponse.TIMEOUT, response -> {
            if (attempt == joinPush) {
                onJoinTimeout(attempt);
            }
        });

        attempt.resendNow(timeout);
        protocolEvent(ChannelProtocolEvent.Kind.JOIN_SENT, "ref=" + attempt.currentRef());
    }

    private void onJoinOk() {
        transition(ChannelState.JOINED);
        cancelRejoinTimer();
        protocolEvent(ChannelProtocolEvent.Kind.JOIN_OK, "ref=" + joinRef());

        List<Push> buffered = new ArrayList<>(pushBuffer);
        pushBuffer.clear();
        for (Push push : buffered) {
            push.sendNow();
        }
        if (!buffered.isEmpty()) {
            protocolEvent(ChannelProtocolEvent.Kind.BUFFER_FLUSHED, buffered.size() + " push(es)");
        }
    }

    private void onJoinError(PushResponse response) {
        protocolEvent(ChannelProtocolEvent.Kind.JOIN_ERROR, String.valueOf(response.response()));
        transition(ChannelState.ERRORED);
        if (transport.isConnected()) {
            startRejoinTimer();
        }
    }

    private void onJoinTimeout(Push attempt) {
        protocolEvent(ChannelProtocolEvent.Kind.JOIN_TIMEOUT, "after " + attempt.timeout());

        // Best effort: tell the server to drop the attempt it may still be processing.
        new Push(this, ChannelEvents.LEAVE, Map.of(), timeout).sendNow();

        attempt.resetNow();
        transition(ChannelState.ERRORED);
        if (transport.isConnected()) {
            startRejoinTimer();
        }
    }

    private void leaveNow(Push leavePush) {
        if (disposed) {
            leavePush.triggerNow(PushResponse.ok());
            return;
        }

        Push current = joinPush;
        if (current != null) {
            current.cancelTimeoutNow();
        }
        cancelRejoinTimer();

        boolean wasJoined = state == ChannelState.JOINED;
        transition(ChannelState.LEAVING);

        Consumer<PushResponse> onClose = this::onLeaveCompleted;
        leavePush.bindReply(PushResponse.OK, onClose);
        leavePush.bindReply(PushResponse.TIMEOUT, onClose);

        if (!transport.isConnected() || !wasJoined) {
            leavePush.triggerNow(PushResponse.ok());
        }
        else {
            leavePush.sendNow();
            protocolEvent(ChannelProtocolEvent.Kind.LEAVE_SENT, "ref=" + leavePush.currentRef());
        }
    }

    private void onLeaveCompleted(PushResponse response) {
        protocolEvent(ChannelProtocolEvent.Kind.LEAVE_COMPLETED, response.status());
        triggerNow(new Message(topic, ChannelEvents.CLOSE, Map.of("ok", "leave"), null, null));
    }

    private void triggerErrorNow(ChannelException error) {
        if (disposed
                || state == ChannelState.ERRORED
                || state == ChannelState.LEAVING
                || state == ChannelState.CLOSED) {
            return;
        }

        stream.publish(error.message());
        reportError(error.getMessage(), error);

        List<CompletableFuture<Message>> pending = new ArrayList<>(waiters.values());
        waiters.clear();
        for (CompletableFuture<Message> waiter : pending) {
            waiter.completeExceptionally(error);
        }

        boolean wasJoining = state == ChannelState.JOINING;
        transition(ChannelState.ERRORED);
        if (wasJoining && joinPush != null) {
            joinPush.resetNow();
        }
        if (transport.isConnected()) {
            startRejoinTimer();
        }
    }

    private void closeNow() {
        if (disposed) {
            return;
        }
        disposed = true;
        transition(ChannelState.CLOSED);

        for (Push push : pushBuffer) {
            push.cancelTimeoutNow();
        }
        pushBuffer.clear();

        Push current = joinPush;
        if (current != null) {
            current.cancelTimeoutNow();
        }
        cancelRejoinTimer();

        for (Cancellable subscription : subscriptions) {
            subscription.cancel();
        }
        subscriptions.clear();

        stream.close();
        waiters.clear();

        protocolEvent(ChannelProtocolEvent.Kind.CLOSED, "");
        transport.removeChannel(this);
    }

    // -------------------------------------------------------------------------
    // Rejoin timer
    // -------------------------------------------------------------------------

    private void startRejoinTimer() {
        cancelRejoinTimer();

        long seq = rejoinSequence;
        Duration delay = timeout;
        rejoinTimer = schedule(delay, () -> onRejoinTimer(seq));
        protocolEvent(ChannelProtocolEvent.Kind.REJOIN_SCHEDULED, "in " + delay);
    }

    private void onRejoinTimer(long seq) {
        if (seq != rejoinSequence || disposed) {
            return;
        }
        rejoinTimer = null;
        if (transport.isConnected()) {
            attemptJoin(newJoinPush());
        }
    }

    private void cancelRejoinTimer() {
        rejoinSequence++;
        Cancellable timer = rejoinTimer;
        if (timer != null) {
            timer.cancel();
            rejoinTimer = null;
            protocolEvent(ChannelProtocolEvent.Kind.REJOIN_CANCELLED, "");
        }
    }

    // -------------------------------------------------------------------------
    // Observability
    // -------------------------------------------------------------------------

    private void transition(ChannelState next) {
        ChannelState previous = state;
        state = next;
        observabilitySink.onStateTransition(
                new ChannelStateTransitionEvent(wallClock.now(), topic, previous, next));
    }

    private void protocolEvent(ChannelProtocolEvent.Kind kind, String detail) {
        observabilitySink.onProtocolEvent(new ChannelProtocolEvent(wallClock.now(), topic, kind, detail));
    }

    private void reportError(String message, Throwable cause) {
        observabilitySink.onError(new ChannelErrorEvent(wallClock.now(), topic, message, cause));
    }

    private static Duration requireTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative");
        }
        return timeout;
    }

    @Override
    public String toString() {
        return "Channel[" + topic + ", " + state + "]";
    }

    // -------------------------------------------------------------------------
    // Builder
    // -------------------------------------------------------------------------

    public static final class Builder {
        private final ChannelTransport transport;
        private final String topic;
        private Map<String, Object> parameters = Map.of();
        private Duration timeout;
        private ChannelExecutor executor;
        private MonotonicScheduler scheduler;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private ChannelObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private WaiterConflictPolicy waiterConflictPolicy = WaiterConflictPolicy.REPLACE;

        private Builder(ChannelTransport transport, String topic) {
            this.transport = Objects.requireNonNull(transport, "transport");
            this.topic = Objects.requireNonNull(topic, "topic");
        }

        public Builder withParameters(Map<String, Object> parameters) {
            this.parameters = parameters == null ? Map.of() : parameters;
            return this;
        }

        public Builder withTimeout(Duration timeout) {
            this.timeout = timeout == null ? null : requireTimeout(timeout);
            return this;
        }

        public Builder withExecutor(ChannelExecutor executor) {
            this.executor = executor;
            return this;
        }

        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withObservabilitySink(ChannelObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withWaiterConflictPolicy(WaiterConflictPolicy policy) {
            this.waiterConflictPolicy = policy;
            return this;
        }

        /**
         * Builds the channel and binds its transport subscriptions.
         */
        public Channel build() {
            Objects.requireNonNull(executor, "executor");
            Objects.requireNonNull(scheduler, "scheduler");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(waiterConflictPolicy, "waiterConflictPolicy");

            Channel channel = new Channel(this);
            channel.bindTransport();
            return channel;
        }
    }
}
