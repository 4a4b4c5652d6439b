package com.livehub.hub;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.LockSupport;
import java.util.function.Consumer;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import reactor.core.Exceptions;
import reactor.core.publisher.BufferOverflowStrategy;
import reactor.core.publisher.Flux;
import reactor.core.publisher.SignalType;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Fan-out engine behind a hub: a multicast {@link Sinks.Many} fed by the single {@link Inlet}, with one
 * bounded delivery channel per consumer.
 * <p>
 * Each channel buffers up to {@link HubSettings#bufferSize()} elements and hands them to its consumer on
 * a scheduler, so a slow consumer fills its own buffer instead of pacing the producer; the
 * {@link OverflowPolicy} decides what a full buffer does. Only {@link OverflowPolicy#BLOCK_PRODUCER}
 * makes the producer wait.
 * <p>
 * A core whose last consumer detaches tears itself down. {@link BroadcastHub} prevents that by keeping a
 * {@link KeepAliveAnchor} subscribed for its whole lifetime.
 */
public class BroadcastCore<T> {

    private static final Logger log = LoggerFactory.getLogger(BroadcastCore.class);
    private static final Duration SERIALIZE_TIMEOUT = Duration.ofSeconds(5);
    private static final long BLOCKED_RETRY_NANOS = TimeUnit.MILLISECONDS.toNanos(1);

    private final HubSettings settings;
    private final Sinks.Many<T> sink;
    private final SubscriptionRegistry<T> registry = new SubscriptionRegistry<>();
    private final Object stateLock = new Object();
    private final AtomicReference<String> producer = new AtomicReference<>();
    private final AtomicReference<SubscriberOverflowException> pendingOverflow = new AtomicReference<>();
    private final LongAdder pushed = new LongAdder();
    private final LongAdder dropped = new LongAdder();
    private final CoreInlet inlet = new CoreInlet();

    private volatile HubState state = HubState.CREATED;
    private volatile HubSignal<T> terminalSignal;
    private volatile boolean anchored;

    public BroadcastCore(HubSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.sink = settings.overflowPolicy() == OverflowPolicy.BLOCK_PRODUCER
                ? Sinks.many().multicast().directAllOrNothing()
                : Sinks.many().multicast().directBestEffort();
    }

    /**
     * Hands the inlet to the one producer allowed to feed this core.
     *
     * @throws IllegalStateException if another producer already claimed it
     */
    public Inlet<T> claimInlet(String producerName) {
        Objects.requireNonNull(producerName, "producerName");
        if (!producer.compareAndSet(null, producerName)) {
            throw new IllegalStateException("Inlet of hub '" + name() + "' is already owned by " + producer.get());
        }
        log.info("EVENT=HUB_INLET_CLAIMED hub={} producer={}", name(), producerName);
        return inlet;
    }

    public Flux<HubSignal<T>> flux() {
        return flux(Schedulers.boundedElastic());
    }

    /**
     * Every subscription to the returned Flux attaches a new consumer channel that delivers on
     * {@code scheduler}; cancelling it detaches. The Flux completes when the hub completes and errors with
     * {@link HubFailedException} when it fails.
     */
    public Flux<HubSignal<T>> flux(Scheduler scheduler) {
        Objects.requireNonNull(scheduler, "scheduler");
        return Flux.defer(() -> deliveries(open(), scheduler));
    }

    public HubSubscription<T> attach(Consumer<HubSignal<T>> consumer) {
        return attach(consumer, Schedulers.boundedElastic());
    }

    /**
     * Attaches {@code consumer}, which receives elements and drop notices followed by exactly one
     * {@link HubSignal.Kind#COMPLETED} or {@link HubSignal.Kind#FAILED} signal, unless it detaches first.
     * A consumer that throws is detached; the hub and its other consumers carry on.
     */
    public HubSubscription<T> attach(Consumer<HubSignal<T>> consumer, Scheduler scheduler) {
        Objects.requireNonNull(consumer, "consumer");
        Objects.requireNonNull(scheduler, "scheduler");
        HubSubscription<T> subscription = open();
        deliveries(subscription, scheduler).subscribe(
                consumer,
                error -> {
                    if (error instanceof HubFailedException) {
                        deliverTerminal(subscription, consumer, HubSignal.failed(error));
                    } else {
                        log.warn("EVENT=HUB_CONSUMER_FAIL hub={} subscription={} reason={}",
                                name(), subscription.id(), error.getMessage(), error);
                    }
                },
                () -> {
                    if (!subscription.isDetachRequested()) {
                        deliverTerminal(subscription, consumer, HubSignal.completed());
                    }
                });
        return subscription;
    }

    /**
     * Owner-initiated end of stream. Unlike {@link Inlet#complete()} this is not a producer call and never
     * throws; it returns {@code false} when the core had already ended.
     */
    public boolean shutdown() {
        boolean completed = terminate(HubSignal.completed());
        if (completed) {
            log.info("EVENT=HUB_TEARDOWN hub={} pushed={}", name(), pushed.sum());
        }
        return completed;
    }

    public String name() {
        return settings.name();
    }

    public HubSettings settings() {
        return settings;
    }

    public HubState state() {
        return state;
    }

    public boolean isTerminated() {
        return terminalSignal != null;
    }

    public int subscriberCount() {
        return registry.size();
    }

    public long pushedCount() {
        return pushed.sum();
    }

    public long droppedCount() {
        return dropped.sum();
    }

    SubscriptionRegistry<T> registry() {
        return registry;
    }

    /**
     * Raw element feed for the keep-alive anchor. Once subscribed, the core no longer tears down when its
     * last consumer leaves.
     */
    Flux<T> anchorFeed() {
        return Flux.defer(() -> {
            synchronized (stateLock) {
                anchored = true;
                if (terminalSignal == null) {
                    state = HubState.RUNNING;
                }
            }
            return sink.asFlux();
        });
    }

    private HubSubscription<T> open() {
        HubSubscription<T> subscription = new HubSubscription<>(registry.nextId(), name(), settings.overflowPolicy());
        synchronized (stateLock) {
            if (terminalSignal == null) {
                registry.add(subscription);
                state = HubState.RUNNING;
            }
        }
        log.debug("EVENT=HUB_ATTACH hub={} subscription={} subscribers={}", name(), subscription.id(), registry.size());
        return subscription;
    }

    private Flux<HubSignal<T>> deliveries(HubSubscription<T> subscription, Scheduler scheduler) {
        HubSignal<T> terminal = terminalSignal;
        Flux<HubSignal<T>> signals;
        if (terminal != null) {
            log.debug("EVENT=HUB_LATE_ATTACH hub={} subscription={} state={}", name(), subscription.id(), state);
            signals = terminal.kind() == HubSignal.Kind.FAILED ? Flux.error(terminal.error()) : Flux.empty();
        } else if (settings.overflowPolicy() == OverflowPolicy.BLOCK_PRODUCER) {
            signals = sink.asFlux()
                    .publishOn(scheduler, settings.bufferSize())
                    .map(HubSignal::next);
        } else {
            signals = sink.asFlux()
                    .onBackpressureBuffer(settings.bufferSize(), element -> onOverflow(subscription), bufferStrategy())
                    .onErrorMap(Exceptions::isOverflow, error -> new HubFailedException(name(),
                            new SubscriberOverflowException(name(), subscription.id(), settings.bufferSize())))
                    // pending drops are claimed when an element leaves the buffer, not when it is delivered
                    .concatMap(element -> Flux.fromIterable(subscription.signalsFor(element)).subscribeOn(scheduler), 0)
                    .concatWith(Flux.<HubSignal<T>>defer(() -> Flux.fromIterable(subscription.pendingNotice())));
        }
        return signals
                .takeUntilOther(subscription.onDetach())
                .doFinally(signal -> release(subscription, signal));
    }

    private BufferOverflowStrategy bufferStrategy() {
        switch (settings.overflowPolicy()) {
            case DROP_OLDEST:
                return BufferOverflowStrategy.DROP_OLDEST;
            case DROP_NEWEST:
                return BufferOverflowStrategy.DROP_LATEST;
            default:
                return BufferOverflowStrategy.ERROR;
        }
    }

    // Runs on the pushing thread, inside the sink's emission; the hub is failed once the push returns.
    private void onOverflow(HubSubscription<T> subscription) {
        if (settings.overflowPolicy() == OverflowPolicy.FAIL_FAST) {
            pendingOverflow.compareAndSet(null,
                    new SubscriberOverflowException(name(), subscription.id(), settings.bufferSize()));
            return;
        }
        dropped.increment();
        subscription.recordDropped();
    }

    private void release(HubSubscription<T> subscription, SignalType signal) {
        subscription.markDetached();
        boolean removed;
        boolean idle;
        synchronized (stateLock) {
            removed = registry.remove(subscription);
            boolean cancelled = signal == SignalType.CANCEL || subscription.isDetachRequested();
            idle = removed && cancelled && !anchored && registry.isEmpty()
                    && terminalSignal == null && pendingOverflow.get() == null;
        }
        if (removed) {
            log.debug("EVENT=HUB_DETACH hub={} subscription={} signal={} subscribers={}",
                    name(), subscription.id(), signal, registry.size());
        }
        if (idle && terminate(HubSignal.completed())) {
            log.warn("EVENT=HUB_IDLE_TEARDOWN hub={} pushed={}", name(), pushed.sum());
        }
    }

    private void deliverTerminal(HubSubscription<T> subscription, Consumer<HubSignal<T>> consumer,
            HubSignal<T> signal) {
        try {
            consumer.accept(signal);
        } catch (RuntimeException ex) {
            log.warn("EVENT=HUB_CONSUMER_FAIL hub={} subscription={} signal={} reason={}",
                    name(), subscription.id(), signal.kind(), ex.getMessage(), ex);
        }
    }

    private void push(T element) {
        Objects.requireNonNull(element, "element");
        applyPendingOverflow();
        ensureOpen("push");
        pushed.increment();
        Sinks.EmitResult result = emit(() -> sink.tryEmitNext(element),
                settings.overflowPolicy() == OverflowPolicy.BLOCK_PRODUCER);
        if (result == Sinks.EmitResult.FAIL_NON_SERIALIZED) {
            throw new HubException(name(), "Push to hub '" + name() + "' could not be serialized within "
                    + SERIALIZE_TIMEOUT);
        }
        if (result.isFailure()) {
            log.debug("EVENT=HUB_PUSH_UNDELIVERED hub={} result={}", name(), result);
        }
        applyPendingOverflow();
    }

    private void complete() {
        applyPendingOverflow();
        if (!terminate(HubSignal.completed())) {
            throw new ProducerContractViolationException(name(), "complete", state);
        }
        log.info("EVENT=HUB_COMPLETED hub={} pushed={} dropped={}", name(), pushed.sum(), dropped.sum());
    }

    private void fail(Throwable error) {
        Objects.requireNonNull(error, "error");
        applyPendingOverflow();
        if (!terminate(HubSignal.failed(new HubFailedException(name(), error)))) {
            throw new ProducerContractViolationException(name(), "fail", state);
        }
        log.error("EVENT=HUB_FAILED hub={} reason={}", name(), error.getMessage(), error);
    }

    private void applyPendingOverflow() {
        SubscriberOverflowException overflow = pendingOverflow.getAndSet(null);
        if (overflow != null && terminate(HubSignal.failed(new HubFailedException(name(), overflow)))) {
            log.error("EVENT=HUB_OVERFLOW_FAIL_FAST hub={} subscription={} capacity={}",
                    name(), overflow.subscriptionId(), overflow.capacity());
        }
    }

    private void ensureOpen(String operation) {
        if (terminalSignal != null) {
            throw new ProducerContractViolationException(name(), operation, state);
        }
        if (state == HubState.CREATED) {
            synchronized (stateLock) {
                if (terminalSignal == null) {
                    state = HubState.RUNNING;
                }
            }
        }
    }

    private boolean terminate(HubSignal<T> signal) {
        synchronized (stateLock) {
            if (terminalSignal != null) {
                return false;
            }
            terminalSignal = signal;
            state = signal.kind() == HubSignal.Kind.COMPLETED ? HubState.COMPLETED : HubState.FAILED;
        }
        Supplier<Sinks.EmitResult> attempt;
        if (signal.kind() == HubSignal.Kind.COMPLETED) {
            attempt = sink::tryEmitComplete;
        } else {
            attempt = () -> sink.tryEmitError(signal.error());
        }
        Sinks.EmitResult result = emit(attempt, false);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_TERMINATED) {
            log.warn("EVENT=HUB_TERMINAL_UNDELIVERED hub={} signal={} result={}", name(), signal.kind(), result);
        }
        return true;
    }

    private Sinks.EmitResult emit(Supplier<Sinks.EmitResult> attempt, boolean mayBlock) {
        Sinks.EmitFailureHandler handler = new ProducerEmitFailureHandler(mayBlock);
        Sinks.EmitResult result = attempt.get();
        while (result.isFailure() && handler.onEmitFailure(SignalType.ON_NEXT, result)) {
            result = attempt.get();
        }
        return result;
    }

    /**
     * Retries emissions that collided with another thread, and under {@link OverflowPolicy#BLOCK_PRODUCER}
     * parks the producer while some channel has no room, until room appears or the hub terminates.
     */
    private final class ProducerEmitFailureHandler implements Sinks.EmitFailureHandler {

        private final Sinks.EmitFailureHandler serialization = Sinks.EmitFailureHandler.busyLooping(SERIALIZE_TIMEOUT);
        private final boolean mayBlock;
        private boolean blockedLogged;

        private ProducerEmitFailureHandler(boolean mayBlock) {
            this.mayBlock = mayBlock;
        }

        @Override
        public boolean onEmitFailure(SignalType signalType, Sinks.EmitResult emitResult) {
            if (emitResult == Sinks.EmitResult.FAIL_NON_SERIALIZED) {
                return serialization.onEmitFailure(signalType, emitResult);
            }
            if (emitResult != Sinks.EmitResult.FAIL_OVERFLOW || !mayBlock || terminalSignal != null) {
                return false;
            }
            if (!blockedLogged) {
                blockedLogged = true;
                log.debug("EVENT=HUB_PRODUCER_BLOCKED hub={} subscribers={}", name(), registry.size());
            }
            LockSupport.parkNanos(BLOCKED_RETRY_NANOS);
            if (Thread.currentThread().isInterrupted()) {
                throw new HubException(name(), "Interrupted while waiting for room in hub '" + name() + "'");
            }
            return true;
        }
    }

    private final class CoreInlet implements Inlet<T> {

        @Override
        public void push(T element) {
            BroadcastCore.this.push(element);
        }

        @Override
        public void complete() {
            BroadcastCore.this.complete();
        }

        @Override
        public void fail(Throwable error) {
            BroadcastCore.this.fail(error);
        }

        @Override
        public boolean isOpen() {
            return terminalSignal == null;
        }
    }
}
