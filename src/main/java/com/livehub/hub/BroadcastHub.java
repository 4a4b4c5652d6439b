package com.livehub.hub;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

/**
 * A {@link BroadcastCore} kept alive by a {@link KeepAliveAnchor} attached before any real subscriber.
 * Subscribers come and go freely; the hub ends only when its producer completes or fails it, or when the
 * owner calls {@link #shutdown()}.
 */
public class BroadcastHub<T> {

    private static final Logger log = LoggerFactory.getLogger(BroadcastHub.class);

    private final BroadcastCore<T> core;
    private final KeepAliveAnchor<T> anchor;
    private final AtomicBoolean shutdown = new AtomicBoolean();

    public BroadcastHub(HubSettings settings) {
        this.core = new BroadcastCore<>(settings);
        this.anchor = new KeepAliveAnchor<>(core);
        log.info("EVENT=HUB_CREATED hub={} bufferSize={} overflowPolicy={}",
                settings.name(), settings.bufferSize(), settings.overflowPolicy());
    }

    public Inlet<T> claimInlet(String producerName) {
        return core.claimInlet(producerName);
    }

    public HubSubscription<T> attach(Consumer<HubSignal<T>> consumer) {
        return core.attach(consumer);
    }

    public HubSubscription<T> attach(Consumer<HubSignal<T>> consumer, Scheduler scheduler) {
        return core.attach(consumer, scheduler);
    }

    /**
     * Each subscription to the returned Flux attaches a fresh consumer channel delivering on the
     * bounded-elastic scheduler; cancelling it detaches.
     */
    public Flux<HubSignal<T>> flux() {
        return core.flux();
    }

    public Flux<HubSignal<T>> flux(Scheduler scheduler) {
        return core.flux(scheduler);
    }

    /**
     * Completes the stream for every attached subscription and releases the anchor. Idempotent.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        boolean completedByOwner = core.shutdown();
        anchor.release();
        log.info("EVENT=HUB_SHUTDOWN hub={} completedByOwner={} anchorDiscarded={}",
                name(), completedByOwner, anchor.discarded());
    }

    public String name() {
        return core.name();
    }

    public HubSettings settings() {
        return core.settings();
    }

    public HubState state() {
        return core.state();
    }

    public int subscriberCount() {
        return core.subscriberCount();
    }

    public boolean isAnchored() {
        return anchor.isAttached();
    }

    public HubStatus status() {
        HubSettings settings = core.settings();
        return new HubStatus(
                settings.name(),
                core.state(),
                core.subscriberCount(),
                core.pushedCount(),
                core.droppedCount(),
                anchor.discarded(),
                settings.bufferSize(),
                settings.overflowPolicy());
    }
}
