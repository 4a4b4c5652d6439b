package com.livehub.hub;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Handle on one consumer's live delivery channel from a hub.
 * <p>
 * Elements reach the consumer through a bounded buffer owned by the channel. When a drop policy discards
 * elements, the next signal the consumer receives is a {@link HubSignal.Kind#DROPPED} notice carrying
 * the number lost since the previous notice.
 */
public class HubSubscription<T> {

    private static final Logger log = LoggerFactory.getLogger(HubSubscription.class);
    private static final long DROP_WARN_INTERVAL_MS = 30000L;

    private final long id;
    private final String hubName;
    private final OverflowPolicy overflowPolicy;
    private final Sinks.Empty<Void> detachSignal = Sinks.empty();
    private final AtomicLong pendingDrops = new AtomicLong();
    private final AtomicLong droppedTotal = new AtomicLong();
    private final AtomicLong lastDropWarnMs = new AtomicLong();

    private volatile boolean detachRequested;
    private volatile boolean detached;

    HubSubscription(long id, String hubName, OverflowPolicy overflowPolicy) {
        this.id = id;
        this.hubName = hubName;
        this.overflowPolicy = overflowPolicy;
    }

    public long id() {
        return id;
    }

    public String hubName() {
        return hubName;
    }

    /**
     * Stops delivery to this consumer without touching the hub or its other subscriptions. Idempotent.
     */
    public void detach() {
        detachRequested = true;
        detachSignal.tryEmitEmpty();
    }

    public boolean isDetached() {
        return detached;
    }

    public long droppedCount() {
        return droppedTotal.get();
    }

    boolean isDetachRequested() {
        return detachRequested;
    }

    Mono<Void> onDetach() {
        return detachSignal.asMono();
    }

    void markDetached() {
        detached = true;
    }

    void recordDropped() {
        pendingDrops.incrementAndGet();
        droppedTotal.incrementAndGet();
        long now = System.currentTimeMillis();
        long lastWarn = lastDropWarnMs.get();
        if (now - lastWarn >= DROP_WARN_INTERVAL_MS && lastDropWarnMs.compareAndSet(lastWarn, now)) {
            log.warn("EVENT=HUB_SUBSCRIPTION_DROPPED hub={} subscription={} policy={} droppedTotal={}",
                    hubName, id, overflowPolicy, droppedTotal.get());
        }
    }

    List<HubSignal<T>> signalsFor(T element) {
        long dropped = pendingDrops.getAndSet(0L);
        if (dropped == 0L) {
            return List.of(HubSignal.next(element));
        }
        return List.of(HubSignal.dropped(dropped), HubSignal.next(element));
    }

    List<HubSignal<T>> pendingNotice() {
        long dropped = pendingDrops.getAndSet(0L);
        return dropped == 0L ? List.of() : List.of(HubSignal.dropped(dropped));
    }
}
