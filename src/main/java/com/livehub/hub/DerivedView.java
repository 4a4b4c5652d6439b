package com.livehub.hub;

import java.util.Objects;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Shares one transformation among many readers by nesting hubs: the stage is the single subscriber of the
 * upstream hub and the only producer of its own downstream hub, which consumers attach to.
 */
public final class DerivedView<T, R> {

    private static final Logger log = LoggerFactory.getLogger(DerivedView.class);

    private final BroadcastHub<T> upstream;
    private final BroadcastHub<R> hub;
    private final LongAdder upstreamDropped = new LongAdder();
    private final Disposable pipeline;

    private DerivedView(BroadcastHub<T> upstream, HubSettings settings, Function<Flux<T>, Flux<R>> stage,
            Scheduler scheduler) {
        this.upstream = upstream;
        this.hub = new BroadcastHub<>(settings);
        Inlet<R> inlet = hub.claimInlet("view:" + upstream.name());
        Flux<T> elements = upstream.flux(scheduler)
                .doOnNext(this::recordDropped)
                .filter(HubSignal::isElement)
                .map(HubSignal::element);
        this.pipeline = stage.apply(elements).subscribe(
                inlet::push,
                error -> {
                    if (inlet.isOpen()) {
                        inlet.fail(error);
                    }
                },
                () -> {
                    if (inlet.isOpen()) {
                        inlet.complete();
                    }
                });
        log.info("EVENT=VIEW_ATTACHED upstream={} view={}", upstream.name(), settings.name());
    }

    public static <T, R> DerivedView<T, R> attach(BroadcastHub<T> upstream, HubSettings settings,
            Function<Flux<T>, Flux<R>> stage) {
        return attach(upstream, settings, stage, Schedulers.boundedElastic());
    }

    /**
     * Runs {@code stage} on {@code scheduler}, fed by a single subscription to {@code upstream}.
     */
    public static <T, R> DerivedView<T, R> attach(BroadcastHub<T> upstream, HubSettings settings,
            Function<Flux<T>, Flux<R>> stage, Scheduler scheduler) {
        Objects.requireNonNull(upstream, "upstream");
        Objects.requireNonNull(stage, "stage");
        Objects.requireNonNull(scheduler, "scheduler");
        return new DerivedView<>(upstream, settings, stage, scheduler);
    }

    public BroadcastHub<R> hub() {
        return hub;
    }

    public BroadcastHub<T> upstream() {
        return upstream;
    }

    public long upstreamDropped() {
        return upstreamDropped.sum();
    }

    public void close() {
        pipeline.dispose();
        hub.shutdown();
        log.info("EVENT=VIEW_CLOSED upstream={} view={}", upstream.name(), hub.name());
    }

    private void recordDropped(HubSignal<T> signal) {
        if (signal.isDropped()) {
            upstreamDropped.add(signal.droppedCount());
            log.warn("EVENT=VIEW_UPSTREAM_DROPPED upstream={} view={} count={}",
                    upstream.name(), hub.name(), signal.droppedCount());
        }
    }
}
