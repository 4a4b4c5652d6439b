package com.livehub.feed;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.livehub.hub.Inlet;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Timer-driven random walk, one tick per symbol per interval. Useful without network access.
 */
public class SyntheticTickProducer implements FeedProducer {

    private static final Logger log = LoggerFactory.getLogger(SyntheticTickProducer.class);
    private static final double START_PRICE = 100.0;
    private static final double MAX_STEP = 0.002;

    private final FeedProperties properties;
    private final Inlet<Tick> inlet;
    private final Scheduler scheduler;
    private final Map<String, Double> lastPrices = new HashMap<>();
    private final AtomicReference<Disposable> taskRef = new AtomicReference<>();

    public SyntheticTickProducer(FeedProperties properties, Inlet<Tick> inlet) {
        this(properties, inlet, Schedulers.newSingle("synthetic-feed"));
    }

    SyntheticTickProducer(FeedProperties properties, Inlet<Tick> inlet, Scheduler scheduler) {
        this.properties = properties;
        this.inlet = inlet;
        this.scheduler = scheduler;
    }

    @Override
    public String name() {
        return "synthetic";
    }

    @Override
    public void start() {
        List<String> symbols = properties.resolvedSymbols();
        Disposable task = Flux.interval(properties.resolvedSyntheticInterval(), scheduler)
                .onBackpressureDrop()
                .takeWhile(tick -> inlet.isOpen())
                .subscribe(
                        tick -> emitRound(symbols),
                        ex -> log.error("EVENT=SYNTHETIC_FEED_ERROR message={}", ex.getMessage(), ex));
        if (!taskRef.compareAndSet(null, task)) {
            task.dispose();
            return;
        }
        log.info("EVENT=SYNTHETIC_FEED_STARTED symbols={} interval={}", symbols, properties.resolvedSyntheticInterval());
    }

    @Override
    public void stop() {
        Disposable task = taskRef.getAndSet(null);
        if (task != null) {
            task.dispose();
        }
        scheduler.dispose();
    }

    void emitRound(List<String> symbols) {
        long now = System.currentTimeMillis();
        for (String symbol : symbols) {
            double previous = lastPrices.getOrDefault(symbol, START_PRICE);
            double step = ThreadLocalRandom.current().nextDouble(-MAX_STEP, MAX_STEP);
            double price = Math.max(0.01, previous * (1.0 + step));
            lastPrices.put(symbol, price);
            double quantity = ThreadLocalRandom.current().nextDouble(0.01, 2.0);
            inlet.push(new Tick(symbol, price, quantity, now));
        }
    }
}
