package com.livehub.feed;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.livehub.hub.Inlet;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Replays a finite JSONL file of ticks into the hub and completes the inlet at end of file. Unlike a live
 * feed this source is replayable: starting another replay into a fresh hub yields the same sequence.
 */
public class JsonlReplayProducer implements FeedProducer {

    private static final Logger log = LoggerFactory.getLogger(JsonlReplayProducer.class);

    private final Path file;
    private final Duration delay;
    private final TickParser parser;
    private final Inlet<Tick> inlet;
    private final Scheduler scheduler;
    private final AtomicReference<Disposable> taskRef = new AtomicReference<>();
    private final LongAdder pushed = new LongAdder();

    public JsonlReplayProducer(FeedProperties properties, TickParser parser, Inlet<Tick> inlet) {
        this(properties.replayFile(), properties.resolvedReplayDelay(), parser, inlet, Schedulers.boundedElastic());
    }

    JsonlReplayProducer(Path file, Duration delay, TickParser parser, Inlet<Tick> inlet, Scheduler scheduler) {
        this.file = file;
        this.delay = delay;
        this.parser = parser;
        this.inlet = inlet;
        this.scheduler = scheduler;
    }

    @Override
    public String name() {
        return "replay";
    }

    @Override
    public void start() {
        if (file == null) {
            log.warn("EVENT=REPLAY_FEED_NO_FILE");
            return;
        }
        Flux<String> lines = Flux.using(() -> Files.lines(file), stream -> Flux.fromStream(stream), Stream::close)
                .subscribeOn(scheduler);
        if (!delay.isZero()) {
            lines = lines.delayElements(delay, scheduler);
        }
        Disposable task = lines
                .filter(line -> !line.isBlank())
                .subscribe(
                        this::pushLine,
                        this::failInlet,
                        this::completeInlet);
        if (!taskRef.compareAndSet(null, task)) {
            task.dispose();
            return;
        }
        log.info("EVENT=REPLAY_FEED_STARTED file={}", file);
    }

    @Override
    public void stop() {
        Disposable task = taskRef.getAndSet(null);
        if (task != null) {
            task.dispose();
        }
    }

    public long pushedCount() {
        return pushed.sum();
    }

    private void pushLine(String line) {
        parser.parse(line).ifPresent(tick -> {
            inlet.push(tick);
            pushed.increment();
        });
    }

    private void completeInlet() {
        log.info("EVENT=REPLAY_FEED_DONE file={} pushed={}", file, pushed.sum());
        if (inlet.isOpen()) {
            inlet.complete();
        }
    }

    private void failInlet(Throwable error) {
        log.error("EVENT=REPLAY_FEED_FAILED file={} message={}", file, error.getMessage(), error);
        if (inlet.isOpen()) {
            inlet.fail(error);
        }
    }
}
