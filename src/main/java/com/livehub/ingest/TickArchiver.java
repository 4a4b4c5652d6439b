package com.livehub.ingest;

import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.livehub.feed.Tick;
import com.livehub.hub.BroadcastHub;
import com.livehub.hub.HubSignal;

import reactor.core.Disposable;

/**
 * Hub consumer that archives the live tick stream: ticks are collected into batches bounded by size and
 * time, and every batch goes through {@link BatchIngestionService}.
 * <p>
 * Batches are pulled only as fast as the store takes them. A store that falls behind leaves ticks in the
 * archiver's hub subscription, where the hub's overflow policy applies and drops are logged.
 */
public class TickArchiver {

	private static final Logger LOGGER = LoggerFactory.getLogger(TickArchiver.class);
	static final String DESTINATION = "ticks";

	private final BroadcastHub<Tick> tickHub;
	private final BatchIngestionService ingestionService;
	private final BatchWriter<Tick> writer;
	private final IngestionProperties properties;
	private final AtomicReference<Disposable> subscriptionRef = new AtomicReference<>();

	public TickArchiver(BroadcastHub<Tick> tickHub, BatchIngestionService ingestionService, BatchWriter<Tick> writer,
			IngestionProperties properties) {
		this.tickHub = tickHub;
		this.ingestionService = ingestionService;
		this.writer = writer;
		this.properties = properties;
	}

	public void start() {
		if (subscriptionRef.get() != null) {
			return;
		}
		Disposable subscription = tickHub.flux()
				.doOnNext(signal -> {
					if (signal.isDropped()) {
						LOGGER.warn("EVENT=ARCHIVE_TICKS_DROPPED hub={} count={}", tickHub.name(), signal.droppedCount());
					}
				})
				.filter(HubSignal::isElement)
				.map(HubSignal::element)
				.bufferTimeout(properties.resolvedBatchSize(), properties.resolvedArchiveFlushInterval(), true)
				.concatMap(batch -> ingestionService.ingest(DESTINATION, batch, writer))
				.subscribe(
						report -> {
							if (!report.isComplete()) {
								LOGGER.warn("EVENT=ARCHIVE_INCOMPLETE records={} written={}", report.totalRecords(),
										report.writtenRecords());
							}
						},
						error -> LOGGER.error("EVENT=ARCHIVE_FAILED hub={} message={}", tickHub.name(),
								error.getMessage(), error),
						() -> LOGGER.info("EVENT=ARCHIVE_DONE hub={}", tickHub.name()));
		if (!subscriptionRef.compareAndSet(null, subscription)) {
			subscription.dispose();
			return;
		}
		LOGGER.info("EVENT=ARCHIVE_STARTED hub={} batchSize={}", tickHub.name(), properties.resolvedBatchSize());
	}

	public void stop() {
		Disposable subscription = subscriptionRef.getAndSet(null);
		if (subscription != null) {
			subscription.dispose();
		}
	}

	public boolean isRunning() {
		Disposable subscription = subscriptionRef.get();
		return subscription != null && !subscription.isDisposed();
	}
}
