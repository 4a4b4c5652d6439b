package com.livehub.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;

import com.livehub.feed.FeedProducer;
import com.livehub.ingest.TickArchiver;

import jakarta.annotation.PreDestroy;

/**
 * Starts the consumers before the producer once the application is ready, so the archiver sees the feed
 * from its first tick.
 */
public class LiveHubStarter implements ApplicationListener<ApplicationReadyEvent> {

	private static final Logger log = LoggerFactory.getLogger(LiveHubStarter.class);

	private final ObjectProvider<FeedProducer> feedProducer;
	private final ObjectProvider<TickArchiver> tickArchiver;

	public LiveHubStarter(ObjectProvider<FeedProducer> feedProducer, ObjectProvider<TickArchiver> tickArchiver) {
		this.feedProducer = feedProducer;
		this.tickArchiver = tickArchiver;
	}

	@Override
	public void onApplicationEvent(ApplicationReadyEvent event) {
		start();
	}

	void start() {
		try {
			TickArchiver archiver = tickArchiver.getIfAvailable();
			if (archiver != null) {
				archiver.start();
			} else {
				log.info("EVENT=LIVE_HUB_ARCHIVE_DISABLED");
			}
			FeedProducer producer = feedProducer.getIfAvailable();
			if (producer == null) {
				log.warn("EVENT=LIVE_HUB_NO_PRODUCER");
				return;
			}
			producer.start();
			log.info("EVENT=LIVE_HUB_STARTED producer={}", producer.name());
		} catch (Exception ex) {
			log.error("EVENT=LIVE_HUB_START_FAILED message={}", ex.getMessage(), ex);
		}
	}

	@PreDestroy
	public void shutdown() {
		FeedProducer producer = feedProducer.getIfAvailable();
		if (producer != null) {
			producer.stop();
		}
		TickArchiver archiver = tickArchiver.getIfAvailable();
		if (archiver != null) {
			archiver.stop();
		}
	}
}
