package com.livehub.config;

import java.util.List;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.livehub.feed.FeedProducer;
import com.livehub.feed.FeedProperties;
import com.livehub.feed.JsonlReplayProducer;
import com.livehub.feed.SyntheticTickProducer;
import com.livehub.feed.Tick;
import com.livehub.feed.TickParser;
import com.livehub.feed.WebSocketTickProducer;
import com.livehub.hub.BroadcastHub;
import com.livehub.hub.DerivedView;
import com.livehub.hub.HubRegistry;
import com.livehub.ingest.TickArchiver;
import com.livehub.view.Candle;
import com.livehub.view.CandleStage;
import com.livehub.view.SlidingWindowStage;

@Configuration
@EnableConfigurationProperties({ LiveHubProperties.class, FeedProperties.class })
public class LiveHubConfiguration {

	public static final String TICKS_HUB = "ticks";
	public static final String CANDLES_HUB = "candles";
	public static final String TICK_WINDOW_HUB = "ticks-window";

	@Bean
	public HubRegistry hubRegistry() {
		return new HubRegistry();
	}

	@Bean
	public BroadcastHub<Tick> tickHub(HubRegistry hubRegistry, LiveHubProperties properties) {
		return hubRegistry.create(properties.settings(TICKS_HUB));
	}

	@Bean
	public DerivedView<Tick, Candle> candleView(
			HubRegistry hubRegistry,
			BroadcastHub<Tick> tickHub,
			LiveHubProperties properties) {
		return hubRegistry.derive(tickHub, properties.settings(CANDLES_HUB),
				new CandleStage(properties.resolvedCandleInterval()));
	}

	@Bean
	public DerivedView<Tick, List<Tick>> tickWindowView(
			HubRegistry hubRegistry,
			BroadcastHub<Tick> tickHub,
			LiveHubProperties properties) {
		return hubRegistry.derive(tickHub, properties.settings(TICK_WINDOW_HUB),
				new SlidingWindowStage<>(properties.resolvedWindowSize()));
	}

	@Bean
	public TickParser tickParser(ObjectMapper objectMapper) {
		return new TickParser(objectMapper);
	}

	@Bean
	@ConditionalOnProperty(prefix = "live-hub.feed", name = "mode", havingValue = "synthetic", matchIfMissing = true)
	public FeedProducer syntheticTickProducer(FeedProperties feedProperties, BroadcastHub<Tick> tickHub) {
		return new SyntheticTickProducer(feedProperties, tickHub.claimInlet("synthetic"));
	}

	@Bean
	@ConditionalOnProperty(prefix = "live-hub.feed", name = "mode", havingValue = "websocket")
	public FeedProducer webSocketTickProducer(
			FeedProperties feedProperties,
			TickParser tickParser,
			BroadcastHub<Tick> tickHub) {
		return new WebSocketTickProducer(feedProperties, tickParser, tickHub.claimInlet("websocket"));
	}

	@Bean
	@ConditionalOnProperty(prefix = "live-hub.feed", name = "mode", havingValue = "replay")
	public FeedProducer jsonlReplayProducer(
			FeedProperties feedProperties,
			TickParser tickParser,
			BroadcastHub<Tick> tickHub) {
		return new JsonlReplayProducer(feedProperties, tickParser, tickHub.claimInlet("replay"));
	}

	@Bean
	public LiveHubStarter liveHubStarter(
			ObjectProvider<FeedProducer> feedProducer,
			ObjectProvider<TickArchiver> tickArchiver) {
		return new LiveHubStarter(feedProducer, tickArchiver);
	}
}
