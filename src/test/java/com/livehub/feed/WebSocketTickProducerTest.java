package com.livehub.feed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.livehub.hub.BroadcastHub;
import com.livehub.hub.HubSettings;
import com.livehub.hub.HubSignal;
import com.livehub.hub.Inlet;

import reactor.core.scheduler.Schedulers;

class WebSocketTickProducerTest {

	private final TickParser parser = new TickParser(new ObjectMapper());

	@Test
	void pushesParsedFramesIntoInlet() {
		BroadcastHub<Tick> hub = new BroadcastHub<>(HubSettings.of("ws"));
		List<HubSignal<Tick>> signals = new ArrayList<>();
		hub.attach(signals::add, Schedulers.immediate());
		WebSocketTickProducer producer = new WebSocketTickProducer(properties("wss://feed.test/ws"), parser,
				hub.claimInlet("websocket"), mock(ReactorNettyWebSocketClient.class));

		producer.handlePayload("{\"s\":\"BTCUSDT\",\"p\":\"1.5\",\"q\":\"3\",\"E\":10}");
		producer.handlePayload("{\"result\":null,\"id\":1}");

		assertThat(signals).extracting(HubSignal::element)
				.containsExactly(new Tick("BTCUSDT", 1.5, 3.0, 10L));
		assertThat(producer.pushedCount()).isEqualTo(1);
	}

	@Test
	void closedHubDoesNotPropagateToNettyThread() {
		BroadcastHub<Tick> hub = new BroadcastHub<>(HubSettings.of("ws-closed"));
		Inlet<Tick> inlet = hub.claimInlet("websocket");
		WebSocketTickProducer producer = new WebSocketTickProducer(properties("wss://feed.test/ws"), parser, inlet,
				mock(ReactorNettyWebSocketClient.class));
		hub.shutdown();

		producer.handlePayload("{\"s\":\"BTCUSDT\",\"p\":\"1.5\",\"q\":\"3\",\"E\":10}");

		assertThat(producer.pushedCount()).isZero();
	}

	@Test
	void startWithoutUrlDoesNotConnect() {
		ReactorNettyWebSocketClient client = mock(ReactorNettyWebSocketClient.class);
		BroadcastHub<Tick> hub = new BroadcastHub<>(HubSettings.of("ws-no-url"));
		WebSocketTickProducer producer = new WebSocketTickProducer(properties(" "), parser,
				hub.claimInlet("websocket"), client);

		producer.start();

		verifyNoInteractions(client);
	}

	private static FeedProperties properties(String url) {
		return new FeedProperties("websocket", url, List.of("BTCUSDT"), null, null, null, null, null);
	}
}
