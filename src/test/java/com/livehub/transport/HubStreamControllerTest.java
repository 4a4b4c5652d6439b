package com.livehub.transport;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;

import com.livehub.hub.BroadcastHub;
import com.livehub.hub.HubFailedException;
import com.livehub.hub.HubRegistry;
import com.livehub.hub.HubSettings;
import com.livehub.hub.HubSignal;
import com.livehub.hub.HubState;

import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

class HubStreamControllerTest {

	@Test
	void mapsSignalsToNamedEvents() {
		Flux<HubSignal<String>> signals = Flux.just(HubSignal.next("a"), HubSignal.dropped(4),
				HubSignal.next("b"));

		StepVerifier.create(HubStreamController.toEvents(signals, "ticks"))
				.assertNext(event -> {
					assertThat(event.event()).isEqualTo("element");
					assertThat(event.data()).isEqualTo("a");
				})
				.assertNext(event -> {
					assertThat(event.event()).isEqualTo("dropped");
					assertThat(event.data()).isEqualTo(Map.of("count", 4L));
				})
				.assertNext(event -> assertThat(event.event()).isEqualTo("element"))
				.assertNext(event -> assertThat(event.event()).isEqualTo("end"))
				.verifyComplete();
	}

	@Test
	void hubFailureBecomesErrorEvent() {
		Flux<HubSignal<String>> signals = Flux.just(HubSignal.next("a"))
				.concatWith(Flux.error(new HubFailedException("ticks", new IllegalStateException("feed lost"))));

		StepVerifier.create(HubStreamController.toEvents(signals, "ticks"))
				.assertNext(event -> assertThat(event.event()).isEqualTo("element"))
				.assertNext(event -> {
					assertThat(event.event()).isEqualTo("error");
					assertThat(String.valueOf(event.data())).contains("feed lost");
				})
				.verifyComplete();
	}

	@Test
	void streamEndsWithEndEventWhenHubCompletes() {
		HubRegistry registry = new HubRegistry();
		BroadcastHub<String> hub = registry.create(HubSettings.of("finished"));
		hub.claimInlet("test").complete();
		HubStreamController controller = new HubStreamController(registry);

		StepVerifier.create(controller.stream("finished"))
				.assertNext(event -> assertThat(event.event()).isEqualTo("end"))
				.verifyComplete();
	}

	@Test
	void statusListsEveryHub() {
		HubRegistry registry = new HubRegistry();
		registry.create(HubSettings.of("ticks"));
		WebTestClient client = WebTestClient.bindToController(new HubStreamController(registry)).build();

		client.get().uri("/hubs")
				.exchange()
				.expectStatus().isOk()
				.expectBody()
				.jsonPath("$[0].name").isEqualTo("ticks")
				.jsonPath("$[0].state").isEqualTo("RUNNING")
				.jsonPath("$[0].subscribers").isEqualTo(0);
	}

	@Test
	void unknownHubIsNotFound() {
		WebTestClient client = WebTestClient.bindToController(new HubStreamController(new HubRegistry())).build();

		client.get().uri("/hubs/missing/stream").exchange().expectStatus().isNotFound();
		client.delete().uri("/hubs/missing").exchange().expectStatus().isNotFound();
	}

	@Test
	void deleteShutsHubDown() {
		HubRegistry registry = new HubRegistry();
		BroadcastHub<String> hub = registry.create(HubSettings.of("doomed"));
		WebTestClient client = WebTestClient.bindToController(new HubStreamController(registry)).build();

		client.delete().uri("/hubs/doomed").exchange().expectStatus().isNoContent();

		assertThat(hub.state()).isEqualTo(HubState.COMPLETED);
		assertThat(registry.find("doomed")).isEmpty();
	}
}
