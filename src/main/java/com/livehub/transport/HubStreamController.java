package com.livehub.transport;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import com.livehub.hub.BroadcastHub;
import com.livehub.hub.HubRegistry;
import com.livehub.hub.HubSignal;
import com.livehub.hub.HubStatus;

import reactor.core.publisher.Flux;

/**
 * Server-Sent Events surface over the hub registry. Every stream request attaches a fresh subscription;
 * the client disconnecting cancels the response Flux and thereby detaches it.
 */
@RestController
@RequestMapping("/hubs")
public class HubStreamController {

    private static final Logger log = LoggerFactory.getLogger(HubStreamController.class);

    static final String ELEMENT_EVENT = "element";
    static final String DROPPED_EVENT = "dropped";
    static final String END_EVENT = "end";
    static final String ERROR_EVENT = "error";

    private final HubRegistry hubRegistry;

    public HubStreamController(HubRegistry hubRegistry) {
        this.hubRegistry = hubRegistry;
    }

    @GetMapping
    public List<HubStatus> status() {
        return hubRegistry.status();
    }

    @GetMapping(path = "/{name}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<Object>> stream(@PathVariable String name) {
        BroadcastHub<?> hub = hubRegistry.find(name)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown hub '" + name + "'"));
        log.debug("EVENT=SSE_CONNECT hub={}", name);
        return toEvents(hub.flux(), name)
                .doOnCancel(() -> log.debug("EVENT=SSE_DISCONNECT hub={}", name));
    }

    @DeleteMapping("/{name}")
    public ResponseEntity<Void> shutdown(@PathVariable String name) {
        if (!hubRegistry.shutdown(name)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown hub '" + name + "'");
        }
        return ResponseEntity.noContent().build();
    }

    static <T> Flux<ServerSentEvent<Object>> toEvents(Flux<HubSignal<T>> signals, String hubName) {
        return signals
                .map(HubStreamController::toEvent)
                .concatWith(Flux.just(ServerSentEvent.builder()
                        .event(END_EVENT)
                        .data(Map.of("hub", hubName))
                        .build()))
                .onErrorResume(error -> {
                    log.warn("EVENT=SSE_HUB_FAILED hub={} message={}", hubName, error.getMessage());
                    return Flux.just(ServerSentEvent.builder()
                            .event(ERROR_EVENT)
                            .data(Map.of("hub", hubName, "message", String.valueOf(error.getMessage())))
                            .build());
                });
    }

    private static <T> ServerSentEvent<Object> toEvent(HubSignal<T> signal) {
        if (signal.isDropped()) {
            return ServerSentEvent.builder()
                    .event(DROPPED_EVENT)
                    .data(Map.of("count", signal.droppedCount()))
                    .build();
        }
        return ServerSentEvent.builder()
                .event(ELEMENT_EVENT)
                .data(signal.element())
                .build();
    }
}
