package com.livehub.feed;

import java.net.URI;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;

import com.livehub.hub.Inlet;
import com.livehub.hub.ProducerContractViolationException;

import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Pushes ticks read from a JSON WebSocket feed. Frames arrive on Netty event-loop threads and are pushed
 * straight into the inlet. Disconnects are retried with backoff; the inlet is never completed by a
 * disconnect, only the hub owner ends the stream.
 */
public class WebSocketTickProducer implements FeedProducer {

    private static final Logger log = LoggerFactory.getLogger(WebSocketTickProducer.class);

    private final FeedProperties properties;
    private final TickParser parser;
    private final Inlet<Tick> inlet;
    private final ReactorNettyWebSocketClient webSocketClient;
    private final AtomicReference<Disposable> subscriptionRef = new AtomicReference<>();
    private final LongAdder pushed = new LongAdder();

    public WebSocketTickProducer(FeedProperties properties, TickParser parser, Inlet<Tick> inlet) {
        this(properties, parser, inlet, new ReactorNettyWebSocketClient());
    }

    WebSocketTickProducer(FeedProperties properties, TickParser parser, Inlet<Tick> inlet,
            ReactorNettyWebSocketClient webSocketClient) {
        this.properties = properties;
        this.parser = parser;
        this.inlet = inlet;
        this.webSocketClient = webSocketClient;
    }

    @Override
    public String name() {
        return "websocket";
    }

    @Override
    public void start() {
        if (properties.url() == null || properties.url().isBlank()) {
            log.warn("EVENT=WS_FEED_NO_URL");
            return;
        }
        if (subscriptionRef.get() != null) {
            return;
        }
        URI uri = URI.create(properties.url());
        log.info("EVENT=WS_FEED_CONNECT uri={}", uri);
        Disposable subscription = webSocketClient.execute(uri, session -> session.receive()
                .filter(message -> message.getType() == WebSocketMessage.Type.TEXT)
                .map(WebSocketMessage::getPayloadAsText)
                .doOnNext(this::handlePayload)
                .then(Mono.<Void>error(() -> new IllegalStateException("Feed closed the connection"))))
                .retryWhen(retrySpec())
                .subscribe(null, error -> log.warn("EVENT=WS_FEED_ERROR reason={}", error.getMessage()));
        if (!subscriptionRef.compareAndSet(null, subscription)) {
            subscription.dispose();
        }
    }

    @Override
    public void stop() {
        Disposable subscription = subscriptionRef.getAndSet(null);
        if (subscription != null) {
            subscription.dispose();
            log.info("EVENT=WS_FEED_STOPPED pushed={}", pushed.sum());
        }
    }

    public long pushedCount() {
        return pushed.sum();
    }

    void handlePayload(String payload) {
        parser.parse(payload).ifPresent(tick -> {
            try {
                inlet.push(tick);
                pushed.increment();
            } catch (ProducerContractViolationException ex) {
                log.warn("EVENT=WS_FEED_HUB_CLOSED hub={} state={}", ex.hubName(), ex.state());
                stop();
            }
        });
    }

    private Retry retrySpec() {
        return Retry.backoff(Long.MAX_VALUE, properties.resolvedReconnectBackoffMin())
                .maxBackoff(properties.resolvedReconnectBackoffMax())
                .jitter(0.3)
                .transientErrors(true)
                .filter(error -> inlet.isOpen())
                .doBeforeRetry(signal -> log.warn("EVENT=WS_FEED_RECONNECT attempt={} reason={}",
                        signal.totalRetries(),
                        signal.failure().getMessage()));
    }
}
