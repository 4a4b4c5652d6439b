package com.livehub.hub;

import java.util.concurrent.atomic.LongAdder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import reactor.core.Disposable;

/**
 * Permanent subscriber of a core's feed that discards everything it receives. While it is subscribed the
 * core never sees zero consumers, so it outlives periods without any real subscriber.
 */
public final class KeepAliveAnchor<T> {

    private static final Logger log = LoggerFactory.getLogger(KeepAliveAnchor.class);

    private final LongAdder discarded = new LongAdder();
    private final Disposable subscription;

    KeepAliveAnchor(BroadcastCore<T> core) {
        this.subscription = core.anchorFeed().subscribe(
                element -> discarded.increment(),
                error -> log.debug("EVENT=HUB_ANCHOR_END hub={} reason={}", core.name(), error.getMessage()),
                () -> log.debug("EVENT=HUB_ANCHOR_END hub={}", core.name()));
    }

    void release() {
        subscription.dispose();
    }

    public boolean isAttached() {
        return !subscription.isDisposed();
    }

    public long discarded() {
        return discarded.sum();
    }
}
