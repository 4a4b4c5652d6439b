package com.livehub.hub;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Live subscriptions of one core, keyed by id. Delivery itself goes through the core's sink; the registry
 * only answers who is attached.
 */
public class SubscriptionRegistry<T> {

    private final AtomicLong ids = new AtomicLong();
    private final Map<Long, HubSubscription<T>> subscriptions = new ConcurrentHashMap<>();

    long nextId() {
        return ids.incrementAndGet();
    }

    void add(HubSubscription<T> subscription) {
        subscriptions.put(subscription.id(), subscription);
    }

    boolean remove(HubSubscription<T> subscription) {
        return subscriptions.remove(subscription.id(), subscription);
    }

    public Optional<HubSubscription<T>> find(long id) {
        return Optional.ofNullable(subscriptions.get(id));
    }

    public boolean contains(long id) {
        return subscriptions.containsKey(id);
    }

    public List<Long> ids() {
        return subscriptions.keySet().stream().sorted().toList();
    }

    public int size() {
        return subscriptions.size();
    }

    public boolean isEmpty() {
        return subscriptions.isEmpty();
    }
}
