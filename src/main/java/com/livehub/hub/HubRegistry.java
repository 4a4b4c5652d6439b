package com.livehub.hub;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.annotation.PreDestroy;
import reactor.core.publisher.Flux;

/**
 * Owns the named hubs of the application: creates them (anchored), derives views from them and tears them
 * down explicitly.
 */
public class HubRegistry {

    private static final Logger log = LoggerFactory.getLogger(HubRegistry.class);

    private final Map<String, BroadcastHub<?>> hubs = new ConcurrentHashMap<>();
    private final Map<String, DerivedView<?, ?>> views = new ConcurrentHashMap<>();

    public <T> BroadcastHub<T> create(HubSettings settings) {
        BroadcastHub<T> hub = new BroadcastHub<>(settings);
        register(hub);
        return hub;
    }

    public <T, R> DerivedView<T, R> derive(BroadcastHub<T> upstream, HubSettings settings,
            Function<Flux<T>, Flux<R>> stage) {
        if (hubs.containsKey(settings.name())) {
            throw new IllegalArgumentException("Hub '" + settings.name() + "' already exists");
        }
        DerivedView<T, R> view = DerivedView.attach(upstream, settings, stage);
        try {
            register(view.hub());
        } catch (IllegalArgumentException ex) {
            view.close();
            throw ex;
        }
        views.put(settings.name(), view);
        return view;
    }

    public Optional<BroadcastHub<?>> find(String name) {
        return Optional.ofNullable(hubs.get(name));
    }

    public BroadcastHub<?> require(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException("Unknown hub '" + name + "'"));
    }

    public List<HubStatus> status() {
        return hubs.values().stream()
                .map(BroadcastHub::status)
                .sorted(Comparator.comparing(HubStatus::name))
                .toList();
    }

    public boolean shutdown(String name) {
        BroadcastHub<?> hub = hubs.remove(name);
        if (hub == null) {
            return false;
        }
        DerivedView<?, ?> view = views.remove(name);
        if (view != null) {
            view.close();
        } else {
            hub.shutdown();
        }
        log.info("EVENT=HUB_REMOVED hub={}", name);
        return true;
    }

    @PreDestroy
    public void shutdownAll() {
        for (String name : List.copyOf(views.keySet())) {
            shutdown(name);
        }
        for (String name : List.copyOf(hubs.keySet())) {
            shutdown(name);
        }
    }

    private void register(BroadcastHub<?> hub) {
        if (hubs.putIfAbsent(hub.name(), hub) != null) {
            hub.shutdown();
            throw new IllegalArgumentException("Hub '" + hub.name() + "' already exists");
        }
    }
}
