package com.charthost.chart.cache;

import reactor.core.publisher.Mono;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Collapses concurrent executions for the same key into one.
 *
 * <p>The first caller for a key starts the work; callers arriving while it runs subscribe to
 * the same cached {@link Mono} and receive its value or error. The entry is removed when the
 * work terminates, so the next caller after that starts afresh.
 */
public final class SingleFlight<K, V> {

    private final ConcurrentHashMap<K, Mono<V>> inFlight = new ConcurrentHashMap<>();

    public Mono<V> execute(K key, Supplier<Mono<V>> work) {
        return Mono.defer(() -> {
            Mono<V> running = inFlight.get(key);
            if (running != null) {
                return running;
            }
            AtomicReference<Mono<V>> self = new AtomicReference<>();
            Mono<V> shared = Mono.defer(work)
                .doFinally(signal -> inFlight.remove(key, self.get()))
                .cache();
            self.set(shared);
            Mono<V> raced = inFlight.putIfAbsent(key, shared);
            return raced != null ? raced : shared;
        });
    }

    /** Number of keys with work in progress. */
    public int inFlightCount() {
        return inFlight.size();
    }
}
