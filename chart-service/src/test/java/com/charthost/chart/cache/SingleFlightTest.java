package com.charthost.chart.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SingleFlightTest {

    private final SingleFlight<String, String> flight = new SingleFlight<>();
    private final AtomicInteger runs = new AtomicInteger();

    private Mono<String> slow(String value) {
        return flight.execute("k", () -> {
            runs.incrementAndGet();
            return Mono.delay(Duration.ofMillis(200)).thenReturn(value);
        });
    }

    @Test
    @DisplayName("overlapping callers share one execution and its value")
    void collapsesConcurrentCallers() {
        StepVerifier.create(Mono.zip(slow("first"), slow("second")))
            .assertNext(pair -> {
                assertEquals("first", pair.getT1());
                assertEquals("first", pair.getT2());
            })
            .verifyComplete();
        assertEquals(1, runs.get());
    }

    @Test
    @DisplayName("overlapping callers share the error too")
    void sharesError() {
        Mono<String> failing = flight.execute("k", () -> {
            runs.incrementAndGet();
            return Mono.delay(Duration.ofMillis(200)).then(Mono.error(new IllegalStateException("boom")));
        });

        StepVerifier.create(Mono.zipDelayError(failing, failing.onErrorReturn("recovered")))
            .expectError(IllegalStateException.class)
            .verify();
        assertEquals(1, runs.get());
    }

    @Test
    @DisplayName("finished work is forgotten; the next caller runs again")
    void sequentialCallersRunAgain() {
        Mono<String> quick = flight.execute("k", () -> Mono.fromSupplier(() -> "run-" + runs.incrementAndGet()));

        assertEquals("run-1", quick.block());
        assertEquals(0, flight.inFlightCount());
        assertEquals("run-2", quick.block());
    }

    @Test
    void keysAreIndependent() {
        Mono<String> a = flight.execute("a", () -> Mono.fromSupplier(() -> "a" + runs.incrementAndGet()));
        Mono<String> b = flight.execute("b", () -> Mono.fromSupplier(() -> "b" + runs.incrementAndGet()));

        StepVerifier.create(Mono.zip(a.delaySubscription(Duration.ofMillis(10)), b))
            .expectNextCount(1)
            .verifyComplete();
        assertEquals(2, runs.get());
    }
}
