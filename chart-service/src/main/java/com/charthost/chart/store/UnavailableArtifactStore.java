package com.charthost.chart.store;

import com.charthost.common.exception.BackendUnavailableException;
import com.charthost.common.model.Artifact;
import com.charthost.common.model.ArtifactMetadata;
import com.charthost.common.model.CommitKind;
import com.charthost.common.model.Ticker;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Takes the relational backend's place in degraded mode. Every call fails with
 * {@link BackendUnavailableException} so callers report 503 instead of crashing.
 */
public class UnavailableArtifactStore implements ArtifactStore {

    private final String reason;

    public UnavailableArtifactStore(String reason) {
        this.reason = reason;
    }

    @Override
    public String name() {
        return "relational-unavailable";
    }

    @Override
    public Mono<Artifact> get(Ticker ticker) {
        return Mono.error(this::unavailable);
    }

    @Override
    public Mono<CommitKind> put(Ticker ticker, byte[] bytes) {
        return Mono.error(this::unavailable);
    }

    @Override
    public Mono<Boolean> exists(Ticker ticker) {
        return Mono.error(this::unavailable);
    }

    @Override
    public Flux<ArtifactMetadata> list() {
        return Flux.error(this::unavailable);
    }

    @Override
    public Mono<Boolean> remove(Ticker ticker) {
        return Mono.error(this::unavailable);
    }

    private BackendUnavailableException unavailable() {
        return new BackendUnavailableException("Relational backend unavailable: " + reason);
    }
}
