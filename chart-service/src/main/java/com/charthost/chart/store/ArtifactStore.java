package com.charthost.chart.store;

import com.charthost.common.model.Artifact;
import com.charthost.common.model.ArtifactMetadata;
import com.charthost.common.model.CommitKind;
import com.charthost.common.model.Ticker;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Strategy interface for chart persistence: relational blob table or named-file directory.
 *
 * <p>The cache orchestrator is written against this interface only; the concrete backend is
 * chosen once, in {@link StoreContext}. Implementations MUST be non-blocking on the calling
 * thread and report failures as {@code StorageIoException} or
 * {@code BackendUnavailableException} error signals.
 */
public interface ArtifactStore {

    /** Short backend name for logs and diagnostics. */
    String name();

    /** @return the stored artifact, or empty when the ticker has none */
    Mono<Artifact> get(Ticker ticker);

    /**
     * Inserts or overwrites the artifact for {@code ticker}, refreshing {@code updatedAt}.
     * Readers see either the previous bytes or the new ones, never a partial write.
     *
     * @return {@link CommitKind#INSERTED} or {@link CommitKind#UPDATED}
     */
    Mono<CommitKind> put(Ticker ticker, byte[] bytes);

    Mono<Boolean> exists(Ticker ticker);

    /** All stored artifacts without their bytes, ordered by ticker ascending. */
    Flux<ArtifactMetadata> list();

    /** Cleanup only; the cache flow overwrites, it never deletes. */
    Mono<Boolean> remove(Ticker ticker);
}
