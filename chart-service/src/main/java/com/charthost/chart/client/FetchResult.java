package com.charthost.chart.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A downloaded chart sitting in the staging directory, not yet committed to a store.
 */
public record FetchResult(Path stagedPath, String filename) {

    private static final Logger log = LoggerFactory.getLogger(FetchResult.class);

    public Mono<byte[]> readBytes() {
        return Mono.fromCallable(() -> Files.readAllBytes(stagedPath))
            .subscribeOn(Schedulers.boundedElastic());
    }

    /** Deletes the staged file. Never fails; a leftover file is logged. */
    public Mono<Void> discard() {
        return deleteStaged(stagedPath);
    }

    static Mono<Void> deleteStaged(Path staged) {
        return Mono.fromRunnable(() -> deleteNow(staged))
            .subscribeOn(Schedulers.boundedElastic())
            .then();
    }

    static void deleteNow(Path staged) {
        try {
            Files.deleteIfExists(staged);
        } catch (IOException e) {
            log.warn("Could not delete staged file. path={} reason={}", staged, e.getMessage());
        }
    }
}
