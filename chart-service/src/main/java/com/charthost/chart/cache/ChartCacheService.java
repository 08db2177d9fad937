package com.charthost.chart.cache;

import com.charthost.chart.client.ChartFetcher;
import com.charthost.chart.client.FetchResult;
import com.charthost.chart.store.ArtifactStore;
import com.charthost.common.exception.ChartException;
import com.charthost.common.exception.StorageIoException;
import com.charthost.common.freshness.FreshnessPolicy;
import com.charthost.common.identity.TickerResolver;
import com.charthost.common.model.Artifact;
import com.charthost.common.model.ArtifactMetadata;
import com.charthost.common.model.BatchOutcome;
import com.charthost.common.model.CommitKind;
import com.charthost.common.model.Ticker;
import com.charthost.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;

/**
 * Fetch-on-miss chart cache over one {@link ArtifactStore}.
 *
 * <p><strong>Flow</strong> ({@link #getOrFetch(String)}):
 * <ol>
 *   <li>Resolve the raw symbol to a {@link Ticker}.</li>
 *   <li>Read the stored artifact.</li>
 *   <li>Fresh per {@link FreshnessPolicy} → return it, no fetch.</li>
 *   <li>Missing or stale → fetch into staging, commit via {@link ArtifactStore#put},
 *       release the staging file, return the committed artifact.</li>
 * </ol>
 *
 * <p>A failed refresh is surfaced even when a stale copy exists; callers that prefer stale
 * data ask for it with {@link #getOrFetchAllowingStale(String)}. There are no automatic
 * retries. Concurrent refreshes of one ticker share a single fetch ({@link SingleFlight}).
 */
public class ChartCacheService {

    private static final Logger log = LoggerFactory.getLogger(ChartCacheService.class);

    private final ArtifactStore   store;
    private final ChartFetcher    fetcher;
    private final FreshnessPolicy freshness;
    private final SingleFlight<Ticker, Lookup> refreshes = new SingleFlight<>();

    public ChartCacheService(ArtifactStore store, ChartFetcher fetcher, FreshnessPolicy freshness) {
        this.store     = store;
        this.fetcher   = fetcher;
        this.freshness = freshness;
    }

    public ArtifactStore store() {
        return store;
    }

    public Mono<Artifact> getOrFetch(String rawSymbol) {
        return resolve(rawSymbol).flatMap(this::getOrFetch);
    }

    public Mono<Artifact> getOrFetch(Ticker ticker) {
        return lookup(ticker).map(Lookup::artifact);
    }

    /**
     * Like {@link #getOrFetch(String)}, but a failed refresh falls back to the stale copy
     * when one exists. Without a stored copy the fetch failure propagates.
     */
    public Mono<Artifact> getOrFetchAllowingStale(String rawSymbol) {
        return resolve(rawSymbol).flatMap(ticker -> current(ticker).flatMap(existing -> {
            if (existing.isPresent() && freshness.isFresh(existing.get().updatedAt())) {
                log.info("CACHE_HIT ticker={} store={}", ticker, store.name());
                return Mono.just(existing.get());
            }
            return refresh(ticker, existing.isPresent())
                .map(Lookup::artifact)
                .onErrorResume(e -> {
                    if (existing.isEmpty()) {
                        return Mono.error(e);
                    }
                    log.warn("STALE_FALLBACK ticker={} store={} updatedAt={} reason={}",
                        ticker, store.name(), existing.get().updatedAt(), ChartException.reasonOf(e));
                    return Mono.just(existing.get());
                });
        }));
    }

    /** Stored artifact only, no fetch on miss. Empty when absent. */
    public Mono<Artifact> find(String rawSymbol) {
        return resolve(rawSymbol).flatMap(store::get);
    }

    public Flux<ArtifactMetadata> listSymbols() {
        return store.list();
    }

    /** Commits externally supplied bytes without fetching. */
    public Mono<CommitKind> commit(String rawSymbol, byte[] bytes) {
        return resolve(rawSymbol).flatMap(ticker -> store.put(ticker, bytes)
            .doOnSuccess(kind -> log.info("CHART_COMMIT ticker={} store={} kind={} size={} source=upload",
                ticker, store.name(), kind, bytes.length)));
    }

    /**
     * Runs {@link #getOrFetch(String)} for each symbol, one at a time, in input order.
     *
     * <p>Each item's failure becomes a {@link BatchOutcome.Failure}; the returned {@code Mono}
     * itself never errors and always holds one outcome per input.
     */
    public Mono<List<BatchOutcome>> batchGetOrFetch(List<String> rawSymbols) {
        String batchId = TraceContextUtil.newBatchId();
        log.info("Batch started. batchId={} size={} store={}", batchId, rawSymbols.size(), store.name());

        Mono<List<BatchOutcome>> outcomes = Flux.fromStream(() -> rawSymbols.stream().map(Optional::ofNullable))
            .concatMap(raw -> outcomeOf(raw.orElse(null)))
            .collectList()
            .doOnEach(signal -> {
                if (signal.isOnNext()) {
                    List<BatchOutcome> list = signal.get();
                    long failed = list.stream().filter(o -> !o.isSuccess()).count();
                    TraceContextUtil.logInBatch(signal.getContextView(), id ->
                        log.info("Batch finished. batchId={} succeeded={} failed={}",
                            id, list.size() - failed, failed));
                }
            });
        return TraceContextUtil.withBatchId(outcomes, batchId);
    }

    // ── internals ─────────────────────────────────────────────────────────────

    private Mono<BatchOutcome> outcomeOf(String raw) {
        return resolve(raw)
            .flatMap(this::lookup)
            .map(l -> BatchOutcome.success(l.artifact().ticker(), l.kind()))
            .onErrorResume(e -> Mono.just(BatchOutcome.failure(raw, ChartException.reasonOf(e), e.getMessage())))
            .doOnEach(signal -> {
                if (signal.isOnNext() && !signal.get().isSuccess()) {
                    BatchOutcome.Failure f = (BatchOutcome.Failure) signal.get();
                    TraceContextUtil.logInBatch(signal.getContextView(), id ->
                        log.warn("Batch item failed. batchId={} ticker={} reason={} message={}",
                            id, f.ticker(), f.reason(), f.message()));
                }
            });
    }

    private Mono<Ticker> resolve(String rawSymbol) {
        return Mono.fromCallable(() -> TickerResolver.resolve(rawSymbol));
    }

    private Mono<Lookup> lookup(Ticker ticker) {
        return current(ticker).flatMap(existing -> {
            if (existing.isPresent() && freshness.isFresh(existing.get().updatedAt())) {
                log.info("CACHE_HIT ticker={} store={} updatedAt={}", ticker, store.name(), existing.get().updatedAt());
                return Mono.just(new Lookup(existing.get(), CommitKind.CACHED));
            }
            return refresh(ticker, existing.isPresent());
        });
    }

    private Mono<Optional<Artifact>> current(Ticker ticker) {
        return store.get(ticker).map(Optional::of).defaultIfEmpty(Optional.empty());
    }

    private Mono<Lookup> refresh(Ticker ticker, boolean stale) {
        log.info("{} ticker={} store={}", stale ? "CACHE_STALE" : "CACHE_MISS", ticker, store.name());
        return refreshes.execute(ticker, () -> current(ticker).flatMap(existing -> {
            // A flight that finished between our read and this one may already have committed.
            if (existing.isPresent() && freshness.isFresh(existing.get().updatedAt())) {
                log.info("CACHE_HIT ticker={} store={} updatedAt={} via=recheck",
                    ticker, store.name(), existing.get().updatedAt());
                return Mono.just(new Lookup(existing.get(), CommitKind.CACHED));
            }
            return fetchAndCommit(ticker);
        }));
    }

    private Mono<Lookup> fetchAndCommit(Ticker ticker) {
        return Mono.usingWhen(
            fetcher.fetch(ticker),
            staged -> staged.readBytes()
                .onErrorMap(e -> new StorageIoException("Could not read staged chart for " + ticker, e))
                .flatMap(bytes -> store.put(ticker, bytes)
                    .doOnSuccess(kind -> log.info("CHART_COMMIT ticker={} store={} kind={} size={} source=fetch",
                        ticker, store.name(), kind, bytes.length)))
                .flatMap(kind -> store.get(ticker)
                    .switchIfEmpty(Mono.error(() -> new StorageIoException(
                        "Committed chart for " + ticker + " could not be read back")))
                    .map(artifact -> new Lookup(artifact, kind))),
            FetchResult::discard);
    }

    private record Lookup(Artifact artifact, CommitKind kind) {}
}
