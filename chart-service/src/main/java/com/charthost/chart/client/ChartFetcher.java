package com.charthost.chart.client;

import com.charthost.common.model.Ticker;
import reactor.core.publisher.Mono;

/**
 * Strategy interface for the upstream chart provider.
 */
public interface ChartFetcher {

    /**
     * Downloads the chart for {@code ticker} into a staging file. One attempt, no retries.
     *
     * <p>On success the caller owns the staged file and must {@link FetchResult#discard()} it.
     * On failure nothing is left behind.
     */
    Mono<FetchResult> fetch(Ticker ticker);
}
