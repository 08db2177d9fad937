package com.charthost.chart.client;

import com.charthost.common.exception.ChartException;
import com.charthost.common.exception.StorageIoException;
import com.charthost.common.exception.UpstreamBadResponseException;
import com.charthost.common.exception.UpstreamTimeoutException;
import com.charthost.common.exception.UpstreamUnavailableException;
import com.charthost.common.identity.TickerResolver;
import com.charthost.common.model.Ticker;
import io.netty.handler.timeout.ReadTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Downloads daily candle charts from Finviz ({@code /chart.ashx}).
 *
 * <p>The body is streamed buffer by buffer into a staging file, so a large or slow response
 * never sits in memory whole. The whole exchange is bounded by one timeout. Any failure,
 * timeout or cancellation deletes the staging file before the error propagates.
 */
public class FinvizChartClient implements ChartFetcher {

    private static final Logger log = LoggerFactory.getLogger(FinvizChartClient.class);

    static final String USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0 Safari/537.36";

    private final WebClient webClient;
    private final Path      stagingDirectory;
    private final Duration  timeout;

    public FinvizChartClient(WebClient chartProviderWebClient, Path stagingDirectory, Duration timeout) {
        this.webClient        = chartProviderWebClient;
        this.stagingDirectory = stagingDirectory;
        this.timeout          = timeout;
    }

    @Override
    public Mono<FetchResult> fetch(Ticker ticker) {
        String filename = TickerResolver.deriveKey(ticker).filename();
        return Mono.usingWhen(
                createStagingFile(ticker),
                staged -> download(ticker, staged)
                    .then(ensureNotEmpty(ticker, staged))
                    .thenReturn(new FetchResult(staged, filename))
                    .timeout(timeout, Mono.error(() -> new UpstreamTimeoutException(
                        "Chart provider did not respond within " + timeout.toMillis() + "ms for " + ticker))),
                staged -> Mono.empty(),
                (staged, e) -> FetchResult.deleteStaged(staged),
                FetchResult::deleteStaged)
            .onErrorMap(e -> classify(ticker, e))
            .doOnSuccess(r -> log.info("Chart fetched. ticker={} staged={}", ticker, r.stagedPath().getFileName()))
            .doOnError(e -> log.warn("FETCH_FAILED ticker={} reason={} message={}",
                ticker, ChartException.reasonOf(e), e.getMessage()));
    }

    // ── internals ─────────────────────────────────────────────────────────────

    private Mono<Path> createStagingFile(Ticker ticker) {
        return Mono.fromCallable(() -> {
                Files.createDirectories(stagingDirectory);
                return Files.createTempFile(stagingDirectory, ticker.value() + "-", ".png.part");
            })
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorMap(IOException.class, e -> new StorageIoException(
                "Could not create staging file for " + ticker + ": " + e.getMessage(), e));
    }

    private Mono<Void> download(Ticker ticker, Path staged) {
        Flux<DataBuffer> body = webClient.get()
            .uri(uri -> uri.path("/chart.ashx")
                .queryParam("t", ticker.value())
                .queryParam("ty", "c")
                .queryParam("ta", "1")
                .queryParam("p", "d")
                .queryParam("s", "l")
                .build())
            .header(HttpHeaders.USER_AGENT, USER_AGENT)
            .exchangeToFlux(response -> {
                if (!response.statusCode().is2xxSuccessful()) {
                    int status = response.statusCode().value();
                    return response.releaseBody().thenMany(Flux.error(new UpstreamBadResponseException(
                        status, "Chart provider answered " + status + " for " + ticker)));
                }
                return response.bodyToFlux(DataBuffer.class);
            });
        return DataBufferUtils.write(body, staged);
    }

    private Mono<Void> ensureNotEmpty(Ticker ticker, Path staged) {
        return Mono.fromCallable(() -> Files.size(staged))
            .subscribeOn(Schedulers.boundedElastic())
            .flatMap(size -> size > 0
                ? Mono.<Void>empty()
                : Mono.error(new UpstreamBadResponseException(200,
                    "Chart provider returned an empty body for " + ticker)));
    }

    private static Throwable classify(Ticker ticker, Throwable e) {
        if (e instanceof ChartException) {
            return e;
        }
        if (isTimeout(e)) {
            return new UpstreamTimeoutException("Chart provider timed out for " + ticker, e);
        }
        if (e instanceof WebClientRequestException) {
            return new UpstreamUnavailableException(
                "Chart provider unreachable for " + ticker + ": " + e.getMessage(), e);
        }
        if (e instanceof IOException) {
            return new StorageIoException("Could not stage chart for " + ticker + ": " + e.getMessage(), e);
        }
        return new UpstreamUnavailableException("Chart fetch failed for " + ticker + ": " + e.getMessage(), e);
    }

    private static boolean isTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException || t instanceof ReadTimeoutException) {
                return true;
            }
        }
        return false;
    }
}
