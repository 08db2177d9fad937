package com.charthost.chart.controller;

import com.charthost.chart.cache.ChartCacheService;
import com.charthost.common.identity.TickerResolver;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Static chart files backed by the file store. A missing or stale file is fetched and
 * written before it is served.
 */
@RestController
public class StaticChartController {

    private final ChartCacheService files;
    private final PublicUrls        publicUrls;

    public StaticChartController(@Qualifier("fileChartCache") ChartCacheService files, PublicUrls publicUrls) {
        this.files      = files;
        this.publicUrls = publicUrls;
    }

    @GetMapping("/static/{filename}")
    public Mono<ResponseEntity<Object>> file(@PathVariable String filename) {
        return Mono.fromCallable(() -> TickerResolver.keyToTicker(filename))
            .flatMap(files::getOrFetch)
            .map(artifact -> ResponseEntity.ok()
                .contentType(MediaType.IMAGE_PNG)
                .lastModified(artifact.updatedAt())
                .<Object>body(artifact.bytes()))
            .onErrorResume(ChartErrorResponses::toResponse);
    }

    /** Plain-text public URL of the chart, fetching it first if needed. */
    @GetMapping("/static/charts/{symbol}")
    public Mono<ResponseEntity<Object>> url(@PathVariable String symbol) {
        return files.getOrFetch(symbol)
            .map(artifact -> ResponseEntity.ok()
                .contentType(MediaType.TEXT_PLAIN)
                .<Object>body(publicUrls.staticChart(artifact.ticker())))
            .onErrorResume(ChartErrorResponses::toResponse);
    }
}
