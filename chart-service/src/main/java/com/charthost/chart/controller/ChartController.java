package com.charthost.chart.controller;

import com.charthost.chart.cache.ChartCacheService;
import com.charthost.chart.dto.BatchChartRequest;
import com.charthost.chart.dto.ChartRequest;
import com.charthost.chart.dto.ChartSummaryDTO;
import com.charthost.chart.dto.ImageUploadRequest;
import com.charthost.chart.dto.SymbolEntryDTO;
import com.charthost.chart.store.StoreContext;
import com.charthost.common.exception.ArtifactNotFoundException;
import com.charthost.common.exception.BackendUnavailableException;
import com.charthost.common.model.BatchOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * JSON API over the relational chart cache. In degraded mode every route here answers 503.
 */
@RestController
public class ChartController {

    private static final Logger log = LoggerFactory.getLogger(ChartController.class);

    private final ChartCacheService charts;
    private final StoreContext      storeContext;

    public ChartController(@Qualifier("relationalChartCache") ChartCacheService charts,
                           StoreContext storeContext) {
        this.charts       = charts;
        this.storeContext = storeContext;
    }

    @PostMapping("/charts")
    public Mono<ResponseEntity<Object>> getOrFetch(@RequestBody(required = false) ChartRequest body) {
        if (body == null || body.symbol() == null || body.symbol().isEmpty()) {
            return Mono.just(ChartErrorResponses.badRequest("symbol is required"));
        }
        log.info("Chart requested. symbol={}", body.symbol());
        return charts.getOrFetch(body.symbol())
            .map(artifact -> ResponseEntity.ok().<Object>body(ChartSummaryDTO.of(artifact)))
            .onErrorResume(ChartErrorResponses::toResponse);
    }

    @GetMapping({"/charts/{symbol}", "/image/{symbol}"})
    public Mono<ResponseEntity<Object>> image(@PathVariable String symbol) {
        return charts.find(symbol)
            .map(artifact -> ResponseEntity.ok()
                .contentType(MediaType.IMAGE_PNG)
                .<Object>body(artifact.bytes()))
            .switchIfEmpty(Mono.error(() -> new ArtifactNotFoundException("Image not found: " + symbol)))
            .onErrorResume(ChartErrorResponses::toResponse);
    }

    @GetMapping("/symbols")
    public Mono<ResponseEntity<Object>> symbols() {
        return charts.listSymbols()
            .map(SymbolEntryDTO::of)
            .collectList()
            .map(list -> ResponseEntity.ok().<Object>body(list))
            .onErrorResume(ChartErrorResponses::toResponse);
    }

    @PostMapping("/batch-charts")
    public Mono<ResponseEntity<Object>> batch(@RequestBody(required = false) BatchChartRequest body) {
        if (body == null || body.symbols() == null || body.symbols().isEmpty()) {
            return Mono.just(ChartErrorResponses.badRequest("symbols must be a non-empty array"));
        }
        if (!storeContext.isRelationalReady()) {
            return ChartErrorResponses.toResponse(new BackendUnavailableException(
                "Relational backend unavailable: batch results cannot be persisted"));
        }
        log.info("Batch requested. size={}", body.symbols().size());
        return charts.batchGetOrFetch(body.symbols())
            .map(outcomes -> ResponseEntity.ok().<Object>body(batchBody(outcomes)));
    }

    /** Base64 JSON upload straight into the relational store. */
    @PostMapping("/images")
    public Mono<ResponseEntity<Object>> uploadBase64(@RequestBody(required = false) ImageUploadRequest body) {
        if (body == null || body.ticker() == null || body.imageBase64() == null || body.imageBase64().isBlank()) {
            return Mono.just(ChartErrorResponses.badRequest("Missing ticker or image"));
        }
        byte[] bytes;
        try {
            bytes = decodeBase64(body.imageBase64());
        } catch (IllegalArgumentException e) {
            return Mono.just(ChartErrorResponses.badRequest("imageBase64 is not valid base64"));
        }
        if (bytes.length == 0) {
            return Mono.just(ChartErrorResponses.badRequest("image is empty"));
        }
        return charts.commit(body.ticker(), bytes)
            .map(kind -> ResponseEntity.ok().<Object>body(Map.of(
                "ticker", body.ticker().toUpperCase(Locale.ROOT),
                "committed", kind,
                "size", bytes.length)))
            .onErrorResume(ChartErrorResponses::toResponse);
    }

    // ── helpers ───────────────────────────────────────────────────────────────

    static byte[] decodeBase64(String encoded) {
        String payload = encoded;
        int comma = payload.indexOf(',');
        if (payload.startsWith("data:") && comma > 0) {
            payload = payload.substring(comma + 1);
        }
        return Base64.getDecoder().decode(payload.replaceAll("\\s", ""));
    }

    static Map<String, Object> batchBody(List<BatchOutcome> outcomes) {
        long succeeded = outcomes.stream().filter(BatchOutcome::isSuccess).count();
        return Map.of(
            "results",   outcomes,
            "succeeded", succeeded,
            "failed",    outcomes.size() - succeeded);
    }
}
