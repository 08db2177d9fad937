package com.charthost.chart.controller;

import com.charthost.chart.cache.ChartCacheService;
import com.charthost.chart.store.StoreContext;
import com.charthost.chart.support.StubChartFetcher;
import com.charthost.chart.support.TestStores;
import com.charthost.common.exception.UpstreamTimeoutException;
import com.charthost.common.exception.UpstreamUnavailableException;
import com.charthost.common.freshness.FreshnessPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ChartControllerTest {

    @TempDir
    Path dir;

    private final Clock clock = Clock.systemUTC();

    private StoreContext     context;
    private StubChartFetcher fetcher;
    private WebTestClient    web;

    private void start(boolean relational) throws IOException {
        Path charts = dir.resolve("charts");
        context = StoreContext.initialize(relational ? TestStores.h2(charts) : TestStores.degraded(charts), clock);
        fetcher = new StubChartFetcher(dir.resolve("staging"));
        ChartCacheService cache = new ChartCacheService(context.relational(), fetcher, FreshnessPolicy.ofHours(24, clock));
        web = WebTestClient.bindToController(new ChartController(cache, context)).build();
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    // ── relational backend up ─────────────────────────────────────────────────

    @Nested
    @DisplayName("relational mode")
    class Relational {

        @BeforeEach
        void setUp() throws IOException {
            start(true);
        }

        @Test
        @DisplayName("POST /charts fetches on miss and returns metadata")
        void getOrFetch() {
            web.post().uri("/charts")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("symbol", "aapl"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.ticker").isEqualTo("AAPL")
                .jsonPath("$.size").isEqualTo(StubChartFetcher.payload("AAPL", 1).length)
                .jsonPath("$.imagePath").isEqualTo("/charts/AAPL")
                .jsonPath("$.updatedAt").exists();
            assertEquals(1, fetcher.calls("AAPL"));
        }

        @Test
        @DisplayName("POST /charts with a bad or missing symbol → 400")
        void badSymbol() {
            web.post().uri("/charts")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("symbol", "BAD$"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.reason").isEqualTo("INVALID_SYMBOL_FORMAT");

            web.post().uri("/charts")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of())
                .exchange()
                .expectStatus().isBadRequest();
            assertEquals(0, fetcher.totalCalls());
        }

        @Test
        @DisplayName("upstream unavailable → 502, upstream timeout → 504")
        void upstreamFailures() {
            fetcher.failWith("DOWN", new UpstreamUnavailableException("provider down"));
            fetcher.failWith("SLOW", new UpstreamTimeoutException("provider slow"));

            web.post().uri("/charts").contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("symbol", "DOWN"))
                .exchange()
                .expectStatus().isEqualTo(502)
                .expectBody()
                .jsonPath("$.reason").isEqualTo("UPSTREAM_UNAVAILABLE")
                .jsonPath("$.error").isEqualTo("provider down");

            web.post().uri("/charts").contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("symbol", "SLOW"))
                .exchange()
                .expectStatus().isEqualTo(504);
        }

        @Test
        @DisplayName("GET /charts/{symbol} serves stored PNG bytes without fetching; 404 when absent")
        void image() {
            web.post().uri("/charts").contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("symbol", "MSFT"))
                .exchange()
                .expectStatus().isOk();

            web.get().uri("/charts/msft")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentType(MediaType.IMAGE_PNG)
                .expectBody(byte[].class).isEqualTo(StubChartFetcher.payload("MSFT", 1));

            web.get().uri("/image/NVDA")
                .exchange()
                .expectStatus().isNotFound();
            assertEquals(0, fetcher.calls("NVDA"));
        }

        @Test
        void symbolsSorted() {
            for (String s : List.of("MSFT", "AAPL")) {
                web.post().uri("/charts").contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("symbol", s))
                    .exchange()
                    .expectStatus().isOk();
            }

            web.get().uri("/symbols")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2)
                .jsonPath("$[0].ticker").isEqualTo("AAPL")
                .jsonPath("$[1].ticker").isEqualTo("MSFT");
        }

        @Test
        @DisplayName("POST /batch-charts → one outcome per symbol, in order")
        void batch() {
            web.post().uri("/batch-charts").contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("symbols", List.of("AAPL", "BAD$", "MSFT")))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.results.length()").isEqualTo(3)
                .jsonPath("$.results[0].ticker").isEqualTo("AAPL")
                .jsonPath("$.results[0].committed").isEqualTo("INSERTED")
                .jsonPath("$.results[1].ticker").isEqualTo("BAD$")
                .jsonPath("$.results[1].reason").isEqualTo("INVALID_SYMBOL_FORMAT")
                .jsonPath("$.results[2].ticker").isEqualTo("MSFT")
                .jsonPath("$.succeeded").isEqualTo(2)
                .jsonPath("$.failed").isEqualTo(1);
        }

        @Test
        @DisplayName("POST /batch-charts without a non-empty array → 400")
        void batchValidation() {
            web.post().uri("/batch-charts").contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("symbols", List.of()))
                .exchange()
                .expectStatus().isBadRequest();
            web.post().uri("/batch-charts").contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of())
                .exchange()
                .expectStatus().isBadRequest();
        }

        @Test
        @DisplayName("POST /images stores base64 content readable via GET /image/{ticker}")
        void base64Upload() {
            byte[] png = {(byte) 0x89, 'P', 'N', 'G', 9};
            web.post().uri("/images").contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("ticker", "tsla",
                    "imageBase64", "data:image/png;base64," + Base64.getEncoder().encodeToString(png)))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.ticker").isEqualTo("TSLA")
                .jsonPath("$.committed").isEqualTo("INSERTED");

            web.get().uri("/image/TSLA")
                .exchange()
                .expectStatus().isOk()
                .expectBody(byte[].class).isEqualTo(png);
        }

        @Test
        void base64UploadRejectsGarbage() {
            web.post().uri("/images").contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("ticker", "TSLA", "imageBase64", "%%% not base64 %%%"))
                .exchange()
                .expectStatus().isBadRequest();
            web.post().uri("/images").contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("ticker", "TSLA"))
                .exchange()
                .expectStatus().isBadRequest();
        }
    }

    // ── degraded mode ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("degraded mode")
    class Degraded {

        @BeforeEach
        void setUp() throws IOException {
            start(false);
        }

        @Test
        @DisplayName("relational routes answer 503 and never fetch")
        void serviceUnavailable() {
            web.post().uri("/charts").contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("symbol", "AAPL"))
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.reason").isEqualTo("BACKEND_UNAVAILABLE");

            web.get().uri("/symbols").exchange().expectStatus().isEqualTo(503);
            web.get().uri("/charts/AAPL").exchange().expectStatus().isEqualTo(503);
            web.post().uri("/batch-charts").contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("symbols", List.of("AAPL")))
                .exchange()
                .expectStatus().isEqualTo(503);
            assertEquals(0, fetcher.totalCalls());
        }

        @Test
        @DisplayName("symbol validation still comes first → 400")
        void invalidBeforeUnavailable() {
            web.post().uri("/charts").contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("symbol", "BAD$"))
                .exchange()
                .expectStatus().isBadRequest();
        }
    }
}
