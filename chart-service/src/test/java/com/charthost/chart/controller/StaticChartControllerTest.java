package com.charthost.chart.controller;

import com.charthost.chart.cache.ChartCacheService;
import com.charthost.chart.store.FileArtifactStore;
import com.charthost.chart.support.StubChartFetcher;
import com.charthost.common.exception.UpstreamUnavailableException;
import com.charthost.common.freshness.FreshnessPolicy;
import com.charthost.common.model.Ticker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;

class StaticChartControllerTest {

    @TempDir
    Path dir;

    private FileArtifactStore files;
    private StubChartFetcher  fetcher;
    private WebTestClient     web;

    @BeforeEach
    void setUp() throws IOException {
        Clock clock = Clock.systemUTC();
        files   = new FileArtifactStore(dir.resolve("charts"), clock);
        fetcher = new StubChartFetcher(dir.resolve("staging"));
        ChartCacheService cache = new ChartCacheService(files, fetcher, FreshnessPolicy.ofHours(24, clock));
        web = WebTestClient.bindToController(
            new StaticChartController(cache, new PublicUrls("http://charts.test/"))).build();
    }

    @Test
    @DisplayName("GET /static/{file} fetches on first request and serves from disk afterwards")
    void servesFile() {
        for (int i = 0; i < 2; i++) {
            web.get().uri("/static/AAPL_chart.png")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentType(MediaType.IMAGE_PNG)
                .expectBody(byte[].class).isEqualTo(StubChartFetcher.payload("AAPL", 1));
        }
        assertEquals(1, fetcher.calls("AAPL"));
        assertTrue(Files.exists(dir.resolve("charts").resolve("AAPL_chart.png")));
    }

    @Test
    @DisplayName("non-canonical filename → 400 without a fetch")
    void rejectsLowercaseKey() {
        web.get().uri("/static/aapl_chart.png")
            .exchange()
            .expectStatus().isBadRequest();
        web.get().uri("/static/notes.txt")
            .exchange()
            .expectStatus().isBadRequest();
        assertEquals(0, fetcher.totalCalls());
    }

    @Test
    @DisplayName("GET /static/charts/{symbol} returns the public URL as text")
    void publicUrl() {
        web.get().uri("/static/charts/msft")
            .exchange()
            .expectStatus().isOk()
            .expectHeader().contentTypeCompatibleWith(MediaType.TEXT_PLAIN)
            .expectBody(String.class).isEqualTo("http://charts.test/static/MSFT_chart.png");
        assertEquals(1, fetcher.calls("MSFT"));
    }

    @Test
    void upstreamDown() {
        fetcher.failWith("DOWN", new UpstreamUnavailableException("provider down"));

        web.get().uri("/static/DOWN_chart.png")
            .exchange()
            .expectStatus().isEqualTo(502);
        assertFalse(Files.exists(files.pathOf(new Ticker("DOWN"))));
    }
}
