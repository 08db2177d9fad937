package com.charthost.chart.store;

import com.charthost.chart.support.TestStores;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the shared store behaviour against H2 through the same pool and schema setup
 * production uses.
 */
class R2dbcArtifactStoreTest extends ArtifactStoreContract {

    @TempDir
    Path dir;

    private StoreContext context;

    @BeforeEach
    void setUp() throws IOException {
        context = StoreContext.initialize(TestStores.h2(dir), clock);
        assertTrue(context.isRelationalReady(), () -> "H2 setup failed: " + context.degradedReason());
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    @Override
    protected ArtifactStore store() {
        return context.relational();
    }

    @Test
    @DisplayName("update keeps createdAt from the first insert")
    void createdAtSurvivesUpdate() {
        store().put(AAPL, bytes("v1")).block();
        clock.advance(Duration.ofHours(3));
        store().put(AAPL, bytes("v2")).block();

        StepVerifier.create(store().get(AAPL))
            .assertNext(a -> {
                assertEquals(T0, a.createdAt());
                assertEquals(T0.plus(Duration.ofHours(3)), a.updatedAt());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("list carries timestamps but no image bytes are needed")
    void listMetadata() {
        store().put(AAPL, bytes("v1")).block();

        StepVerifier.create(store().list())
            .assertNext(m -> {
                assertEquals(AAPL, m.ticker());
                assertEquals(T0, m.createdAt());
                assertEquals(T0, m.updatedAt());
            })
            .verifyComplete();
    }

    @Test
    void nameIsRelational() {
        assertEquals("relational", store().name());
    }
}
