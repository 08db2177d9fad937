package com.charthost.chart.store;

import com.charthost.common.exception.BackendUnavailableException;
import io.r2dbc.pool.ConnectionPool;
import io.r2dbc.pool.ConnectionPoolConfiguration;
import io.r2dbc.pool.PoolMetrics;
import io.r2dbc.spi.ConnectionFactories;
import io.r2dbc.spi.ConnectionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.r2dbc.connection.R2dbcTransactionManager;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns every storage resource of the process: the file store, the optional R2DBC connection
 * pool and the relational store built on it.
 *
 * <p><strong>Initialization order</strong> ({@link #initialize}):
 * <ol>
 *   <li>create the chart directory and the file store;</li>
 *   <li>if a database URL is configured, build the pool and create the schema;</li>
 *   <li>pick the relational strategy: {@link R2dbcArtifactStore} when step 2 succeeded,
 *       {@link UnavailableArtifactStore} otherwise (degraded mode).</li>
 * </ol>
 * The choice is made once; callers never branch on availability themselves.
 *
 * <p>{@link #close()} is idempotent and disposes the pool exactly once.
 */
public final class StoreContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StoreContext.class);

    static final String SCHEMA = """
        CREATE TABLE IF NOT EXISTS chart_images (
            ticker     VARCHAR(10) PRIMARY KEY,
            image      BYTEA       NOT NULL,
            created_at TIMESTAMP   NOT NULL DEFAULT CURRENT_TIMESTAMP,
            updated_at TIMESTAMP   NOT NULL DEFAULT CURRENT_TIMESTAMP
        )
        """;

    private final FileArtifactStore fileStore;
    private final ArtifactStore     relationalStore;
    private final ConnectionPool    pool;
    private final DatabaseClient    databaseClient;
    private final String            degradedReason;
    private final AtomicBoolean     closed = new AtomicBoolean(false);

    private StoreContext(FileArtifactStore fileStore, ArtifactStore relationalStore,
                         ConnectionPool pool, DatabaseClient databaseClient, String degradedReason) {
        this.fileStore       = fileStore;
        this.relationalStore = relationalStore;
        this.pool            = pool;
        this.databaseClient  = databaseClient;
        this.degradedReason  = degradedReason;
    }

    /**
     * Builds the context. Blocks until the schema exists (bounded by
     * {@link StoreSettings#startupTimeout()}); nothing is served before that.
     *
     * @throws IOException if the chart directory cannot be created
     */
    public static StoreContext initialize(StoreSettings settings, Clock clock) throws IOException {
        FileArtifactStore files = new FileArtifactStore(settings.storageDirectory(), clock);
        log.info("File store ready. directory={}", files.directory().toAbsolutePath());

        if (!settings.relationalConfigured()) {
            log.warn("No database URL configured. Starting in degraded mode (file store only).");
            return degraded(files, "no database URL configured");
        }

        String redacted = DatabaseUrls.redact(settings.databaseUrl());
        ConnectionPool pool = null;
        try {
            ConnectionFactory factory = ConnectionFactories.get(DatabaseUrls.options(settings));
            pool = new ConnectionPool(ConnectionPoolConfiguration.builder(factory)
                .initialSize(1)
                .maxSize(Math.max(1, settings.poolSize()))
                .maxIdleTime(Duration.ofMinutes(10))
                .build());

            DatabaseClient client = DatabaseClient.create(pool);
            client.sql(SCHEMA).then().block(settings.startupTimeout());

            R2dbcArtifactStore relational = new R2dbcArtifactStore(
                new R2dbcEntityTemplate(pool),
                TransactionalOperator.create(new R2dbcTransactionManager(pool)),
                clock);
            log.info("Relational store ready. url={} poolSize={}", redacted, settings.poolSize());
            return new StoreContext(files, relational, pool, client, null);
        } catch (RuntimeException e) {
            log.error("Relational store setup failed. Starting in degraded mode. url={}", redacted, e);
            if (pool != null) {
                pool.dispose();
            }
            return degraded(files, "setup failed: " + e.getMessage());
        }
    }

    private static StoreContext degraded(FileArtifactStore files, String reason) {
        return new StoreContext(files, new UnavailableArtifactStore(reason), null, null, reason);
    }

    public FileArtifactStore fileStore() {
        return fileStore;
    }

    /** The relational strategy; in degraded mode every call on it fails with 503 semantics. */
    public ArtifactStore relational() {
        return relationalStore;
    }

    public boolean isRelationalReady() {
        return pool != null && !closed.get();
    }

    public String mode() {
        return isRelationalReady() ? "relational" : "degraded";
    }

    public Optional<String> degradedReason() {
        return Optional.ofNullable(degradedReason);
    }

    public Optional<PoolMetrics> poolMetrics() {
        return pool == null ? Optional.empty() : pool.getMetrics();
    }

    /**
     * Round-trips the database clock through a pooled connection.
     */
    public Mono<String> probe() {
        if (!isRelationalReady()) {
            return Mono.error(() -> new BackendUnavailableException("Relational backend unavailable: "
                + Objects.requireNonNullElse(degradedReason, "closed")));
        }
        return databaseClient.sql("SELECT CURRENT_TIMESTAMP")
            .map(row -> String.valueOf(row.get(0)))
            .one();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (pool != null) {
            log.info("Disposing connection pool");
            pool.dispose();
        }
    }
}
