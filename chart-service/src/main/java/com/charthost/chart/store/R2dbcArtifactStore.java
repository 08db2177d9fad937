package com.charthost.chart.store;

import com.charthost.common.exception.ChartException;
import com.charthost.common.exception.StorageIoException;
import com.charthost.common.model.Artifact;
import com.charthost.common.model.ArtifactMetadata;
import com.charthost.common.model.CommitKind;
import com.charthost.common.model.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Sort;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.data.relational.core.query.Query;
import org.springframework.data.relational.core.query.Update;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.springframework.data.relational.core.query.Criteria.where;
import static org.springframework.data.relational.core.query.Query.query;

/**
 * Relational backend: one {@code chart_images} row per ticker, bytes in a binary column.
 *
 * <p>Every call borrows a pooled connection through {@link R2dbcEntityTemplate} and hands it
 * back when the publisher terminates or is cancelled; nothing here holds a connection.
 * {@link #put} runs update-then-insert in a single transaction so a reader never sees a row
 * without its bytes.
 */
public class R2dbcArtifactStore implements ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(R2dbcArtifactStore.class);

    private final R2dbcEntityTemplate template;
    private final TransactionalOperator tx;
    private final Clock clock;

    public R2dbcArtifactStore(R2dbcEntityTemplate template, TransactionalOperator tx, Clock clock) {
        this.template = template;
        this.tx       = tx;
        this.clock    = clock;
    }

    @Override
    public String name() {
        return "relational";
    }

    @Override
    public Mono<Artifact> get(Ticker ticker) {
        return template.selectOne(byTicker(ticker), ChartImage.class)
            .map(this::toArtifact)
            .onErrorMap(e -> wrap("read", ticker, e));
    }

    @Override
    public Mono<CommitKind> put(Ticker ticker, byte[] bytes) {
        return Mono.defer(() -> {
                LocalDateTime now = LocalDateTime.now(clock.withZone(ZoneOffset.UTC));
                Mono<CommitKind> upsert = overwrite(ticker, bytes, now)
                    .flatMap(rows -> rows > 0
                        ? Mono.just(CommitKind.UPDATED)
                        : template.insert(newRow(ticker, bytes, now)).thenReturn(CommitKind.INSERTED));
                return tx.transactional(upsert)
                    // Lost an insert race against another writer: the row exists now, overwrite it.
                    .onErrorResume(DataIntegrityViolationException.class, e -> {
                        log.debug("Insert raced, retrying as update. ticker={}", ticker);
                        return tx.transactional(overwrite(ticker, bytes, now)).thenReturn(CommitKind.UPDATED);
                    });
            })
            .doOnSuccess(kind -> log.debug("Row committed. ticker={} kind={} size={}", ticker, kind, bytes.length))
            .onErrorMap(e -> wrap("write", ticker, e));
    }

    @Override
    public Mono<Boolean> exists(Ticker ticker) {
        return template.exists(byTicker(ticker), ChartImage.class)
            .onErrorMap(e -> wrap("check", ticker, e));
    }

    @Override
    public Flux<ArtifactMetadata> list() {
        Query metadataOnly = Query.empty()
            .columns("ticker", "created_at", "updated_at")
            .sort(Sort.by(Sort.Direction.ASC, "ticker"));
        return template.select(metadataOnly, ChartImage.class)
            .map(row -> new ArtifactMetadata(new Ticker(row.getTicker()),
                toInstant(row.getCreatedAt()), toInstant(row.getUpdatedAt())))
            .onErrorMap(e -> wrap("list", null, e));
    }

    @Override
    public Mono<Boolean> remove(Ticker ticker) {
        return template.delete(byTicker(ticker), ChartImage.class)
            .map(rows -> rows > 0)
            .onErrorMap(e -> wrap("delete", ticker, e));
    }

    // ── internals ─────────────────────────────────────────────────────────────

    private Mono<Long> overwrite(Ticker ticker, byte[] bytes, LocalDateTime now) {
        return template.update(byTicker(ticker),
            Update.update("image", bytes).set("updated_at", now), ChartImage.class);
    }

    private static Query byTicker(Ticker ticker) {
        return query(where("ticker").is(ticker.value()));
    }

    private static ChartImage newRow(Ticker ticker, byte[] bytes, LocalDateTime now) {
        ChartImage row = new ChartImage();
        row.setTicker(ticker.value());
        row.setImage(bytes);
        row.setCreatedAt(now);
        row.setUpdatedAt(now);
        return row;
    }

    private Artifact toArtifact(ChartImage row) {
        return new Artifact(new Ticker(row.getTicker()), row.getImage(),
            toInstant(row.getCreatedAt()), toInstant(row.getUpdatedAt()));
    }

    private static Instant toInstant(LocalDateTime utc) {
        return utc == null ? null : utc.toInstant(ZoneOffset.UTC);
    }

    private static Throwable wrap(String op, Ticker ticker, Throwable e) {
        if (e instanceof ChartException) {
            return e;
        }
        return new StorageIoException("Database " + op + " failed"
            + (ticker == null ? "" : " for " + ticker) + ": " + e.getMessage(), e);
    }
}
