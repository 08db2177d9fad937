package com.charthost.chart.store;

import com.charthost.common.exception.StorageIoException;
import com.charthost.common.identity.TickerResolver;
import com.charthost.common.model.Artifact;
import com.charthost.common.model.ArtifactMetadata;
import com.charthost.common.model.CommitKind;
import com.charthost.common.model.StorageKey;
import com.charthost.common.model.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.nio.file.attribute.UserDefinedFileAttributeView;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * File backend: one {@code <TICKER>_chart.png} per ticker under a fixed directory.
 *
 * <p>Freshness comes from the file's last-modified time; the first-insert time is kept in the
 * {@value #CREATED_AT_ATTRIBUTE} user attribute. Writes go to a hidden temp file in the same
 * directory which is then renamed over the target, so a reader sees the old file or the new
 * one, and writes to one ticker are serialized within the process. File I/O is blocking and
 * runs on {@link Schedulers#boundedElastic()}.
 */
public class FileArtifactStore implements ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(FileArtifactStore.class);

    static final String CREATED_AT_ATTRIBUTE = "chart.created-at";

    private static final int MAX_READ_ATTEMPTS = 5;

    private final Path directory;
    private final Clock clock;
    private final ConcurrentHashMap<Ticker, Object> writeLocks = new ConcurrentHashMap<>();

    public FileArtifactStore(Path directory, Clock clock) throws IOException {
        this.directory = Files.createDirectories(directory);
        this.clock     = clock;
    }

    @Override
    public String name() {
        return "file";
    }

    public Path directory() {
        return directory;
    }

    public Path pathOf(Ticker ticker) {
        return directory.resolve(TickerResolver.deriveKey(ticker).filename());
    }

    @Override
    public Mono<Artifact> get(Ticker ticker) {
        return blocking("read", ticker, () -> read(ticker));
    }

    @Override
    public Mono<CommitKind> put(Ticker ticker, byte[] bytes) {
        return blocking("write", ticker, () -> write(ticker, bytes))
            .doOnSuccess(kind -> log.debug("File committed. ticker={} kind={} size={}", ticker, kind, bytes.length));
    }

    @Override
    public Mono<Boolean> exists(Ticker ticker) {
        return blocking("check", ticker, () -> Files.isRegularFile(pathOf(ticker)));
    }

    @Override
    public Flux<ArtifactMetadata> list() {
        return blocking("list", null, this::scan).flatMapMany(Flux::fromIterable);
    }

    @Override
    public Mono<Boolean> remove(Ticker ticker) {
        return blocking("delete", ticker, () -> Files.deleteIfExists(pathOf(ticker)));
    }

    // ── internals ─────────────────────────────────────────────────────────────

    private Artifact read(Ticker ticker) throws IOException {
        Path file = pathOf(ticker);
        try {
            for (int attempt = 1; attempt <= MAX_READ_ATTEMPTS; attempt++) {
                BasicFileAttributes before = Files.readAttributes(file, BasicFileAttributes.class);
                byte[] bytes = Files.readAllBytes(file);
                Instant createdAt = createdAt(file, before);
                BasicFileAttributes after = Files.readAttributes(file, BasicFileAttributes.class);
                if (sameVersion(before, after)) {
                    return new Artifact(ticker, bytes, createdAt, before.lastModifiedTime().toInstant());
                }
                log.debug("File replaced while reading, retrying. ticker={} attempt={}", ticker, attempt);
            }
        } catch (NoSuchFileException e) {
            return null;
        }
        throw new IOException("File kept changing while being read: " + file.getFileName());
    }

    private CommitKind write(Ticker ticker, byte[] bytes) throws IOException {
        synchronized (writeLocks.computeIfAbsent(ticker, k -> new Object())) {
            Path target = pathOf(ticker);
            Instant now = clock.instant();
            Instant createdAt = existingCreatedAt(target);
            Path temp = Files.createTempFile(directory, "." + ticker.value() + "-", ".tmp");
            try {
                Files.write(temp, bytes);
                stampCreatedAt(temp, createdAt == null ? now : createdAt);
                Files.setLastModifiedTime(temp, FileTime.from(now));
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(temp);
            }
            return createdAt == null ? CommitKind.INSERTED : CommitKind.UPDATED;
        }
    }

    private List<ArtifactMetadata> scan() throws IOException {
        List<ArtifactMetadata> out = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                String name = file.getFileName().toString();
                if (!name.endsWith(StorageKey.SUFFIX)) continue;
                String symbol = name.substring(0, name.length() - StorageKey.SUFFIX.length());
                if (!Ticker.isCanonical(symbol) || !Files.isRegularFile(file)) continue;
                try {
                    BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
                    out.add(new ArtifactMetadata(new Ticker(symbol),
                        createdAt(file, attrs), attrs.lastModifiedTime().toInstant()));
                } catch (NoSuchFileException e) {
                    log.debug("File vanished during listing. file={}", name);
                }
            }
        }
        out.sort(Comparator.comparing(ArtifactMetadata::ticker));
        return out;
    }

    // ── creation time ─────────────────────────────────────────────────────────
    // The rename replaces the inode on every write, so the first-insert time travels in a
    // user-defined attribute. Where the file system has none, last-modified stands in.

    private Instant existingCreatedAt(Path target) throws IOException {
        try {
            return createdAt(target, Files.readAttributes(target, BasicFileAttributes.class));
        } catch (NoSuchFileException e) {
            return null;
        }
    }

    private static Instant createdAt(Path file, BasicFileAttributes attrs) throws IOException {
        UserDefinedFileAttributeView view = Files.getFileAttributeView(file, UserDefinedFileAttributeView.class);
        if (view != null) {
            try {
                ByteBuffer buf = ByteBuffer.allocate(view.size(CREATED_AT_ATTRIBUTE));
                view.read(CREATED_AT_ATTRIBUTE, buf);
                buf.flip();
                return Instant.parse(StandardCharsets.US_ASCII.decode(buf));
            } catch (NoSuchFileException e) {
                throw e;
            } catch (IOException | UnsupportedOperationException | DateTimeParseException e) {
                log.debug("No stored creation time, using last-modified. file={} reason={}",
                    file.getFileName(), e.getMessage());
            }
        }
        return attrs.lastModifiedTime().toInstant();
    }

    private static void stampCreatedAt(Path file, Instant createdAt) {
        UserDefinedFileAttributeView view = Files.getFileAttributeView(file, UserDefinedFileAttributeView.class);
        if (view == null) {
            return;
        }
        try {
            view.write(CREATED_AT_ATTRIBUTE, StandardCharsets.US_ASCII.encode(createdAt.toString()));
        } catch (IOException | UnsupportedOperationException e) {
            log.debug("User attributes unsupported, creation time falls back to last-modified. file={} reason={}",
                file.getFileName(), e.getMessage());
        }
    }

    private static boolean sameVersion(BasicFileAttributes a, BasicFileAttributes b) {
        return Objects.equals(a.fileKey(), b.fileKey())
            && a.lastModifiedTime().equals(b.lastModifiedTime())
            && a.size() == b.size();
    }

    private <T> Mono<T> blocking(String op, Ticker ticker, IoCall<T> call) {
        return Mono.fromCallable(call::call)
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorMap(IOException.class, e -> new StorageIoException("File " + op + " failed"
                + (ticker == null ? "" : " for " + ticker) + ": " + e.getMessage(), e));
    }

    @FunctionalInterface
    private interface IoCall<T> {
        T call() throws IOException;
    }
}
