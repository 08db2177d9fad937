package com.charthost.chart.upload;

import com.charthost.chart.store.ArtifactStore;
import com.charthost.common.exception.ChartException;
import com.charthost.common.exception.InvalidSymbolFormatException;
import com.charthost.common.exception.StorageIoException;
import com.charthost.common.exception.ValidationFailureException;
import com.charthost.common.identity.TickerResolver;
import com.charthost.common.model.BatchOutcome;
import com.charthost.common.model.CommitKind;
import com.charthost.common.model.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Accepts externally supplied chart images and commits them straight to the file store.
 *
 * <p>Content is staged first, then the claimed type and name are checked: the type must be
 * {@code image/png} and the name must be a canonical {@code <TICKER>_chart.png}. The staged
 * file is deleted on every path, so a rejected upload leaves nothing behind.
 */
public class ChartUploadService {

    private static final Logger log = LoggerFactory.getLogger(ChartUploadService.class);

    private final ArtifactStore fileStore;
    private final Path          stagingDirectory;

    public ChartUploadService(ArtifactStore fileStore, Path stagingDirectory) {
        this.fileStore        = fileStore;
        this.stagingDirectory = stagingDirectory;
    }

    /**
     * @return the ticker the upload was stored under
     */
    public Mono<Ticker> acceptUpload(String filename, String mimeType, Flux<DataBuffer> content) {
        return stageAndCommit(filename, mimeType, content).map(Committed::ticker);
    }

    public Mono<Ticker> acceptUpload(String filename, String mimeType, byte[] bytes) {
        return acceptUpload(filename, mimeType,
            Flux.just(DefaultDataBufferFactory.sharedInstance.wrap(bytes)));
    }

    /**
     * Processes uploads one at a time; each gets its own outcome, none aborts the rest.
     */
    public Mono<List<BatchOutcome>> acceptUploads(List<UploadRequest> uploads) {
        return Flux.fromIterable(uploads)
            .concatMap(upload -> stageAndCommit(upload.filename(), upload.mimeType(), upload.content())
                .map(c -> BatchOutcome.success(c.ticker(), c.kind()))
                .onErrorResume(e -> Mono.just(BatchOutcome.failure(
                    upload.filename(), ChartException.reasonOf(e), e.getMessage()))))
            .collectList()
            .doOnSuccess(list -> log.info("Upload batch finished. files={} failed={}",
                list.size(), list.stream().filter(o -> !o.isSuccess()).count()));
    }

    // ── internals ─────────────────────────────────────────────────────────────

    private Mono<Committed> stageAndCommit(String filename, String mimeType, Flux<DataBuffer> content) {
        return Mono.usingWhen(
                createStagingFile(),
                staged -> DataBufferUtils.write(content, staged)
                    .then(Mono.fromCallable(() -> validate(filename, mimeType, staged))
                        .subscribeOn(Schedulers.boundedElastic()))
                    .flatMap(ticker -> Mono.fromCallable(() -> Files.readAllBytes(staged))
                        .subscribeOn(Schedulers.boundedElastic())
                        .flatMap(bytes -> fileStore.put(ticker, bytes))
                        .map(kind -> new Committed(ticker, kind))),
                this::deleteStaged)
            .onErrorMap(IOException.class, e -> new StorageIoException(
                "Could not stage upload " + filename + ": " + e.getMessage(), e))
            .doOnSuccess(c -> log.info("CHART_COMMIT ticker={} store={} kind={} source=upload",
                c.ticker(), fileStore.name(), c.kind()))
            .doOnError(e -> log.warn("Upload rejected. filename={} mimeType={} reason={} message={}",
                filename, mimeType, ChartException.reasonOf(e), e.getMessage()));
    }

    private Ticker validate(String filename, String mimeType, Path staged) throws IOException {
        if (!isPng(mimeType)) {
            throw new ValidationFailureException("Only image/png uploads are accepted, got: " + mimeType);
        }
        Ticker ticker;
        try {
            ticker = TickerResolver.keyToTicker(filename);
        } catch (InvalidSymbolFormatException e) {
            throw new ValidationFailureException(e.getMessage(), e);
        }
        if (Files.size(staged) == 0) {
            throw new ValidationFailureException("Upload " + filename + " is empty");
        }
        return ticker;
    }

    private static boolean isPng(String mimeType) {
        if (mimeType == null || mimeType.isBlank()) {
            return false;
        }
        try {
            return MediaType.IMAGE_PNG.equalsTypeAndSubtype(MediaType.parseMediaType(mimeType));
        } catch (InvalidMediaTypeException e) {
            return false;
        }
    }

    private Mono<Path> createStagingFile() {
        return Mono.fromCallable(() -> {
                Files.createDirectories(stagingDirectory);
                return Files.createTempFile(stagingDirectory, "upload-", ".part");
            })
            .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<Void> deleteStaged(Path staged) {
        return Mono.fromRunnable(() -> {
                try {
                    Files.deleteIfExists(staged);
                } catch (IOException e) {
                    log.warn("Could not delete staged upload. path={} reason={}", staged, e.getMessage());
                }
            })
            .subscribeOn(Schedulers.boundedElastic())
            .then();
    }

    private record Committed(Ticker ticker, CommitKind kind) {}
}
