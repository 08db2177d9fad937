package com.charthost.chart.controller;

import com.charthost.chart.dto.UploadResultDTO;
import com.charthost.chart.upload.ChartUploadService;
import com.charthost.chart.upload.UploadRequest;
import com.charthost.common.identity.TickerResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Multipart uploads of ready-made charts into the file store.
 */
@RestController
public class UploadController {

    private static final Logger log = LoggerFactory.getLogger(UploadController.class);

    private final ChartUploadService uploads;
    private final PublicUrls         publicUrls;

    public UploadController(ChartUploadService uploads, PublicUrls publicUrls) {
        this.uploads    = uploads;
        this.publicUrls = publicUrls;
    }

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<ResponseEntity<Object>> upload(@RequestPart("file") Mono<FilePart> file) {
        return file
            .doOnNext(part -> log.info("Upload received. filename={}", part.filename()))
            .flatMap(part -> uploads.acceptUpload(part.filename(), contentType(part), part.content()))
            .map(ticker -> ResponseEntity.ok().<Object>body(new UploadResultDTO(
                ticker.value(),
                TickerResolver.deriveKey(ticker).filename(),
                publicUrls.staticChart(ticker))))
            .switchIfEmpty(Mono.fromSupplier(() -> ChartErrorResponses.badRequest("file part is required")))
            .onErrorResume(ChartErrorResponses::toResponse);
    }

    @PostMapping(value = "/upload-batch", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<ResponseEntity<Object>> uploadBatch(@RequestPart("files") Flux<FilePart> files) {
        return files
            .map(part -> new UploadRequest(part.filename(), contentType(part), part.content()))
            .collectList()
            .flatMap(requests -> {
                if (requests.isEmpty()) {
                    return Mono.just(ChartErrorResponses.badRequest("files must contain at least one file"));
                }
                log.info("Upload batch received. files={}", requests.size());
                return uploads.acceptUploads(requests)
                    .map(outcomes -> ResponseEntity.ok().<Object>body(ChartController.batchBody(outcomes)));
            });
    }

    private static String contentType(FilePart part) {
        MediaType type = part.headers().getContentType();
        return type == null ? null : type.toString();
    }
}
