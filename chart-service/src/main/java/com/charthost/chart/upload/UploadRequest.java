package com.charthost.chart.upload;

import org.springframework.core.io.buffer.DataBuffer;
import reactor.core.publisher.Flux;

/**
 * One uploaded file as received from the web layer: claimed name, claimed type, raw content.
 */
public record UploadRequest(String filename, String mimeType, Flux<DataBuffer> content) {}
