package com.charthost.chart.controller;

import com.charthost.common.exception.ChartException;
import com.charthost.common.exception.FailureReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Single mapping from {@link FailureReason} to HTTP status for every controller.
 * The failure message goes back verbatim.
 */
final class ChartErrorResponses {

    private static final Logger log = LoggerFactory.getLogger(ChartErrorResponses.class);

    private ChartErrorResponses() {}

    static HttpStatus statusOf(FailureReason reason) {
        return switch (reason) {
            case INVALID_SYMBOL_FORMAT, VALIDATION_FAILURE -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND                                 -> HttpStatus.NOT_FOUND;
            case BACKEND_UNAVAILABLE                       -> HttpStatus.SERVICE_UNAVAILABLE;
            case UPSTREAM_TIMEOUT                          -> HttpStatus.GATEWAY_TIMEOUT;
            case UPSTREAM_UNAVAILABLE, UPSTREAM_BAD_RESPONSE -> HttpStatus.BAD_GATEWAY;
            case STORAGE_IO_FAILURE                        -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    static Mono<ResponseEntity<Object>> toResponse(Throwable e) {
        FailureReason reason = ChartException.reasonOf(e);
        HttpStatus status = statusOf(reason);
        if (status.is5xxServerError()) {
            log.error("Request failed. reason={} status={}", reason, status.value(), e);
        } else {
            log.info("Request rejected. reason={} status={} message={}", reason, status.value(), e.getMessage());
        }
        return Mono.just(error(status, reason.name(), e.getMessage()));
    }

    static ResponseEntity<Object> error(HttpStatus status, String reason, String message) {
        return ResponseEntity.status(status)
            .contentType(MediaType.APPLICATION_JSON)
            .body(Map.of("error", message == null ? reason : message, "reason", reason));
    }

    static ResponseEntity<Object> badRequest(String message) {
        return error(HttpStatus.BAD_REQUEST, FailureReason.VALIDATION_FAILURE.name(), message);
    }
}
