package com.charthost.common.exception;

/**
 * Closed set of reasons a chart operation can fail with. Carried by every
 * {@link ChartException} and by failed batch outcomes.
 */
public enum FailureReason {
    INVALID_SYMBOL_FORMAT,
    NOT_FOUND,
    UPSTREAM_TIMEOUT,
    UPSTREAM_UNAVAILABLE,
    UPSTREAM_BAD_RESPONSE,
    VALIDATION_FAILURE,
    BACKEND_UNAVAILABLE,
    STORAGE_IO_FAILURE
}
