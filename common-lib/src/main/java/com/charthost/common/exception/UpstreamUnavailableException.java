package com.charthost.common.exception;

public class UpstreamUnavailableException extends ChartException {

    public UpstreamUnavailableException(String message) {
        super(FailureReason.UPSTREAM_UNAVAILABLE, message);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(FailureReason.UPSTREAM_UNAVAILABLE, message, cause);
    }
}
