package com.charthost.common.exception;

public class UpstreamTimeoutException extends ChartException {

    public UpstreamTimeoutException(String message) {
        super(FailureReason.UPSTREAM_TIMEOUT, message);
    }

    public UpstreamTimeoutException(String message, Throwable cause) {
        super(FailureReason.UPSTREAM_TIMEOUT, message, cause);
    }
}
