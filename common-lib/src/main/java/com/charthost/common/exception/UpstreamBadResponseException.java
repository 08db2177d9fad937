package com.charthost.common.exception;

/**
 * The chart provider answered, but not with a 2xx status.
 */
public class UpstreamBadResponseException extends ChartException {
    private final int statusCode;

    public UpstreamBadResponseException(int statusCode, String message) {
        super(FailureReason.UPSTREAM_BAD_RESPONSE, message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
