package com.charthost.common.exception;

public class BackendUnavailableException extends ChartException {

    public BackendUnavailableException(String message) {
        super(FailureReason.BACKEND_UNAVAILABLE, message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(FailureReason.BACKEND_UNAVAILABLE, message, cause);
    }
}
