package com.charthost.common.exception;

public class ArtifactNotFoundException extends ChartException {

    public ArtifactNotFoundException(String message) {
        super(FailureReason.NOT_FOUND, message);
    }

    public ArtifactNotFoundException(String message, Throwable cause) {
        super(FailureReason.NOT_FOUND, message, cause);
    }
}
