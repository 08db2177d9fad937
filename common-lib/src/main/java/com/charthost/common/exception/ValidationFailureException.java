package com.charthost.common.exception;

public class ValidationFailureException extends ChartException {

    public ValidationFailureException(String message) {
        super(FailureReason.VALIDATION_FAILURE, message);
    }

    public ValidationFailureException(String message, Throwable cause) {
        super(FailureReason.VALIDATION_FAILURE, message, cause);
    }
}
