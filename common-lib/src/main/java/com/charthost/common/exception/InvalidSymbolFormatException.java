package com.charthost.common.exception;

public class InvalidSymbolFormatException extends ChartException {

    public InvalidSymbolFormatException(String message) {
        super(FailureReason.INVALID_SYMBOL_FORMAT, message);
    }

    public InvalidSymbolFormatException(String message, Throwable cause) {
        super(FailureReason.INVALID_SYMBOL_FORMAT, message, cause);
    }
}
