package com.charthost.common.exception;

public class StorageIoException extends ChartException {

    public StorageIoException(String message) {
        super(FailureReason.STORAGE_IO_FAILURE, message);
    }

    public StorageIoException(String message, Throwable cause) {
        super(FailureReason.STORAGE_IO_FAILURE, message, cause);
    }
}
