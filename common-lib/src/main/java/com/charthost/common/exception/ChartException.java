package com.charthost.common.exception;

/**
 * Root of the chart cache error taxonomy. Each subclass pins one {@link FailureReason};
 * the web layer maps reasons to status codes, the batch path records them per item.
 */
public class ChartException extends RuntimeException {
    private final FailureReason reason;

    public ChartException(FailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ChartException(FailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public FailureReason getReason() {
        return reason;
    }

    /**
     * Classifies any throwable. Anything outside the taxonomy counts as a storage failure,
     * since stores are the only collaborators that surface foreign exceptions.
     */
    public static FailureReason reasonOf(Throwable t) {
        if (t instanceof ChartException ce) {
            return ce.getReason();
        }
        return FailureReason.STORAGE_IO_FAILURE;
    }
}
