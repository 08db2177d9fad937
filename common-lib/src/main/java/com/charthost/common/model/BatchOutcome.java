package com.charthost.common.model;

import com.charthost.common.exception.FailureReason;

/**
 * Result of one item in a batch request. A batch always yields exactly one outcome per
 * input, in input order, whatever happened to the other items.
 *
 * <p>{@code ticker} is the raw input symbol for failures, since a symbol that failed
 * resolution has no canonical form.
 */
public interface BatchOutcome {

    String ticker();

    boolean isSuccess();

    static BatchOutcome success(Ticker ticker, CommitKind committed) {
        return new Success(ticker.value(), committed);
    }

    static BatchOutcome failure(String rawTicker, FailureReason reason, String message) {
        return new Failure(rawTicker, reason, message);
    }

    record Success(String ticker, CommitKind committed) implements BatchOutcome {
        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    record Failure(String ticker, FailureReason reason, String message) implements BatchOutcome {
        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
