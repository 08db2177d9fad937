package com.charthost.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Filename of a ticker's cached chart, {@code <TICKER>_chart.png}. Used as the file name in
 * the file backend and in public URLs.
 */
public record StorageKey(@JsonValue String filename) {

    public static final String SUFFIX = "_chart.png";

    public static StorageKey of(Ticker ticker) {
        return new StorageKey(ticker.value() + SUFFIX);
    }

    @Override
    public String toString() {
        return filename;
    }
}
