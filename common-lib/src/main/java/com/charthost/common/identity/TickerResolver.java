package com.charthost.common.identity;

import com.charthost.common.exception.InvalidSymbolFormatException;
import com.charthost.common.model.StorageKey;
import com.charthost.common.model.Ticker;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw symbols and storage filenames into canonical {@link Ticker}s.
 *
 * <p>Every entry point (JSON API, static paths, uploads, batches) goes through here before
 * any store or fetch call, so the {@code ^[A-Z0-9]+$} invariant holds everywhere downstream.
 * Input is not trimmed: surrounding whitespace is a format error like any other character.
 */
public final class TickerResolver {

    private static final Pattern RAW = Pattern.compile("^[A-Za-z0-9]+$");
    private static final Pattern KEY = Pattern.compile(
        "^([A-Z0-9]{1," + Ticker.MAX_LENGTH + "})" + Pattern.quote(StorageKey.SUFFIX) + "$");

    private TickerResolver() {}

    /**
     * @param raw symbol as supplied by the caller, any case
     * @return the uppercased ticker
     * @throws InvalidSymbolFormatException if raw is null, empty, longer than
     *         {@link Ticker#MAX_LENGTH} or not alphanumeric
     */
    public static Ticker resolve(String raw) {
        if (raw == null || raw.isEmpty()) {
            throw new InvalidSymbolFormatException("Symbol is required");
        }
        if (raw.length() > Ticker.MAX_LENGTH) {
            throw new InvalidSymbolFormatException(
                "Symbol exceeds " + Ticker.MAX_LENGTH + " characters: " + raw);
        }
        if (!RAW.matcher(raw).matches()) {
            throw new InvalidSymbolFormatException(
                "Symbol must contain only letters and digits: " + raw);
        }
        return new Ticker(raw.toUpperCase(Locale.ROOT));
    }

    public static StorageKey deriveKey(Ticker ticker) {
        return StorageKey.of(ticker);
    }

    /**
     * Inverse of {@link #deriveKey(Ticker)}. Only the canonical form is accepted,
     * so {@code aapl_chart.png} is rejected rather than aliased onto {@code AAPL}.
     */
    public static Ticker keyToTicker(String filename) {
        if (filename == null) {
            throw new InvalidSymbolFormatException("Filename is required");
        }
        Matcher m = KEY.matcher(filename);
        if (!m.matches()) {
            throw new InvalidSymbolFormatException(
                "Filename must look like <TICKER>" + StorageKey.SUFFIX + ": " + filename);
        }
        return new Ticker(m.group(1));
    }

    public static Ticker keyToTicker(StorageKey key) {
        return keyToTicker(key.filename());
    }
}
