package com.charthost.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.regex.Pattern;

/**
 * Canonical stock symbol: 1 to 10 uppercase ASCII letters or digits.
 *
 * <p>Raw user input goes through {@code TickerResolver}; this constructor only
 * re-checks the invariant so an invalid ticker can never reach a store or the network.
 */
public record Ticker(@JsonValue String value) implements Comparable<Ticker> {

    public static final int MAX_LENGTH = 10;

    private static final Pattern CANONICAL = Pattern.compile("^[A-Z0-9]{1," + MAX_LENGTH + "}$");

    public Ticker {
        if (value == null || !CANONICAL.matcher(value).matches()) {
            throw new IllegalArgumentException("Not a canonical ticker: " + value);
        }
    }

    public static boolean isCanonical(String value) {
        return value != null && CANONICAL.matcher(value).matches();
    }

    @Override
    public int compareTo(Ticker other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
