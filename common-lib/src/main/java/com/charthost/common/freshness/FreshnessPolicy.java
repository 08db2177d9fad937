package com.charthost.common.freshness;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Decides whether a cached chart can be served as-is.
 *
 * <p>A chart is fresh while {@code now - updatedAt < ttl}; at exactly {@code ttl} it is stale.
 * A missing timestamp is never fresh, which makes "never fetched" and "absent" the same case.
 */
public final class FreshnessPolicy {

    private final Duration ttl;
    private final Clock clock;

    public FreshnessPolicy(Duration ttl, Clock clock) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive: " + ttl);
        }
        this.ttl = ttl;
        this.clock = clock;
    }

    public static FreshnessPolicy ofHours(long hours, Clock clock) {
        return new FreshnessPolicy(Duration.ofHours(hours), clock);
    }

    public static boolean isFresh(Instant updatedAt, Instant now, Duration ttl) {
        if (updatedAt == null) {
            return false;
        }
        return Duration.between(updatedAt, now).compareTo(ttl) < 0;
    }

    public boolean isFresh(Instant updatedAt) {
        return isFresh(updatedAt, clock.instant(), ttl);
    }

    public Duration ttl() {
        return ttl;
    }
}
