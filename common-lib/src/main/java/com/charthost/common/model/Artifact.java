package com.charthost.common.model;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * A cached chart image plus its timestamps. {@code updatedAt} is the freshness clock:
 * a stored column in the relational backend, the last-modified time in the file backend.
 *
 * <p>One artifact can be handed to several subscribers at once, so the image bytes are copied
 * on the way in and on every {@link #bytes()} call.
 */
public record Artifact(Ticker ticker, byte[] bytes, Instant createdAt, Instant updatedAt) {

    public Artifact {
        bytes = bytes == null ? null : bytes.clone();
    }

    @Override
    public byte[] bytes() {
        return bytes == null ? null : bytes.clone();
    }

    public int size() {
        return bytes == null ? 0 : bytes.length;
    }

    public ArtifactMetadata metadata() {
        return new ArtifactMetadata(ticker, createdAt, updatedAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Artifact other)) return false;
        return ticker.equals(other.ticker)
            && Arrays.equals(bytes, other.bytes)
            && Objects.equals(createdAt, other.createdAt)
            && Objects.equals(updatedAt, other.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ticker, Arrays.hashCode(bytes), createdAt, updatedAt);
    }

    @Override
    public String toString() {
        return "Artifact[ticker=" + ticker + ", size=" + size()
            + ", createdAt=" + createdAt + ", updatedAt=" + updatedAt + "]";
    }
}
