package com.charthost.common.model;

import com.charthost.common.exception.ChartException;
import com.charthost.common.exception.FailureReason;
import com.charthost.common.exception.UpstreamTimeoutException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class BatchOutcomeTest {

    @Test
    void successAndFailureAreTagged() {
        BatchOutcome ok = BatchOutcome.success(new Ticker("AAPL"), CommitKind.INSERTED);
        BatchOutcome bad = BatchOutcome.failure("BAD$", FailureReason.INVALID_SYMBOL_FORMAT, "nope");

        assertThat(ok.isSuccess()).isTrue();
        assertThat(ok).isEqualTo(new BatchOutcome.Success("AAPL", CommitKind.INSERTED));
        assertThat(bad.isSuccess()).isFalse();
        assertThat(((BatchOutcome.Failure) bad).reason()).isEqualTo(FailureReason.INVALID_SYMBOL_FORMAT);
        assertThat(bad.ticker()).isEqualTo("BAD$");
    }

    @Test
    void unknownThrowablesClassifyAsStorageFailures() {
        assertThat(ChartException.reasonOf(new UpstreamTimeoutException("slow")))
            .isEqualTo(FailureReason.UPSTREAM_TIMEOUT);
        assertThat(ChartException.reasonOf(new IllegalStateException("boom")))
            .isEqualTo(FailureReason.STORAGE_IO_FAILURE);
    }

    @Test
    void artifactEqualityComparesBytes() {
        Instant t = Instant.parse("2024-01-01T00:00:00Z");
        Artifact a = new Artifact(new Ticker("MSFT"), new byte[] {1, 2, 3}, t, t);
        Artifact b = new Artifact(new Ticker("MSFT"), new byte[] {1, 2, 3}, t, t);

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a.size()).isEqualTo(3);
        assertThat(a.metadata()).isEqualTo(new ArtifactMetadata(new Ticker("MSFT"), t, t));
    }

    @Test
    void artifactBytesCannotBeChangedFromOutside() {
        Instant t = Instant.parse("2024-01-01T00:00:00Z");
        byte[] source = {1, 2, 3};
        Artifact a = new Artifact(new Ticker("MSFT"), source, t, t);

        source[0] = 9;
        a.bytes()[1] = 9;

        assertThat(a.bytes()).containsExactly(new byte[] {1, 2, 3});
    }
}
