package com.charthost.chart.dto;

import com.charthost.common.model.ArtifactMetadata;

import java.time.Instant;

public record SymbolEntryDTO(String ticker, Instant createdAt, Instant updatedAt) {

    public static SymbolEntryDTO of(ArtifactMetadata m) {
        return new SymbolEntryDTO(m.ticker().value(), m.createdAt(), m.updatedAt());
    }
}
