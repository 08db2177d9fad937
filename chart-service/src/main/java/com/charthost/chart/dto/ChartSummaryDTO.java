package com.charthost.chart.dto;

import com.charthost.common.model.Artifact;

import java.time.Instant;

/**
 * JSON view of a cached chart: metadata plus where to download the image.
 */
public record ChartSummaryDTO(
    String  ticker,
    int     size,
    Instant createdAt,
    Instant updatedAt,
    String  imagePath
) {
    public static ChartSummaryDTO of(Artifact artifact) {
        return new ChartSummaryDTO(
            artifact.ticker().value(),
            artifact.size(),
            artifact.createdAt(),
            artifact.updatedAt(),
            "/charts/" + artifact.ticker().value());
    }
}
