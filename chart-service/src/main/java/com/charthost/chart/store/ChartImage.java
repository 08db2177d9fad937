package com.charthost.chart.store;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One cached chart in {@code chart_images}, keyed by ticker. Timestamps are UTC.
 */
@Data
@NoArgsConstructor
@Table("chart_images")
public class ChartImage {

    @Id
    private String        ticker;

    private byte[]        image;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
