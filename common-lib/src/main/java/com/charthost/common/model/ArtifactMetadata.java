package com.charthost.common.model;

import java.time.Instant;

public record ArtifactMetadata(Ticker ticker, Instant createdAt, Instant updatedAt) {}
