package com.charthost.chart.store;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Inputs for {@link StoreContext#initialize}. A blank {@code databaseUrl} means degraded mode.
 */
public record StoreSettings(
    String   databaseUrl,
    String   username,
    String   password,
    int      poolSize,
    Path     storageDirectory,
    Duration startupTimeout
) {
    public boolean relationalConfigured() {
        return databaseUrl != null && !databaseUrl.isBlank();
    }
}
