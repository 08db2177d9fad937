package com.charthost.chart.config;

import com.charthost.chart.cache.ChartCacheService;
import com.charthost.chart.client.ChartFetcher;
import com.charthost.chart.store.StoreContext;
import com.charthost.chart.store.StoreSettings;
import com.charthost.chart.upload.ChartUploadService;
import com.charthost.common.freshness.FreshnessPolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Storage and cache wiring. Two cache instances share one fetcher and one freshness policy:
 * {@code relationalChartCache} behind the JSON API, {@code fileChartCache} behind the static paths.
 */
@Configuration
public class ChartCacheConfig {

    @Value("${chart.cache.ttl-hours:24}")
    private long ttlHours;

    @Value("${chart.database.url:}")
    private String databaseUrl;

    @Value("${chart.database.username:}")
    private String databaseUsername;

    @Value("${chart.database.password:}")
    private String databasePassword;

    @Value("${chart.database.pool-size:10}")
    private int poolSize;

    @Value("${chart.database.startup-timeout-ms:15000}")
    private long startupTimeoutMs;

    @Value("${chart.storage.directory:./charts}")
    private String storageDirectory;

    @Value("${chart.storage.staging-directory:${java.io.tmpdir}/chart-staging}")
    private String stagingDirectory;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public FreshnessPolicy freshnessPolicy(Clock clock) {
        return FreshnessPolicy.ofHours(ttlHours, clock);
    }

    @Bean(destroyMethod = "close")
    public StoreContext storeContext(Clock clock) throws IOException {
        StoreSettings settings = new StoreSettings(
            databaseUrl, databaseUsername, databasePassword, poolSize,
            Path.of(storageDirectory), Duration.ofMillis(startupTimeoutMs));
        return StoreContext.initialize(settings, clock);
    }

    @Bean
    public ChartCacheService relationalChartCache(StoreContext storeContext, ChartFetcher chartFetcher,
                                                  FreshnessPolicy freshnessPolicy) {
        return new ChartCacheService(storeContext.relational(), chartFetcher, freshnessPolicy);
    }

    @Bean
    public ChartCacheService fileChartCache(StoreContext storeContext, ChartFetcher chartFetcher,
                                            FreshnessPolicy freshnessPolicy) {
        return new ChartCacheService(storeContext.fileStore(), chartFetcher, freshnessPolicy);
    }

    @Bean
    public ChartUploadService chartUploadService(StoreContext storeContext) {
        return new ChartUploadService(storeContext.fileStore(), Path.of(stagingDirectory));
    }
}
