package com.charthost.chart;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.r2dbc.R2dbcDataAutoConfiguration;
import org.springframework.boot.autoconfigure.data.r2dbc.R2dbcRepositoriesAutoConfiguration;
import org.springframework.boot.autoconfigure.r2dbc.R2dbcAutoConfiguration;
import org.springframework.boot.autoconfigure.r2dbc.R2dbcTransactionManagerAutoConfiguration;

/**
 * Chart image host. The connection pool is owned by
 * {@link com.charthost.chart.store.StoreContext}, so Spring's R2DBC auto-configuration is off:
 * a missing database URL must mean degraded mode, not a failed startup.
 */
@SpringBootApplication(exclude = {
    R2dbcAutoConfiguration.class,
    R2dbcDataAutoConfiguration.class,
    R2dbcRepositoriesAutoConfiguration.class,
    R2dbcTransactionManagerAutoConfiguration.class
})
public class ChartServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChartServiceApplication.class, args);
    }
}
