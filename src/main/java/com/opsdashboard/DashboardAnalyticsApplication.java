package com.opsdashboard;

import com.opsdashboard.config.DashboardProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Operational Dashboard Analytics
 *
 * Reporting back end for two tabular domains (financial transactions and
 * equipment telemetry) that share one filtering and aggregation engine.
 *
 * Architecture:
 * - REST APIs per domain and report shape (metrics, time series, breakdown, list, filter options)
 * - Filter parsing -> single store fetch -> in-memory aggregation or pagination
 * - Spring Data JPA store behind a narrow RecordStore boundary
 * - Optional Redis cache in front of the engine
 */
@SpringBootApplication
@EnableConfigurationProperties(DashboardProperties.class)
public class DashboardAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(DashboardAnalyticsApplication.class, args);
    }
}
