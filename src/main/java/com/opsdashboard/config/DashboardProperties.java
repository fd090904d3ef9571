package com.opsdashboard.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Application settings, bound once at startup.
 *
 * Passed explicitly to the components that need them; nothing reads these
 * values from global state at request time.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "dashboard")
public class DashboardProperties {

    @NotBlank
    private String appName = "Dashboard Analytics";

    private boolean debug = false;

    @NotBlank
    private String locale = "en";

    @Valid
    private Pagination pagination = new Pagination();

    @Valid
    private Seed seed = new Seed();

    private Cors cors = new Cors();

    @Data
    public static class Pagination {

        @Min(1)
        private int defaultPageSize = 100;

        @Min(1)
        private int maxPageSize = 1000;
    }

    @Data
    public static class Seed {

        private boolean enabled = false;

        @Min(0)
        private int transactions = 200;

        @Min(0)
        private int equipmentMetrics = 1000;
    }

    @Data
    public static class Cors {

        /** Origin patterns; "*" admits any origin, credentials included. */
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    }
}
