package com.opsdashboard.infrastructure.seed;

import com.opsdashboard.config.DashboardProperties;
import com.opsdashboard.domain.model.Domain;
import com.opsdashboard.domain.model.FilterSpecification;
import com.opsdashboard.domain.model.ReportShape;
import com.opsdashboard.domain.service.ReportService;
import com.opsdashboard.infrastructure.cache.ReportCacheService;
import com.opsdashboard.infrastructure.persistence.entity.EquipmentMetricEntity;
import com.opsdashboard.infrastructure.persistence.entity.TransactionEntity;
import com.opsdashboard.infrastructure.persistence.repository.EquipmentMetricRepository;
import com.opsdashboard.infrastructure.persistence.repository.TransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Fills empty tables with demo data at startup.
 *
 * Enabled with {@code dashboard.seed.enabled=true}. Transactions span the last
 * 90 days with mostly completed statuses; equipment readings span the last 30
 * days and get their status from how far the value strays from the metric's
 * normal range.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "dashboard.seed", name = "enabled", havingValue = "true")
public class DemoDataSeeder implements ApplicationRunner {

    static final List<String> CATEGORIES = List.of("sales", "refund", "subscription", "service", "product");
    static final List<String> STATUSES = List.of("completed", "pending", "failed", "cancelled");
    static final int[] STATUS_WEIGHTS = {70, 15, 10, 5};

    static final List<String> EQUIPMENT_IDS = List.of(
            "PUMP-A1", "PUMP-A2", "PUMP-B1",
            "COMPRESSOR-01", "COMPRESSOR-02",
            "TURBINE-T1", "TURBINE-T2",
            "MOTOR-M1", "MOTOR-M2", "MOTOR-M3");

    static final Map<String, NormalRange> NORMAL_RANGES = Map.of(
            "temperature", new NormalRange(35, 75, "°C"),
            "cpu_load", new NormalRange(20, 85, "%"),
            "memory_usage", new NormalRange(30, 80, "%"),
            "vibration", new NormalRange(0.5, 4.0, "mm/s"),
            "pressure", new NormalRange(2.5, 8.5, "bar"),
            "rpm", new NormalRange(1200, 3000, "rpm"),
            "power_consumption", new NormalRange(15, 95, "kW"),
            "efficiency", new NormalRange(70, 95, "%"));

    private final TransactionRepository transactionRepository;
    private final EquipmentMetricRepository equipmentMetricRepository;
    private final ReportService reportService;
    private final ReportCacheService cacheService;
    private final DashboardProperties properties;

    private final Random random = new Random();
    private final Clock clock = Clock.systemDefaultZone();

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        DashboardProperties.Seed seed = properties.getSeed();

        if (transactionRepository.count() == 0) {
            transactionRepository.saveAll(transactions(seed.getTransactions()));
            log.info("Seeded {} transactions", seed.getTransactions());
            invalidateFilterOptions(Domain.TRANSACTIONS);
        } else {
            log.info("Transactions already present, skipping seed");
        }

        if (equipmentMetricRepository.count() == 0) {
            equipmentMetricRepository.saveAll(equipmentMetrics(seed.getEquipmentMetrics()));
            log.info("Seeded {} equipment metrics", seed.getEquipmentMetrics());
            invalidateFilterOptions(Domain.EQUIPMENT);
        } else {
            log.info("Equipment metrics already present, skipping seed");
        }
    }

    List<TransactionEntity> transactions(int count) {
        LocalDateTime start = LocalDateTime.now(clock).minusDays(90);
        List<TransactionEntity> rows = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String category = pick(CATEGORIES);
            rows.add(TransactionEntity.builder()
                    .date(start.plusDays(random.nextInt(91)))
                    .category(category)
                    // log-normal, weighted towards small amounts
                    .amount(round(Math.exp(4 + 1.5 * random.nextGaussian()), 2))
                    .status(weightedStatus())
                    .description(description(category))
                    .customerId(random.nextDouble() > 0.2 ? "CUST" + (1000 + random.nextInt(9000)) : null)
                    .build());
        }
        return rows;
    }

    List<EquipmentMetricEntity> equipmentMetrics(int count) {
        LocalDateTime start = LocalDateTime.now(clock).minusDays(30);
        List<String> metricNames = new ArrayList<>(NORMAL_RANGES.keySet());
        metricNames.sort(null);

        List<EquipmentMetricEntity> rows = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String metricName = pick(metricNames);
            NormalRange range = NORMAL_RANGES.get(metricName);
            double value = reading(range);
            value = "rpm".equals(metricName) ? Math.rint(value) : round(value, 2);

            rows.add(EquipmentMetricEntity.builder()
                    .timestamp(start.plusHours(random.nextInt(30 * 24 + 1)))
                    .equipmentId(pick(EQUIPMENT_IDS))
                    .metricName(metricName)
                    .value(value)
                    .unit(range.unit)
                    .status(range.statusOf(value))
                    .build());
        }
        return rows;
    }

    // 15% of readings fall outside the normal range
    private double reading(NormalRange range) {
        if (random.nextDouble() > 0.85) {
            return random.nextBoolean()
                    ? uniform(range.max * 1.05, range.max * 1.25)
                    : uniform(range.min * 0.5, range.min * 0.9);
        }
        return uniform(range.min, range.max);
    }

    private String weightedStatus() {
        int roll = random.nextInt(100);
        int cumulative = 0;
        for (int i = 0; i < STATUSES.size(); i++) {
            cumulative += STATUS_WEIGHTS[i];
            if (roll < cumulative) {
                return STATUSES.get(i);
            }
        }
        return STATUSES.get(0);
    }

    private String description(String category) {
        return switch (random.nextInt(4)) {
            case 0 -> Character.toUpperCase(category.charAt(0)) + category.substring(1) + " transaction";
            case 1 -> "Monthly " + category;
            case 2 -> "One-time " + category;
            default -> null;
        };
    }

    private void invalidateFilterOptions(Domain domain) {
        cacheService.invalidate(reportService.cacheKey(domain, ReportShape.FILTER_OPTIONS,
                FilterSpecification.unrestricted()));
    }

    private <T> T pick(List<T> values) {
        return values.get(random.nextInt(values.size()));
    }

    private double uniform(double low, double high) {
        return low + (high - low) * random.nextDouble();
    }

    private static double round(double value, int decimals) {
        double scale = Math.pow(10, decimals);
        return Math.round(value * scale) / scale;
    }

    static final class NormalRange {
        final double min;
        final double max;
        final String unit;

        NormalRange(double min, double max, String unit) {
            this.min = min;
            this.max = max;
            this.unit = unit;
        }

        String statusOf(double value) {
            if (value > max * 1.1 || value < min * 0.8) {
                return "critical";
            }
            if (value > max * 0.95 || value < min * 0.9) {
                return "warning";
            }
            return "normal";
        }
    }
}
