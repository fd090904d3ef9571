package com.opsdashboard.domain.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.opsdashboard.domain.model.BreakdownEntry;
import com.opsdashboard.domain.model.Domain;
import com.opsdashboard.domain.model.FilterOptions;
import com.opsdashboard.domain.model.FilterSpecification;
import com.opsdashboard.domain.model.Granularity;
import com.opsdashboard.domain.model.MetricResult;
import com.opsdashboard.domain.model.PageResult;
import com.opsdashboard.domain.model.RecordSchema;
import com.opsdashboard.domain.model.RecordSchemas;
import com.opsdashboard.domain.model.ReportResponse;
import com.opsdashboard.domain.model.ReportShape;
import com.opsdashboard.domain.model.RowSet;
import com.opsdashboard.domain.model.SortDirection;
import com.opsdashboard.domain.model.TimeSeriesPoint;
import com.opsdashboard.infrastructure.cache.ReportCacheService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Serves one report per request.
 *
 * Report Flow:
 * 1. Parse raw parameters into a FilterSpecification (validation errors stop here)
 * 2. Check cache (Redis), keyed by shape + domain + normalized filter
 * 3. On a miss, fetch the filtered rows once
 * 4. Aggregate or page them
 * 5. Store result in cache
 *
 * The engine components stay pure; caching and metrics live only here.
 * Errors raised while computing a report are counted and rethrown unchanged.
 *
 * Caching Strategy:
 * - Lists: short TTL (rows change as data arrives)
 * - Aggregates (metrics, series, breakdowns): longer TTL
 * - Filter options: longest TTL (distinct values change slowly)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportService {

    private static final TypeReference<MetricResult> METRICS_TYPE = new TypeReference<>() { };
    private static final TypeReference<List<TimeSeriesPoint>> SERIES_TYPE = new TypeReference<>() { };
    private static final TypeReference<List<BreakdownEntry>> BREAKDOWN_TYPE = new TypeReference<>() { };
    private static final TypeReference<PageResult> PAGE_TYPE = new TypeReference<>() { };
    private static final TypeReference<FilterOptions> OPTIONS_TYPE = new TypeReference<>() { };

    private final FilterSpecificationParser filterParser;
    private final QueryExecutor queryExecutor;
    private final Aggregator aggregator;
    private final PaginationView paginationView;
    private final ReportCacheService cacheService;
    private final MeterRegistry meterRegistry;

    @Value("${dashboard.cache.enabled:false}")
    private boolean cacheEnabled;

    @Value("${dashboard.cache.ttl.list:300}")
    private long listTtl;

    @Value("${dashboard.cache.ttl.aggregate:3600}")
    private long aggregateTtl;

    @Value("${dashboard.cache.ttl.filter-options:7200}")
    private long filterOptionsTtl;

    public ReportResponse<MetricResult> metrics(Domain domain, Map<String, ?> rawParams) {
        RecordSchema schema = RecordSchemas.forDomain(domain);
        FilterSpecification filter = filterParser.parse(schema, rawParams);

        return execute(domain, ReportShape.METRICS, filter, METRICS_TYPE, aggregateTtl, () -> {
            RowSet rows = queryExecutor.fetch(schema, filter);
            RowSet comparison = filter.hasComparisonWindow()
                    ? queryExecutor.fetch(schema, filter.comparisonFilter())
                    : null;
            return aggregator.metrics(rows, comparison);
        });
    }

    public ReportResponse<List<TimeSeriesPoint>> timeSeries(Domain domain, Map<String, ?> rawParams,
                                                            Granularity granularity) {
        RecordSchema schema = RecordSchemas.forDomain(domain);
        FilterSpecification filter = filterParser.parse(schema, rawParams);

        return execute(domain, ReportShape.TIME_SERIES, filter, SERIES_TYPE, aggregateTtl, () -> {
            RowSet rows = queryExecutor.fetch(schema, filter);
            LocalDate from = filter.getDateFrom() != null ? filter.getDateFrom().toLocalDate() : null;
            LocalDate to = filter.getDateTo() != null ? filter.getDateTo().toLocalDate() : null;
            return aggregator.timeSeries(rows, granularity, from, to);
        }, granularity);
    }

    public ReportResponse<List<BreakdownEntry>> breakdown(Domain domain, Map<String, ?> rawParams, String dimension) {
        RecordSchema schema = RecordSchemas.forDomain(domain);
        FilterSpecification filter = filterParser.parse(schema, rawParams);
        String field = dimension == null || dimension.isBlank() ? schema.getDefaultBreakdownField() : dimension.trim();

        return execute(domain, ReportShape.BREAKDOWN, filter, BREAKDOWN_TYPE, aggregateTtl,
                () -> aggregator.breakdown(schema, queryExecutor.fetch(schema, filter), field), field);
    }

    public ReportResponse<PageResult> list(Domain domain, Map<String, ?> rawParams, String sortField,
                                           SortDirection direction, Integer page, Integer pageSize) {
        RecordSchema schema = RecordSchemas.forDomain(domain);
        FilterSpecification filter = filterParser.parse(schema, rawParams);

        return execute(domain, ReportShape.LIST, filter, PAGE_TYPE, listTtl,
                () -> paginationView.page(schema, queryExecutor.fetch(schema, filter), sortField, direction, page, pageSize),
                sortField, direction, page, pageSize);
    }

    /**
     * Option sets always come from the unfiltered data.
     */
    public ReportResponse<FilterOptions> filterOptions(Domain domain) {
        RecordSchema schema = RecordSchemas.forDomain(domain);

        return execute(domain, ReportShape.FILTER_OPTIONS, FilterSpecification.unrestricted(), OPTIONS_TYPE,
                filterOptionsTtl, () -> aggregator.filterOptions(schema, queryExecutor.fetchDistinctValues(schema)));
    }

    public String cacheKey(Domain domain, ReportShape shape, FilterSpecification filter, Object... parameters) {
        Object[] parts = new Object[parameters.length + 2];
        parts[0] = domain.getPath();
        parts[1] = filter.cacheKey();
        System.arraycopy(parameters, 0, parts, 2, parameters.length);
        return cacheService.generateCacheKey("report:" + shape.getTag(), parts);
    }

    private <T> ReportResponse<T> execute(Domain domain, ReportShape shape, FilterSpecification filter,
                                          TypeReference<T> type, long ttlSeconds, Supplier<T> computation,
                                          Object... parameters) {
        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();

        try {
            String cacheKey = cacheKey(domain, shape, filter, parameters);

            if (cacheEnabled) {
                Optional<T> cached = cacheService.get(cacheKey, type);
                if (cached.isPresent()) {
                    countCache(shape, "hit");
                    stopTimer(sample, domain, shape, true);
                    return response(domain, shape, filter, cached.get(), true, startTime);
                }
                countCache(shape, "miss");
            }

            T result = computation.get();

            if (cacheEnabled) {
                cacheService.set(cacheKey, result, ttlSeconds);
            }

            stopTimer(sample, domain, shape, false);
            countExecuted(domain, shape, "success");

            ReportResponse<T> response = response(domain, shape, filter, result, false, startTime);
            log.info("Report executed: {} {} in {} ms", domain.getPath(), shape.getTag(), response.getQueryTimeMs());
            return response;

        } catch (RuntimeException e) {
            log.error("Error executing {} report for {}: {}", shape.getTag(), domain.getPath(), e.getMessage());

            countExecuted(domain, shape, "error");
            throw e;
        }
    }

    private <T> ReportResponse<T> response(Domain domain, ReportShape shape, FilterSpecification filter,
                                           T data, boolean cached, long startTime) {
        return ReportResponse.<T>builder()
                .domain(domain)
                .shape(shape)
                .data(data)
                .warnings(filter.getWarnings())
                .cached(cached)
                .queryTimeMs(System.currentTimeMillis() - startTime)
                .build();
    }

    private void countExecuted(Domain domain, ReportShape shape, String result) {
        Counter.builder("report.executed")
                .tag("domain", domain.getPath())
                .tag("shape", shape.getTag())
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }

    private void countCache(ReportShape shape, String result) {
        Counter.builder("report.cache")
                .tag("shape", shape.getTag())
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }

    private void stopTimer(Timer.Sample sample, Domain domain, ReportShape shape, boolean cached) {
        sample.stop(Timer.builder("report.latency")
                .tag("domain", domain.getPath())
                .tag("shape", shape.getTag())
                .tag("cached", String.valueOf(cached))
                .register(meterRegistry));
    }
}
