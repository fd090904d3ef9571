package com.opsdashboard.domain.service;

import com.opsdashboard.domain.exception.QueryExecutionException;
import com.opsdashboard.domain.exception.ValidationException;
import com.opsdashboard.domain.model.AnalyticsRecord;
import com.opsdashboard.domain.model.BreakdownEntry;
import com.opsdashboard.domain.model.Domain;
import com.opsdashboard.domain.model.FilterOptions;
import com.opsdashboard.domain.model.FilterSpecification;
import com.opsdashboard.domain.model.Granularity;
import com.opsdashboard.domain.model.MetricResult;
import com.opsdashboard.domain.model.PageResult;
import com.opsdashboard.domain.model.RecordSchemas;
import com.opsdashboard.domain.model.ReportResponse;
import com.opsdashboard.domain.model.ReportShape;
import com.opsdashboard.domain.model.RowSet;
import com.opsdashboard.domain.model.SortDirection;
import com.opsdashboard.domain.model.TimeSeriesPoint;
import com.opsdashboard.infrastructure.cache.ReportCacheService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ReportService.
 *
 * The engine components are real; only the store access and the cache are
 * mocked, so these tests cover the whole parse, fetch, aggregate path.
 */
@ExtendWith(MockitoExtension.class)
class ReportServiceTest {

    @Mock
    private QueryExecutor queryExecutor;

    @Mock
    private ReportCacheService cacheService;

    private MeterRegistry meterRegistry;
    private ReportService reportService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        reportService = new ReportService(new FilterSpecificationParser(), queryExecutor, new Aggregator(),
                new PaginationView(100, 1000), cacheService, meterRegistry);
        ReflectionTestUtils.setField(reportService, "listTtl", 300L);
        ReflectionTestUtils.setField(reportService, "aggregateTtl", 3600L);
        ReflectionTestUtils.setField(reportService, "filterOptionsTtl", 7200L);
    }

    @Test
    void testMetrics_CacheHit() {
        // Given
        ReflectionTestUtils.setField(reportService, "cacheEnabled", true);
        MetricResult cachedResult = MetricResult.builder().count(3).sum(30.0).average(10.0).min(5.0).max(15.0).build();
        doReturn(Optional.of(cachedResult)).when(cacheService).get(any(), any());

        // When
        ReportResponse<MetricResult> result = reportService.metrics(Domain.TRANSACTIONS, Map.of());

        // Then
        assertTrue(result.isCached());
        assertEquals(cachedResult, result.getData());
        assertEquals(ReportShape.METRICS, result.getShape());

        // Verify store was NOT called (cache hit)
        verify(queryExecutor, never()).fetch(any(), any());
        verify(cacheService, never()).set(any(), any(), anyLong());
        assertEquals(1.0, meterRegistry.get("report.cache").tag("result", "hit").counter().count());
    }

    @Test
    void testMetrics_CacheMiss() {
        // Given
        ReflectionTestUtils.setField(reportService, "cacheEnabled", true);
        doReturn(Optional.empty()).when(cacheService).get(any(), any());
        when(queryExecutor.fetch(eq(RecordSchemas.TRANSACTIONS), any())).thenReturn(rows(10.0, 20.0));

        // When
        ReportResponse<MetricResult> result = reportService.metrics(Domain.TRANSACTIONS, Map.of());

        // Then
        assertFalse(result.isCached());
        assertEquals(2, result.getData().getCount());
        assertEquals(30.0, result.getData().getSum());

        // Verify result was cached with the aggregate TTL
        verify(cacheService).set(any(), eq(result.getData()), eq(3600L));
        assertEquals(1.0, meterRegistry.get("report.cache").tag("result", "miss").counter().count());
        assertEquals(1.0, meterRegistry.get("report.executed").tag("result", "success").counter().count());
    }

    @Test
    void testMetrics_CacheDisabledByDefault() {
        when(queryExecutor.fetch(any(), any())).thenReturn(rows(1.0));

        ReportResponse<MetricResult> result = reportService.metrics(Domain.TRANSACTIONS, Map.of());

        assertFalse(result.isCached());
        verify(cacheService, never()).get(any(), any());
        verify(cacheService, never()).set(any(), any(), anyLong());
    }

    @Test
    void testMetrics_ComparisonWindowFetchesPreviousPeriod() {
        // Given
        when(queryExecutor.fetch(eq(RecordSchemas.TRANSACTIONS), any()))
                .thenReturn(rows(100.0, 50.0))
                .thenReturn(rows(100.0));

        // When
        ReportResponse<MetricResult> result = reportService.metrics(Domain.TRANSACTIONS, Map.of(
                "date_from", "2024-02-01", "date_to", "2024-02-29",
                "compare_from", "2024-01-01", "compare_to", "2024-01-31"));

        // Then
        ArgumentCaptor<FilterSpecification> filters = ArgumentCaptor.forClass(FilterSpecification.class);
        verify(queryExecutor, times(2)).fetch(eq(RecordSchemas.TRANSACTIONS), filters.capture());
        assertEquals(LocalDateTime.of(2024, 1, 1, 0, 0), filters.getAllValues().get(1).getDateFrom());
        assertEquals(100.0, result.getData().getPreviousSum());
        assertEquals(50.0, result.getData().getTrendPercent(), 1e-9);
    }

    @Test
    void testMetrics_InvalidRangeStopsBeforeFetch() {
        assertThrows(ValidationException.class, () -> reportService.metrics(Domain.TRANSACTIONS,
                Map.of("date_from", "2024-03-01", "date_to", "2024-01-01")));

        verifyNoInteractions(queryExecutor);
    }

    @Test
    void testMetrics_StoreFailureCountedAndRethrown() {
        when(queryExecutor.fetch(any(), any())).thenThrow(new QueryExecutionException(
                QueryExecutionException.Kind.STORE_UNAVAILABLE, "database down"));

        QueryExecutionException ex = assertThrows(QueryExecutionException.class, () ->
                reportService.metrics(Domain.EQUIPMENT, Map.of()));

        assertEquals(QueryExecutionException.Kind.STORE_UNAVAILABLE, ex.getKind());
        assertEquals(1.0, meterRegistry.get("report.executed")
                .tag("domain", "equipment").tag("result", "error").counter().count());
    }

    @Test
    void testTimeSeries_UsesFilterRangeAsBucketBounds() {
        when(queryExecutor.fetch(any(), any())).thenReturn(rows(5.0));

        ReportResponse<List<TimeSeriesPoint>> result = reportService.timeSeries(Domain.TRANSACTIONS,
                Map.of("date_from", "2024-01-01", "date_to", "2024-01-07"), Granularity.DAY);

        assertEquals(7, result.getData().size());
        assertEquals(LocalDate.of(2024, 1, 1), result.getData().get(0).getBucketStart());
        assertEquals(5.0, result.getData().stream().mapToDouble(TimeSeriesPoint::getSum).sum());
    }

    @Test
    void testBreakdown_DefaultsToSchemaDimension() {
        when(queryExecutor.fetch(any(), any())).thenReturn(rows(3.0, 1.0));

        ReportResponse<List<BreakdownEntry>> result = reportService.breakdown(Domain.TRANSACTIONS, Map.of(), null);

        assertEquals(1, result.getData().size());
        assertEquals("sales", result.getData().get(0).getValue());
        assertEquals(100.0, result.getData().get(0).getPercentage(), 1e-9);
    }

    @Test
    void testList_PagesFetchedRows() {
        when(queryExecutor.fetch(any(), any())).thenReturn(rows(1.0, 2.0, 3.0));

        ReportResponse<PageResult> result = reportService.list(Domain.TRANSACTIONS, Map.of(),
                "amount", SortDirection.DESC, 1, 2);

        assertEquals(3, result.getData().getTotalCount());
        assertEquals(2, result.getData().getTotalPages());
        assertEquals(3.0, result.getData().getItems().get(0).getValue());
    }

    @Test
    void testList_WarningsCarriedIntoResponse() {
        when(queryExecutor.fetch(any(), any())).thenReturn(rows(1.0));

        ReportResponse<PageResult> result = reportService.list(Domain.TRANSACTIONS, Map.of("min_value", "lots"),
                null, null, null, null);

        assertEquals(1, result.getWarnings().size());
        assertEquals(1, result.getData().getTotalCount());
    }

    @Test
    void testFilterOptions_FromDistinctValues() {
        when(queryExecutor.fetchDistinctValues(RecordSchemas.EQUIPMENT)).thenReturn(Map.of(
                "equipment_id", List.of("PUMP-A1", "MOTOR-M1"),
                "metric_name", List.of("rpm"),
                "status", List.of("normal")));

        ReportResponse<FilterOptions> result = reportService.filterOptions(Domain.EQUIPMENT);

        assertEquals(List.of("MOTOR-M1", "PUMP-A1"), result.getData().getOptions().get("equipment_id"));
        verify(queryExecutor, never()).fetch(any(), any());
    }

    private static RowSet rows(double... amounts) {
        List<AnalyticsRecord> records = new ArrayList<>();
        for (int i = 0; i < amounts.length; i++) {
            records.add(AnalyticsRecord.builder()
                    .id((long) i + 1)
                    .timestamp(LocalDateTime.of(2024, 1, 3, 12, 0))
                    .value(amounts[i])
                    .status("completed")
                    .dimension("category", "sales")
                    .build());
        }
        return RowSet.of(Domain.TRANSACTIONS, records);
    }
}
