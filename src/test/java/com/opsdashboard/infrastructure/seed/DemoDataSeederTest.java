package com.opsdashboard.infrastructure.seed;

import com.opsdashboard.config.DashboardProperties;
import com.opsdashboard.domain.model.Domain;
import com.opsdashboard.domain.model.FilterSpecification;
import com.opsdashboard.domain.model.RecordSchemas;
import com.opsdashboard.domain.model.ReportShape;
import com.opsdashboard.domain.service.ReportService;
import com.opsdashboard.infrastructure.cache.ReportCacheService;
import com.opsdashboard.infrastructure.persistence.entity.EquipmentMetricEntity;
import com.opsdashboard.infrastructure.persistence.entity.TransactionEntity;
import com.opsdashboard.infrastructure.persistence.repository.EquipmentMetricRepository;
import com.opsdashboard.infrastructure.persistence.repository.TransactionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DemoDataSeederTest {

    @Mock
    private TransactionRepository transactionRepository;

    @Mock
    private EquipmentMetricRepository equipmentMetricRepository;

    @Mock
    private ReportService reportService;

    @Mock
    private ReportCacheService cacheService;

    private DashboardProperties properties;
    private DemoDataSeeder seeder;

    @BeforeEach
    void setUp() {
        properties = new DashboardProperties();
        properties.getSeed().setTransactions(50);
        properties.getSeed().setEquipmentMetrics(80);
        seeder = new DemoDataSeeder(transactionRepository, equipmentMetricRepository, reportService, cacheService,
                properties);
    }

    @Test
    void testTransactions_UseKnownCategoriesAndStatuses() {
        List<TransactionEntity> rows = seeder.transactions(500);

        assertEquals(500, rows.size());
        for (TransactionEntity row : rows) {
            assertTrue(DemoDataSeeder.CATEGORIES.contains(row.getCategory()));
            assertTrue(RecordSchemas.TRANSACTIONS.getAllowedStatuses().contains(row.getStatus()));
            assertTrue(row.getAmount() > 0);
            assertNotNull(row.getDate());
        }
    }

    @Test
    void testEquipmentMetrics_StatusFollowsNormalRange() {
        List<EquipmentMetricEntity> rows = seeder.equipmentMetrics(500);

        assertEquals(500, rows.size());
        for (EquipmentMetricEntity row : rows) {
            DemoDataSeeder.NormalRange range = DemoDataSeeder.NORMAL_RANGES.get(row.getMetricName());
            assertNotNull(range);
            assertEquals(range.unit, row.getUnit());
            assertEquals(range.statusOf(row.getValue()), row.getStatus());
            assertTrue(DemoDataSeeder.EQUIPMENT_IDS.contains(row.getEquipmentId()));
        }
    }

    @Test
    void testNormalRange_Thresholds() {
        DemoDataSeeder.NormalRange temperature = DemoDataSeeder.NORMAL_RANGES.get("temperature");

        assertEquals("normal", temperature.statusOf(50));
        assertEquals("warning", temperature.statusOf(73));
        assertEquals("critical", temperature.statusOf(90));
        assertEquals("warning", temperature.statusOf(30));
        assertEquals("critical", temperature.statusOf(20));
    }

    @Test
    void testRun_SeedsEmptyTablesAndInvalidatesOptions() {
        when(transactionRepository.count()).thenReturn(0L);
        when(equipmentMetricRepository.count()).thenReturn(0L);
        when(reportService.cacheKey(any(Domain.class), eq(ReportShape.FILTER_OPTIONS), any(FilterSpecification.class)))
                .thenReturn("report:filters:key");

        seeder.run(null);

        verify(transactionRepository).saveAll(argThat((List<TransactionEntity> rows) -> rows.size() == 50));
        verify(equipmentMetricRepository).saveAll(argThat((List<EquipmentMetricEntity> rows) -> rows.size() == 80));
        verify(cacheService, times(2)).invalidate("report:filters:key");
    }

    @Test
    void testRun_SkipsPopulatedTables() {
        when(transactionRepository.count()).thenReturn(10L);
        when(equipmentMetricRepository.count()).thenReturn(10L);

        seeder.run(null);

        verify(transactionRepository, never()).saveAll(anyList());
        verify(equipmentMetricRepository, never()).saveAll(anyList());
        verifyNoInteractions(cacheService);
    }
}
