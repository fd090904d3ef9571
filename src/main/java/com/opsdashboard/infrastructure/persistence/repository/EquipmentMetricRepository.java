package com.opsdashboard.infrastructure.persistence.repository;

import com.opsdashboard.infrastructure.persistence.entity.EquipmentMetricEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Filtered fetches go through {@link JpaSpecificationExecutor}; the distinct
 * queries feed the filter option lists.
 */
@Repository
public interface EquipmentMetricRepository extends JpaRepository<EquipmentMetricEntity, Long>,
        JpaSpecificationExecutor<EquipmentMetricEntity> {

    @Query("SELECT DISTINCT m.equipmentId FROM EquipmentMetricEntity m")
    List<String> findDistinctEquipmentIds();

    @Query("SELECT DISTINCT m.metricName FROM EquipmentMetricEntity m")
    List<String> findDistinctMetricNames();

    @Query("SELECT DISTINCT m.status FROM EquipmentMetricEntity m")
    List<String> findDistinctStatuses();
}
