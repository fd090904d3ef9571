package com.opsdashboard.infrastructure.persistence.store;

import com.opsdashboard.domain.model.AnalyticsRecord;
import com.opsdashboard.domain.model.RecordSchemas;
import com.opsdashboard.infrastructure.persistence.entity.EquipmentMetricEntity;
import com.opsdashboard.infrastructure.persistence.repository.EquipmentMetricRepository;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class EquipmentRecordStore extends AbstractJpaRecordStore<EquipmentMetricEntity> {

    private final EquipmentMetricRepository repository;

    public EquipmentRecordStore(EquipmentMetricRepository repository) {
        super(repository, RecordSchemas.EQUIPMENT);
        this.repository = repository;
    }

    @Override
    protected List<String> queryDistinct(String field) {
        return switch (field) {
            case "equipment_id" -> repository.findDistinctEquipmentIds();
            case "metric_name" -> repository.findDistinctMetricNames();
            case "status" -> repository.findDistinctStatuses();
            default -> throw new IllegalArgumentException("No distinct query for equipment." + field);
        };
    }

    @Override
    protected AnalyticsRecord toRecord(EquipmentMetricEntity entity) {
        return AnalyticsRecord.builder()
                .id(entity.getId())
                .timestamp(entity.getTimestamp())
                .value(entity.getValue())
                .status(entity.getStatus())
                .dimension("equipment_id", entity.getEquipmentId())
                .dimension("metric_name", entity.getMetricName())
                .attribute("unit", entity.getUnit())
                .build();
    }
}
