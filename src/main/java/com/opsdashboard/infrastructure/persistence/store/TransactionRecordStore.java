package com.opsdashboard.infrastructure.persistence.store;

import com.opsdashboard.domain.model.AnalyticsRecord;
import com.opsdashboard.domain.model.RecordSchemas;
import com.opsdashboard.infrastructure.persistence.entity.TransactionEntity;
import com.opsdashboard.infrastructure.persistence.repository.TransactionRepository;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class TransactionRecordStore extends AbstractJpaRecordStore<TransactionEntity> {

    private final TransactionRepository repository;

    public TransactionRecordStore(TransactionRepository repository) {
        super(repository, RecordSchemas.TRANSACTIONS);
        this.repository = repository;
    }

    @Override
    protected List<String> queryDistinct(String field) {
        return switch (field) {
            case "category" -> repository.findDistinctCategories();
            case "status" -> repository.findDistinctStatuses();
            default -> throw new IllegalArgumentException("No distinct query for transactions." + field);
        };
    }

    @Override
    protected AnalyticsRecord toRecord(TransactionEntity entity) {
        return AnalyticsRecord.builder()
                .id(entity.getId())
                .timestamp(entity.getDate())
                .value(entity.getAmount())
                .status(entity.getStatus())
                .dimension("category", entity.getCategory())
                .attribute("description", entity.getDescription())
                .attribute("customer_id", entity.getCustomerId())
                .build();
    }
}
