package com.opsdashboard.domain.service;

import com.opsdashboard.domain.exception.QueryExecutionException;
import com.opsdashboard.domain.model.AnalyticsRecord;
import com.opsdashboard.domain.model.Domain;
import com.opsdashboard.domain.model.FilterSpecification;
import com.opsdashboard.domain.model.RecordSchema;
import com.opsdashboard.domain.model.RowSet;
import com.opsdashboard.domain.query.FieldPredicate;
import com.opsdashboard.domain.query.MembershipPredicate;
import com.opsdashboard.domain.query.RangePredicate;
import com.opsdashboard.domain.store.RecordStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The only component that touches the data store.
 *
 * Each active constraint of the filter becomes one field predicate; absent
 * constraints add nothing. The store returns every matching row (no limit),
 * since aggregations need the complete filtered set.
 *
 * Store failures propagate unchanged. Retrying is up to the store.
 */
@Slf4j
@Service
public class QueryExecutor {

    private final Map<Domain, RecordStore> stores = new EnumMap<>(Domain.class);

    public QueryExecutor(List<RecordStore> recordStores) {
        for (RecordStore store : recordStores) {
            stores.put(store.domain(), store);
        }
    }

    public RowSet fetch(RecordSchema schema, FilterSpecification filter) {
        List<FieldPredicate> predicates = toPredicates(schema, filter);
        long start = System.currentTimeMillis();

        List<AnalyticsRecord> rows = storeFor(schema.getDomain()).findMatching(predicates);

        log.debug("Fetched {} {} rows with {} predicates in {} ms",
                rows.size(), schema.getDomain(), predicates.size(), System.currentTimeMillis() - start);
        return RowSet.of(schema.getDomain(), rows);
    }

    /**
     * Distinct values of every filterable field over the unfiltered domain.
     */
    public Map<String, List<String>> fetchDistinctValues(RecordSchema schema) {
        RecordStore store = storeFor(schema.getDomain());
        Map<String, List<String>> values = new LinkedHashMap<>();
        for (String field : schema.filterableFields()) {
            values.put(field, store.findDistinctValues(field));
        }
        return values;
    }

    public List<FieldPredicate> toPredicates(RecordSchema schema, FilterSpecification filter) {
        List<FieldPredicate> predicates = new ArrayList<>();

        if (filter.getDateFrom() != null || filter.getDateTo() != null) {
            predicates.add(new RangePredicate<>(schema.getTemporalField(), filter.getDateFrom(), filter.getDateTo()));
        }
        for (String field : schema.filterableFields()) {
            if (!filter.valuesFor(field).isEmpty()) {
                predicates.add(new MembershipPredicate(field, filter.valuesFor(field)));
            }
        }
        if (filter.getMinValue() != null || filter.getMaxValue() != null) {
            predicates.add(new RangePredicate<>(schema.getNumericField(), filter.getMinValue(), filter.getMaxValue()));
        }
        return predicates;
    }

    private RecordStore storeFor(Domain domain) {
        RecordStore store = stores.get(domain);
        if (store == null) {
            throw new QueryExecutionException(QueryExecutionException.Kind.STORE_UNAVAILABLE,
                    "No store registered for domain " + domain);
        }
        return store;
    }
}
