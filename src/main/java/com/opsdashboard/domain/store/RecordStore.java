package com.opsdashboard.domain.store;

import com.opsdashboard.domain.model.AnalyticsRecord;
import com.opsdashboard.domain.model.Domain;
import com.opsdashboard.domain.query.FieldPredicate;

import java.util.List;

/**
 * Boundary to the storage collaborator of one domain.
 *
 * Implementations own the schema, indexing and connections. They signal an
 * unreachable store with a {@code QueryExecutionException} of kind
 * {@code STORE_UNAVAILABLE} and never retry.
 */
public interface RecordStore {

    Domain domain();

    /**
     * Rows satisfying every predicate, ordered by id, without any limit.
     */
    List<AnalyticsRecord> findMatching(List<FieldPredicate> predicates);

    /**
     * Distinct values of a filterable field over the whole domain.
     */
    List<String> findDistinctValues(String field);
}
