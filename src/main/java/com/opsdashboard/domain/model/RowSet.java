package com.opsdashboard.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;
import java.util.stream.Stream;

/**
 * Immutable set of rows fetched for one request, in store order.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RowSet {

    Domain domain;
    List<AnalyticsRecord> records;

    public static RowSet of(Domain domain, List<AnalyticsRecord> records) {
        return new RowSet(domain, List.copyOf(records));
    }

    public static RowSet empty(Domain domain) {
        return new RowSet(domain, List.of());
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public Stream<AnalyticsRecord> stream() {
        return records.stream();
    }
}
