package com.opsdashboard.domain.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Validated, immutable description of the constraints one request applies.
 *
 * It is a predicate descriptor, not a store query: the query executor, the
 * aggregator and the cache all read the same instance. Bounds are inclusive
 * and any of them may be absent.
 */
@Value
@Builder(toBuilder = true)
public class FilterSpecification {

    LocalDateTime dateFrom;
    LocalDateTime dateTo;

    // field -> accepted values, sorted for a stable cache key
    @Builder.Default
    Map<String, Set<String>> memberships = Map.of();

    Double minValue;
    Double maxValue;

    // Comparison window for the trend figure
    LocalDateTime compareFrom;
    LocalDateTime compareTo;

    @Builder.Default
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    List<String> warnings = List.of();

    public static FilterSpecification unrestricted() {
        return FilterSpecification.builder().build();
    }

    public Set<String> valuesFor(String field) {
        return memberships.getOrDefault(field, Set.of());
    }

    public boolean hasComparisonWindow() {
        return compareFrom != null && compareTo != null;
    }

    /**
     * Same constraints, with the date range replaced by the comparison window.
     */
    public FilterSpecification comparisonFilter() {
        if (!hasComparisonWindow()) {
            throw new IllegalStateException("No comparison window on this filter");
        }
        return toBuilder()
                .dateFrom(compareFrom)
                .dateTo(compareTo)
                .compareFrom(null)
                .compareTo(null)
                .warnings(List.of())
                .build();
    }

    /**
     * Normalized form used in cache keys. Warnings are not part of it.
     */
    public String cacheKey() {
        String constraints = memberships.entrySet().stream()
                .map(e -> e.getKey() + "=" + String.join(",", e.getValue()))
                .collect(Collectors.joining("&"));
        return "from=" + dateFrom
                + "|to=" + dateTo
                + "|in=" + constraints
                + "|min=" + minValue
                + "|max=" + maxValue
                + "|cmp=" + compareFrom + "/" + compareTo;
    }
}
