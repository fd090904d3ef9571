package com.opsdashboard.domain.service;

import com.opsdashboard.config.DashboardProperties;
import com.opsdashboard.domain.exception.ValidationException;
import com.opsdashboard.domain.model.AnalyticsRecord;
import com.opsdashboard.domain.model.PageResult;
import com.opsdashboard.domain.model.RecordSchema;
import com.opsdashboard.domain.model.RowSet;
import com.opsdashboard.domain.model.SortDirection;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders and slices a filtered row set for list display.
 *
 * Runs after the full fetch, never instead of it. The sort is stable, so rows
 * with equal keys keep their store order. Missing keys sort last in both
 * directions.
 */
@Component
public class PaginationView {

    private final int defaultPageSize;
    private final int maxPageSize;

    @Autowired
    public PaginationView(DashboardProperties properties) {
        this(properties.getPagination().getDefaultPageSize(), properties.getPagination().getMaxPageSize());
    }

    public PaginationView(int defaultPageSize, int maxPageSize) {
        this.defaultPageSize = Math.min(defaultPageSize, maxPageSize);
        this.maxPageSize = maxPageSize;
    }

    public PageResult page(RecordSchema schema, RowSet rows, String sortField, SortDirection direction,
                           Integer pageNumber, Integer pageSize) {
        String field = sortField == null || sortField.isBlank() ? schema.getDefaultSortField() : sortField.trim();
        if (!schema.isSortable(field)) {
            throw new ValidationException(ValidationException.Kind.INVALID_SORT_FIELD, "sort",
                    "Cannot sort " + schema.getDomain() + " by '" + field + "', expected one of "
                            + schema.getSortableFields());
        }
        SortDirection order = direction != null ? direction : SortDirection.DESC;

        int page = pageNumber == null ? 1 : pageNumber;
        if (page < 1) {
            throw new ValidationException(ValidationException.Kind.INVALID_PAGE, "page",
                    "Page numbers start at 1, got " + page);
        }
        int size = effectivePageSize(pageSize);

        List<AnalyticsRecord> sorted = new ArrayList<>(rows.getRecords());
        sorted.sort(comparator(schema, field, order));

        long total = sorted.size();
        long offset = (long) (page - 1) * size;
        List<AnalyticsRecord> items = offset >= total
                ? List.of()
                : List.copyOf(sorted.subList((int) offset, (int) Math.min(offset + size, total)));

        return PageResult.builder()
                .items(items)
                .totalCount(total)
                .page(page)
                .pageSize(size)
                .totalPages((int) ((total + size - 1) / size))
                .sortField(field)
                .direction(order)
                .build();
    }

    int effectivePageSize(Integer requested) {
        if (requested == null || requested <= 0) {
            return defaultPageSize;
        }
        return Math.min(requested, maxPageSize);
    }

    private Comparator<AnalyticsRecord> comparator(RecordSchema schema, String field, SortDirection direction) {
        Comparator<Comparable<?>> keyOrder = PaginationView::compareKeys;
        if (direction == SortDirection.DESC) {
            keyOrder = keyOrder.reversed();
        }
        return Comparator.comparing(row -> row.sortKey(schema, field), Comparator.nullsLast(keyOrder));
    }

    // Keys of one field share a type, so the cast holds.
    private static int compareKeys(Comparable<?> left, Comparable<?> right) {
        return ((Comparable<Object>) left).compareTo(right);
    }
}
