package com.opsdashboard.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Field layout of one domain.
 *
 * The engine only works through this capability set (temporal, numeric,
 * status and dimension fields), so the same filter/aggregation code serves
 * every domain. Field names are the public names used in request parameters
 * and responses; {@link #attributeOf(String)} maps them to persistent
 * attributes for the store.
 */
@Value
@Builder
public class RecordSchema {

    Domain domain;
    String idField;
    String temporalField;
    String numericField;
    String statusField;

    @Singular("dimensionField")
    List<String> dimensionFields;

    // Free text, only returned in list views
    @Singular("attributeField")
    List<String> attributeFields;

    @Singular("allowedStatus")
    Set<String> allowedStatuses;

    @Singular("sortableField")
    Set<String> sortableFields;

    @Singular("attributeName")
    Map<String, String> attributeNames;

    String defaultSortField;
    String defaultBreakdownField;

    /**
     * Fields usable as equality/membership filters and as breakdown
     * dimensions: every dimension field plus the status field.
     */
    public List<String> filterableFields() {
        List<String> fields = new ArrayList<>(dimensionFields);
        fields.add(statusField);
        return fields;
    }

    public boolean isFilterable(String field) {
        return field != null && (dimensionFields.contains(field) || field.equals(statusField));
    }

    public boolean isSortable(String field) {
        return field != null && sortableFields.contains(field);
    }

    public String attributeOf(String field) {
        return attributeNames.getOrDefault(field, field);
    }
}
