package com.opsdashboard.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * One row of either domain, in domain-neutral shape.
 *
 * The engine never mutates a record; the id is assigned by the store.
 */
@Value
@Builder
@Jacksonized
public class AnalyticsRecord {

    Long id;
    LocalDateTime timestamp;
    Double value;
    String status;

    @Singular("dimension")
    Map<String, String> dimensions;

    @Singular("attribute")
    Map<String, String> attributes;

    /**
     * Rows with a missing timestamp or a non-finite value are left out of
     * every aggregation.
     */
    @JsonIgnore
    public boolean isAggregatable() {
        return timestamp != null && value != null && Double.isFinite(value);
    }

    /**
     * Categorical value of a filterable field (a dimension or the status).
     */
    public String categoryValue(RecordSchema schema, String field) {
        if (field.equals(schema.getStatusField())) {
            return status;
        }
        return dimensions.get(field);
    }

    public Comparable<?> sortKey(RecordSchema schema, String field) {
        if (field.equals(schema.getIdField())) {
            return id;
        }
        if (field.equals(schema.getTemporalField())) {
            return timestamp;
        }
        if (field.equals(schema.getNumericField())) {
            return value;
        }
        if (field.equals(schema.getStatusField())) {
            return status;
        }
        if (dimensions.containsKey(field)) {
            return dimensions.get(field);
        }
        return attributes.get(field);
    }
}
