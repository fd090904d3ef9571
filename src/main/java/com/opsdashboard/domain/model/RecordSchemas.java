package com.opsdashboard.domain.model;

/**
 * The two supported field mappings.
 */
public final class RecordSchemas {

    public static final RecordSchema TRANSACTIONS = RecordSchema.builder()
            .domain(Domain.TRANSACTIONS)
            .idField("id")
            .temporalField("date")
            .numericField("amount")
            .statusField("status")
            .dimensionField("category")
            .attributeField("description")
            .attributeField("customer_id")
            .allowedStatus("completed")
            .allowedStatus("pending")
            .allowedStatus("failed")
            .allowedStatus("cancelled")
            .sortableField("id")
            .sortableField("date")
            .sortableField("category")
            .sortableField("amount")
            .sortableField("status")
            .sortableField("customer_id")
            .attributeName("customer_id", "customerId")
            .defaultSortField("date")
            .defaultBreakdownField("category")
            .build();

    public static final RecordSchema EQUIPMENT = RecordSchema.builder()
            .domain(Domain.EQUIPMENT)
            .idField("id")
            .temporalField("timestamp")
            .numericField("value")
            .statusField("status")
            .dimensionField("equipment_id")
            .dimensionField("metric_name")
            .attributeField("unit")
            .allowedStatus("normal")
            .allowedStatus("warning")
            .allowedStatus("critical")
            .sortableField("id")
            .sortableField("timestamp")
            .sortableField("equipment_id")
            .sortableField("metric_name")
            .sortableField("value")
            .sortableField("status")
            .attributeName("equipment_id", "equipmentId")
            .attributeName("metric_name", "metricName")
            .defaultSortField("timestamp")
            .defaultBreakdownField("equipment_id")
            .build();

    private RecordSchemas() {
    }

    public static RecordSchema forDomain(Domain domain) {
        return switch (domain) {
            case TRANSACTIONS -> TRANSACTIONS;
            case EQUIPMENT -> EQUIPMENT;
        };
    }
}
