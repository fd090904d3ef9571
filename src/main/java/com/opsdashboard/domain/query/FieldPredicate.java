package com.opsdashboard.domain.query;

/**
 * A constraint on one record field, expressed with the schema's public
 * field name. Stores translate these into their own query language.
 */
public interface FieldPredicate {

    String getField();
}
