package com.opsdashboard.domain.query;

import lombok.Value;

/**
 * Inclusive range. A null bound leaves that side open.
 */
@Value
public class RangePredicate<T extends Comparable<? super T>> implements FieldPredicate {

    String field;
    T lower;
    T upper;
}
