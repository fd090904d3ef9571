package com.opsdashboard.domain.query;

import lombok.Value;

import java.util.Set;

/**
 * Equality when the set has one value, membership otherwise.
 */
@Value
public class MembershipPredicate implements FieldPredicate {

    String field;
    Set<String> values;
}
