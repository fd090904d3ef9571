package com.opsdashboard.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One group of a dimensional breakdown.
 */
@Value
@Builder
@Jacksonized
public class BreakdownEntry {

    String value;
    long count;
    double sum;
    double average;
    double percentage;
}
