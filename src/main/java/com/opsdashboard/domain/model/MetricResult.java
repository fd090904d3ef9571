package com.opsdashboard.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Key figures over the filtered row set.
 *
 * {@code previousSum} and {@code trendPercent} are only present when a
 * comparison window was requested.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MetricResult {

    long count;
    double sum;
    double average;
    double min;
    double max;

    Double previousSum;
    Double trendPercent;
}
