package com.opsdashboard.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/**
 * One bucket of a time series. Empty buckets report zero for every figure.
 */
@Value
@Builder
@Jacksonized
public class TimeSeriesPoint {

    LocalDate bucketStart;
    Granularity granularity;
    double sum;
    long count;
    double average;
    double min;
    double max;
}
