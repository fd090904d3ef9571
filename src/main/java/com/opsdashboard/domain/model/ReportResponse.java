package com.opsdashboard.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Envelope returned to the serving layer for every report shape.
 *
 * Warnings list the filter values that were dropped while parsing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportResponse<T> {

    private Domain domain;
    private ReportShape shape;
    private T data;
    private List<String> warnings;
    private boolean cached;
    private long queryTimeMs;
}
