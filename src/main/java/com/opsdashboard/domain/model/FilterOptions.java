package com.opsdashboard.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Distinct values per filterable field, taken from the unfiltered data.
 */
@Value
@Builder
@Jacksonized
public class FilterOptions {

    Domain domain;
    Map<String, List<String>> options;
}
