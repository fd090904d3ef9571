package com.opsdashboard.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class PageResult {

    List<AnalyticsRecord> items;
    long totalCount;
    int page;
    int pageSize;
    int totalPages;
    String sortField;
    SortDirection direction;
}
