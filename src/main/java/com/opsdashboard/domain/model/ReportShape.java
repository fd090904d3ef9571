package com.opsdashboard.domain.model;

public enum ReportShape {
    METRICS("metrics"),
    TIME_SERIES("time-series"),
    BREAKDOWN("breakdown"),
    LIST("list"),
    FILTER_OPTIONS("filters");

    private final String tag;

    ReportShape(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
