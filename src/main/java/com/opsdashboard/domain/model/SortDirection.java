package com.opsdashboard.domain.model;

import com.opsdashboard.domain.exception.ValidationException;

public enum SortDirection {
    ASC,
    DESC;

    public static SortDirection from(String value) {
        if (value == null || value.isBlank()) {
            return DESC;
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ValidationException(ValidationException.Kind.INVALID_SORT_DIRECTION, "direction",
                    "Unsupported sort direction '" + value + "', expected asc or desc");
        }
    }
}
