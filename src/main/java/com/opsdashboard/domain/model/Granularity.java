package com.opsdashboard.domain.model;

import com.opsdashboard.domain.exception.ValidationException;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Time bucket width for series output. Months follow calendar boundaries.
 */
public enum Granularity {
    DAY,
    MONTH;

    public LocalDate bucketStart(LocalDateTime timestamp) {
        return bucketStart(timestamp.toLocalDate());
    }

    public LocalDate bucketStart(LocalDate date) {
        return this == MONTH ? date.withDayOfMonth(1) : date;
    }

    public LocalDate next(LocalDate bucketStart) {
        return this == MONTH ? bucketStart.plusMonths(1) : bucketStart.plusDays(1);
    }

    /**
     * Parse a {@code group_by} value. Null or blank means {@link #DAY}.
     */
    public static Granularity from(String value) {
        if (value == null || value.isBlank()) {
            return DAY;
        }
        return switch (value.trim().toLowerCase()) {
            case "day" -> DAY;
            case "month" -> MONTH;
            default -> throw new ValidationException(ValidationException.Kind.INVALID_GRANULARITY, "group_by",
                    "Unsupported granularity '" + value + "', expected day or month");
        };
    }
}
