package com.opsdashboard.domain.exception;

import lombok.Getter;

/**
 * Malformed or contradictory request input.
 *
 * Always surfaced to the caller with enough detail to correct the request.
 */
@Getter
public class ValidationException extends RuntimeException {

    private final Kind kind;
    private final String field;

    public ValidationException(Kind kind, String field, String message) {
        super(message);
        this.kind = kind;
        this.field = field;
    }

    public enum Kind {
        INVALID_RANGE,
        INVALID_SORT_FIELD,
        INVALID_SORT_DIRECTION,
        INVALID_GRANULARITY,
        INVALID_DIMENSION,
        INVALID_PAGE,
        UNKNOWN_DOMAIN
    }
}
