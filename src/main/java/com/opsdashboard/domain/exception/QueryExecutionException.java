package com.opsdashboard.domain.exception;

import lombok.Getter;

/**
 * Store failure while fetching rows.
 *
 * Propagated unchanged to the caller; the engine never retries or degrades
 * it to a partial result.
 */
@Getter
public class QueryExecutionException extends RuntimeException {

    private final Kind kind;

    public QueryExecutionException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public QueryExecutionException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public enum Kind {
        STORE_UNAVAILABLE,
        QUERY_FAILED
    }
}
