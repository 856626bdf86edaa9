package com.esports.dashboard.infrastructure.query;

import lombok.Getter;

/**
 * Raised when a dashboard query does not finish within its bound.
 */
@Getter
public class QueryTimeoutException extends RuntimeException {

    private final String operationName;
    private final long timeoutMs;

    public QueryTimeoutException(String operationName, long timeoutMs) {
        super("Query timeout: " + operationName + " exceeded " + timeoutMs + "ms");
        this.operationName = operationName;
        this.timeoutMs = timeoutMs;
    }
}
