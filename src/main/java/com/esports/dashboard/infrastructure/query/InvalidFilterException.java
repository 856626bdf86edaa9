package com.esports.dashboard.infrastructure.query;

/**
 * Raised when a SQL filter fragment does not match any whitelisted shape.
 *
 * The message never contains the rejected fragment; the fragment is only
 * written to the security log by {@link FilterConditionValidator}.
 */
public class InvalidFilterException extends RuntimeException {

    public InvalidFilterException() {
        super("Invalid filter condition detected");
    }
}
