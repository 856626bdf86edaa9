package com.esports.dashboard.api;

import java.util.function.Supplier;

/**
 * A query parameter that could not be read (unknown sort, view mode or period). Mapped to HTTP 400.
 */
public class InvalidParameterException extends RuntimeException {

    public InvalidParameterException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Runs a parameter parser, turning its IllegalArgumentException into a client error.
     * IllegalArgumentExceptions raised anywhere else stay server errors.
     */
    static <T> T readParameter(Supplier<T> parser) {
        try {
            return parser.get();
        } catch (IllegalArgumentException e) {
            throw new InvalidParameterException(e.getMessage(), e);
        }
    }
}
