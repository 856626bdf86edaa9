package com.esports.dashboard.api;

/**
 * Request parameters that break the endpoint contract. Mapped to HTTP 422.
 */
public class RequestValidationException extends RuntimeException {

    public RequestValidationException(String message) {
        super(message);
    }
}
