package com.chambua.schoolsports.exception;

import org.springframework.http.HttpStatus;

/**
 * Base class for errors that map onto a specific HTTP status and a client-facing message.
 */
public abstract class ApiException extends RuntimeException {

    private final HttpStatus status;

    protected ApiException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    protected ApiException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public HttpStatus getStatus() { return status; }
}
