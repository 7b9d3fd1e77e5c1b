package com.chambua.schoolsports.exception;

import org.springframework.http.HttpStatus;

/**
 * A unique key is already taken, or a row is still referenced. Reported as 400 to match the
 * validation errors clients already handle.
 */
public class ConflictException extends ApiException {

    public ConflictException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }

    public ConflictException(String message, Throwable cause) {
        super(HttpStatus.BAD_REQUEST, message, cause);
    }
}
