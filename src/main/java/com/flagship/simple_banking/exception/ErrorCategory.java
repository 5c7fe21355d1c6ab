package com.flagship.simple_banking.exception;

import org.springframework.http.HttpStatus;

/**
 * Machine-stable error categories exposed in the {@code error} field of every
 * error response. Each category maps to exactly one HTTP status.
 */
public enum ErrorCategory {
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    CONFLICT(HttpStatus.CONFLICT),
    PERSISTENCE_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorCategory(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
