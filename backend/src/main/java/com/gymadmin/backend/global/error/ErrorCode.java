package com.gymadmin.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Stable machine-readable rejection codes returned by the access core.
 */
public enum ErrorCode {

    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED),
    INVALID_PIN(HttpStatus.UNAUTHORIZED),
    MIGRATION_REQUIRED(HttpStatus.CONFLICT),
    INVALID_PIN_FORMAT(HttpStatus.BAD_REQUEST),
    WEAK_PIN(HttpStatus.BAD_REQUEST),
    BRANCH_ID_REQUIRED(HttpStatus.BAD_REQUEST),
    TOO_MANY_ATTEMPTS(HttpStatus.TOO_MANY_REQUESTS),
    PERMISSION_DENIED(HttpStatus.FORBIDDEN),
    BRANCH_ACCESS_DENIED(HttpStatus.FORBIDDEN),
    RESOURCE_NOT_FOUND(HttpStatus.NOT_FOUND),
    STORAGE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
