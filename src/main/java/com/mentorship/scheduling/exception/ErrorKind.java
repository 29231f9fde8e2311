package com.mentorship.scheduling.exception;

import org.springframework.http.HttpStatus;

/**
 * Machine-readable rejection kinds. Clients re-fetch slots on SLOT_* and retry later on CLAIM_TIMEOUT.
 */
public enum ErrorKind {
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST, false),
    SLOT_UNAVAILABLE(HttpStatus.CONFLICT, false),
    SLOT_CONFLICT(HttpStatus.CONFLICT, false),
    INVALID_TRANSITION(HttpStatus.CONFLICT, false),
    NOT_FOUND(HttpStatus.NOT_FOUND, false),
    CLAIM_TIMEOUT(HttpStatus.SERVICE_UNAVAILABLE, true);

    private final HttpStatus httpStatus;
    private final boolean retryable;

    ErrorKind(HttpStatus httpStatus, boolean retryable) {
        this.httpStatus = httpStatus;
        this.retryable = retryable;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
