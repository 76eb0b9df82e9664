package com.travelbooking.backend.modules.auth.application;

import org.springframework.http.HttpStatus;

/**
 * Categories every authentication rejection falls into. Wrong-value and expired-value cases share
 * {@link #NOT_FOUND_OR_EXPIRED} so callers cannot tell them apart.
 */
public enum AuthErrorKind {
    CONFLICT(HttpStatus.CONFLICT),
    VALIDATION(HttpStatus.UNPROCESSABLE_ENTITY),
    NOT_FOUND_OR_EXPIRED(HttpStatus.BAD_REQUEST),
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED),
    ACCOUNT_LOCKED(HttpStatus.LOCKED),
    UNVERIFIED(HttpStatus.FORBIDDEN);

    private final HttpStatus status;

    AuthErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
