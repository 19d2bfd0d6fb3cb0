package com.namehub.web;

import org.springframework.http.HttpStatus;

public enum RegistryErrorCode {
    UNAUTHORIZED(HttpStatus.FORBIDDEN),
    INVALID_RANGE(HttpStatus.BAD_REQUEST),
    ALREADY_ACTIVE(HttpStatus.CONFLICT),
    NOT_DRAFT(HttpStatus.CONFLICT),
    NOT_ACTIVE(HttpStatus.CONFLICT),
    NO_ACTIVE_SEASON(HttpStatus.NOT_FOUND),
    SEASON_NOT_FOUND(HttpStatus.NOT_FOUND),
    SEASON_NOT_OPEN(HttpStatus.CONFLICT),
    SEASON_FULL(HttpStatus.CONFLICT),
    INVALID_NAME(HttpStatus.BAD_REQUEST),
    INVALID_NAME_LENGTH(HttpStatus.BAD_REQUEST),
    NAME_TAKEN(HttpStatus.CONFLICT),
    NAME_NOT_FOUND(HttpStatus.NOT_FOUND),
    ALREADY_REGISTERED(HttpStatus.CONFLICT),
    REPLAYED_PAYMENT(HttpStatus.CONFLICT),
    PAYMENT_NOT_VERIFIED(HttpStatus.PAYMENT_REQUIRED),
    LAST_ADMIN(HttpStatus.CONFLICT),
    INVALID_PRINCIPAL(HttpStatus.BAD_REQUEST);

    private final HttpStatus status;

    RegistryErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
