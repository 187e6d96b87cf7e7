package com.todoapi.todo.exception;

import org.springframework.http.HttpStatus;

/**
 * Failure categories returned by the core services.
 * Each maps to one HTTP status and machine-readable code at the API boundary.
 */
public enum ErrorKind {

    VALIDATION(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR"),

    // Duplicate email; the API has always answered 400 here, not 409
    CONFLICT(HttpStatus.BAD_REQUEST, "EMAIL_ALREADY_REGISTERED"),

    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED"),

    FORBIDDEN(HttpStatus.FORBIDDEN, "FORBIDDEN"),

    NOT_FOUND(HttpStatus.NOT_FOUND, "NOT_FOUND");

    private final HttpStatus status;
    private final String code;

    ErrorKind(HttpStatus status, String code) {
        this.status = status;
        this.code = code;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }
}
