package com.todoapi.todo.exception;

/**
 * Raised by controllers when a service outcome is a failure.
 * Mapped to an HTTP response by GlobalExceptionHandler.
 */
public class ApiException extends RuntimeException {

    private final ErrorKind kind;

    public ApiException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
