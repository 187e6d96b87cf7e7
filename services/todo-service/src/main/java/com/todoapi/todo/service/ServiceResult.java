package com.todoapi.todo.service;

import com.todoapi.todo.exception.ApiException;
import com.todoapi.todo.exception.ErrorKind;

import java.util.Objects;

/**
 * Outcome of a core service call: either a value or an {@link ErrorKind}
 * with a client-facing message.
 *
 * Services return this instead of throwing for expected failures
 * (duplicate email, bad credentials, wrong owner, missing record), so every
 * caller decides what to do with each outcome. Controllers usually call
 * {@link #orElseThrow()} and let GlobalExceptionHandler render the error.
 *
 * @param <T> success value type ({@code Void} for operations with no result)
 */
public final class ServiceResult<T> {

    private final T value;
    private final ErrorKind error;
    private final String message;

    private ServiceResult(T value, ErrorKind error, String message) {
        this.value = value;
        this.error = error;
        this.message = message;
    }

    public static <T> ServiceResult<T> success(T value) {
        return new ServiceResult<>(value, null, null);
    }

    public static <T> ServiceResult<T> failure(ErrorKind error, String message) {
        return new ServiceResult<>(null, Objects.requireNonNull(error, "error"), message);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @throws IllegalStateException if this is a failure
     */
    public T getValue() {
        if (!isSuccess()) {
            throw new IllegalStateException("No value on failed result: " + error);
        }
        return value;
    }

    /** The failure kind, or null on success. */
    public ErrorKind getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Unwrap the value, converting a failure into an {@link ApiException}.
     */
    public T orElseThrow() {
        if (!isSuccess()) {
            throw new ApiException(error, message);
        }
        return value;
    }

    @Override
    public String toString() {
        return isSuccess() ? "ServiceResult[success]" : "ServiceResult[" + error + ": " + message + "]";
    }
}
