package com.todoapi.todo.dto;

import java.time.Instant;

/**
 * Unified error response for all API errors.
 * Used by GlobalExceptionHandler for consistent error structure.
 *
 * Example:
 * {
 *   "error": "NOT_FOUND",
 *   "message": "Todo not found",
 *   "timestamp": "2026-01-11T18:30:00Z"
 * }
 */
public class ApiErrorResponse {

    private final String error;       // Machine-readable error code
    private final String message;     // Human-readable error message
    private final Instant timestamp;  // When the error occurred

    public ApiErrorResponse(String error, String message) {
        this.error = error;
        this.message = message;
        this.timestamp = Instant.now();
    }

    public String getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
