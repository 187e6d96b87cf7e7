package com.todoapi.todo.exception;

import com.todoapi.todo.dto.ApiErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Global exception handler for all REST controllers.
 * Maps exceptions to consistent ApiErrorResponse with proper HTTP status codes.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * Handle failed service outcomes raised by controllers.
     * Status and code come from the ErrorKind; 401 adds a Bearer challenge.
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiErrorResponse> handleApiException(ApiException ex) {
        ErrorKind kind = ex.getKind();
        ApiErrorResponse error = new ApiErrorResponse(kind.getCode(), ex.getMessage());

        ResponseEntity.BodyBuilder response = ResponseEntity.status(kind.getStatus());
        if (kind == ErrorKind.UNAUTHORIZED) {
            response.header(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        }
        return response.body(error);
    }

    /**
     * Handle validation errors from @Valid annotations
     * Returns 400 Bad Request with the first offending field
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .findFirst()
                .map(err -> err.getField() + " " + err.getDefaultMessage())
                .orElse("Invalid request");

        return badRequest(message);
    }

    /**
     * Missing or non-JSON request body
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        return badRequest("Malformed request body");
    }

    /**
     * Path or query parameter of the wrong type, e.g. /todos/abc
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return badRequest(ex.getName() + " has an invalid value");
    }

    /**
     * Handle all other exceptions.
     * Spring MVC errors that carry their own status (unknown route, wrong method,
     * missing parameter) keep it; everything else is a 500.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            HttpStatusCode status = errorResponse.getStatusCode();
            HttpStatus resolved = HttpStatus.resolve(status.value());
            ApiErrorResponse error = new ApiErrorResponse(
                    resolved != null ? resolved.name() : "REQUEST_ERROR",
                    errorResponse.getBody().getDetail()
            );
            return ResponseEntity.status(status).body(error);
        }

        log.error("Unhandled exception while processing request", ex);

        ApiErrorResponse error = new ApiErrorResponse(
                "INTERNAL_ERROR",
                "Something went wrong. Please try again later."
        );

        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(error);
    }

    private ResponseEntity<ApiErrorResponse> badRequest(String message) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ApiErrorResponse(ErrorKind.VALIDATION.getCode(), message));
    }
}
