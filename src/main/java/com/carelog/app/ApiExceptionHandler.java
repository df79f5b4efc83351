package com.carelog.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import com.carelog.core.error.CareLogException;
import com.carelog.core.error.FailureKind;

/**
 * Maps domain failures to HTTP responses with a {@code {error, kind, message}} body.
 */
@RestControllerAdvice(basePackages = "com.carelog.app")
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(CareLogException.class)
    public ResponseEntity<ApiError> domain(CareLogException e) {
        HttpStatus status = statusFor(e.kind());
        if (status.is5xxServerError()) {
            log.warn("Request failed kind={} err={}", e.kind(), e.toString());
        } else {
            log.debug("Request rejected kind={} message={}", e.kind(), e.getMessage());
        }
        return ResponseEntity.status(status).body(new ApiError(codeFor(status), e.kind().name(), e.getMessage()));
    }

    @ExceptionHandler({ IllegalArgumentException.class, WebExchangeBindException.class, ServerWebInputException.class })
    public ResponseEntity<ApiError> badRequest(Exception e) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ApiError("invalid_request", FailureKind.INVALID_REQUEST.name(), e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> internal(Exception e) {
        log.error("Request failed", e);
        // Do not leak internals
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiError("internal_error", null, "Request failed"));
    }

    static HttpStatus statusFor(FailureKind kind) {
        return switch (kind) {
            case NO_MATCH, NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_REQUEST -> HttpStatus.UNPROCESSABLE_ENTITY;
            case INVALID_TRANSITION -> HttpStatus.CONFLICT;
            case TRANSIENT -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    private static String codeFor(HttpStatus status) {
        return switch (status) {
            case NOT_FOUND -> "not_found";
            case UNPROCESSABLE_ENTITY -> "invalid_request";
            case CONFLICT -> "conflict";
            case SERVICE_UNAVAILABLE -> "unavailable";
            default -> "error";
        };
    }

    public record ApiError(String error, String kind, String message) {
    }
}
