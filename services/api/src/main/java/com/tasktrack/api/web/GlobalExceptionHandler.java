package com.tasktrack.api.web;

import com.tasktrack.api.errors.AuthenticationFailedException;
import com.tasktrack.api.errors.ConflictException;
import com.tasktrack.api.errors.NotFoundException;
import com.tasktrack.api.errors.UnauthenticatedException;
import com.tasktrack.api.errors.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

/**
 * Maps each error kind to its own status and an RFC 7807 {@link ProblemDetail} body:
 *
 * <pre>
 * {
 *   "type": "https://tasktrack.dev/errors/conflict",
 *   "title": "Conflict",
 *   "status": 409,
 *   "detail": "Username already taken",
 *   "timestamp": "2026-01-12T10:30:00Z"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ProblemDetail handleValidation(ValidationException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        return Problems.of(HttpStatus.BAD_REQUEST, "Validation Error", "validation", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleInvalidBody(MethodArgumentNotValidException ex) {
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        log.warn("Validation failed: {}", detail);
        return Problems.of(HttpStatus.BAD_REQUEST, "Validation Error", "validation", detail);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ProblemDetail handleUnreadable(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return Problems.of(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", "Malformed request");
    }

    @ExceptionHandler(ConflictException.class)
    public ProblemDetail handleConflict(ConflictException ex) {
        log.warn("Conflict: {}", ex.getMessage());
        return Problems.of(HttpStatus.CONFLICT, "Conflict", "conflict", ex.getMessage());
    }

    @ExceptionHandler(AuthenticationFailedException.class)
    public ResponseEntity<ProblemDetail> handleAuthenticationFailed(AuthenticationFailedException ex) {
        return unauthorized("authentication-failed", ex.getMessage());
    }

    @ExceptionHandler(UnauthenticatedException.class)
    public ResponseEntity<ProblemDetail> handleUnauthenticated(UnauthenticatedException ex) {
        return unauthorized("unauthenticated", ex.getMessage());
    }

    @ExceptionHandler(NotFoundException.class)
    public ProblemDetail handleNotFound(NotFoundException ex) {
        log.warn("Not found: {}", ex.getMessage());
        return Problems.of(HttpStatus.NOT_FOUND, "Not Found", "not-found", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse) {
            // unknown route, wrong method, missing parameter: keep the status Spring chose
            ProblemDetail body = ((ErrorResponse) ex).getBody();
            log.warn("Request rejected: {}", ex.getMessage());
            body.setProperty("timestamp", Instant.now().toString());
            return body;
        }
        log.error("Internal server error", ex);
        return Problems.of(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal",
                "An unexpected error occurred");
    }

    private ResponseEntity<ProblemDetail> unauthorized(String type, String detail) {
        log.warn("Unauthorized: {}", detail);
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
                .body(Problems.of(HttpStatus.UNAUTHORIZED, "Unauthorized", type, detail));
    }
}
