package com.parley.feedservice.infrastructure.web;

import com.parley.eventbus.routing.UnknownSubscriptionException;
import com.parley.observability.CorrelationContextHolder;
import com.parley.pagination.InvalidCursorException;
import com.parley.pagination.SourceUnavailableException;
import com.parley.security.UnauthenticatedException;
import com.parley.security.UnauthorizedException;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps exceptions to RFC 7807 ProblemDetail responses.
 *
 * <pre>
 * {
 *   "type": "https://parley.dev/errors/invalid-cursor",
 *   "title": "Invalid Cursor",
 *   "status": 400,
 *   "detail": "Invalid cursor 'xyz': not valid Base64",
 *   "timestamp": "2026-07-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>Every error response includes the correlation ID so errors can be traced to log entries.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidCursorException.class)
    public ProblemDetail handleInvalidCursor(InvalidCursorException ex) {
        log.warn("Invalid cursor: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Invalid Cursor", "invalid-cursor", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        return problem(HttpStatus.BAD_REQUEST, "Validation Error", "validation", detail);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ProblemDetail handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Bad parameter {}: {}", ex.getName(), ex.getValue());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request",
                "Invalid value for parameter '" + ex.getName() + "'");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", "Malformed request body");
    }

    @ExceptionHandler(UnauthenticatedException.class)
    public ProblemDetail handleUnauthenticated(UnauthenticatedException ex) {
        log.info("Unauthenticated request: {}", ex.getMessage());
        return problem(HttpStatus.UNAUTHORIZED, "Unauthenticated", "unauthenticated", ex.getMessage());
    }

    @ExceptionHandler(UnauthorizedException.class)
    public ProblemDetail handleUnauthorized(UnauthorizedException ex) {
        log.info("Forbidden: {}", ex.getMessage());
        return problem(HttpStatus.FORBIDDEN, "Unauthorized", "unauthorized", ex.getMessage());
    }

    @ExceptionHandler(UnknownSubscriptionException.class)
    public ProblemDetail handleUnknownSubscription(UnknownSubscriptionException ex) {
        log.info("Unknown subscription requested: {}", ex.name());
        return problem(HttpStatus.NOT_FOUND, "Unknown Subscription", "unknown-subscription", ex.getMessage());
    }

    @ExceptionHandler(SourceUnavailableException.class)
    public ProblemDetail handleSourceUnavailable(SourceUnavailableException ex) {
        log.error("Message store unavailable", ex);
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable", "unavailable",
                "The message store is temporarily unavailable; retry later");
    }

    @ExceptionHandler(DataAccessException.class)
    public ProblemDetail handleDataAccess(DataAccessException ex) {
        log.error("Database error", ex);
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable", "unavailable",
                "The database is temporarily unavailable; retry later");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse framework) {
            // Spring MVC's own exceptions keep their status.
            ProblemDetail body = framework.getBody();
            log.warn("Request rejected: {}", ex.getMessage());
            return problem(HttpStatus.valueOf(body.getStatus()), body.getTitle(), "request", body.getDetail());
        }
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal",
                "An unexpected error occurred");
    }

    private static ProblemDetail problem(HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create("https://parley.dev/errors/" + type));
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
        return problem;
    }
}
