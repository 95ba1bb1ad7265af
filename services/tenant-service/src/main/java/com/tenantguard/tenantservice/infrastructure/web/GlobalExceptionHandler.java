package com.tenantguard.tenantservice.infrastructure.web;

import com.tenantguard.authorization.ErrorKind;
import com.tenantguard.authorization.TenantAccessException;
import com.tenantguard.authorization.TenantException;
import com.tenantguard.authorization.TenantValidationException;
import com.tenantguard.observability.CorrelationContextHolder;
import java.net.URI;
import java.time.Instant;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <pre>
 * {
 *   "type": "https://tenantguard.dev/errors/access-denied",
 *   "title": "Access Denied",
 *   "status": 403,
 *   "detail": "Insufficient permissions to view tenant statistics",
 *   "code": "ACCESS_DENIED",
 *   "tenantId": "0b0c...",
 *   "timestamp": "2025-07-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>Store failures are answered with 503 and a generic detail; the store's own message only
 * reaches the log.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final String ERROR_TYPE_BASE = "https://tenantguard.dev/errors/";

    @ExceptionHandler(TenantException.class)
    public ProblemDetail handleTenantException(TenantException ex) {
        ErrorKind kind = ex.kind();
        HttpStatus status = statusOf(kind);
        if (kind == ErrorKind.STORE) {
            log.error("Store failure: {}", ex.getMessage(), ex.getCause());
        } else {
            log.warn("{}: {}", kind.code(), ex.getMessage());
        }
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problem.setTitle(titleOf(kind));
        problem.setType(URI.create(ERROR_TYPE_BASE + slugOf(kind)));
        problem.setProperty("code", kind.code());
        problem.setProperty("retryable", kind.retryable());
        if (ex.tenantId() != null) {
            problem.setProperty("tenantId", ex.tenantId());
        }
        if (ex instanceof TenantAccessException access) {
            problem.setProperty("requiredRole", access.requiredRole() == null ? null : access.requiredRole().label());
            problem.setProperty("actualRole", access.actualRole() == null ? null : access.actualRole().label());
        }
        if (ex instanceof TenantValidationException validation) {
            problem.setProperty("field", validation.field());
        }
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMostSpecificCause().getClass().getSimpleName());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Malformed request body");
        problem.setTitle("Bad Request");
        problem.setType(URI.create(ERROR_TYPE_BASE + "bad-request"));
        problem.setProperty("code", ErrorKind.VALIDATION.code());
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ProblemDetail handleMissingHeader(MissingRequestHeaderException ex) {
        log.warn("Missing header: {}", ex.getHeaderName());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.UNAUTHORIZED, "Missing required header " + ex.getHeaderName());
        problem.setTitle("Unauthorized");
        problem.setType(URI.create(ERROR_TYPE_BASE + "unauthorized"));
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
        problem.setTitle("Validation Error");
        problem.setType(URI.create(ERROR_TYPE_BASE + "validation"));
        problem.setProperty("code", ErrorKind.VALIDATION.code());
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
        problem.setTitle("Internal Server Error");
        problem.setType(URI.create(ERROR_TYPE_BASE + "internal"));
        enrichWithCorrelation(problem);
        return problem;
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case ACCESS_DENIED -> HttpStatus.FORBIDDEN;
            case INVARIANT_VIOLATION -> HttpStatus.CONFLICT;
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case STORE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    private static String titleOf(ErrorKind kind) {
        return switch (kind) {
            case NOT_FOUND -> "Not Found";
            case ACCESS_DENIED -> "Access Denied";
            case INVARIANT_VIOLATION -> "Ownership Invariant Violation";
            case VALIDATION -> "Validation Error";
            case STORE -> "Service Unavailable";
        };
    }

    private static String slugOf(ErrorKind kind) {
        return kind.name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    private void enrichWithCorrelation(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
    }
}
