package com.lexguard.gateway.infrastructure.web;

import com.lexguard.observability.RequestCorrelationHolder;
import com.lexguard.security.TenantSecurityException;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <p>Tenant security errors are mapped by {@link com.lexguard.security.ErrorCategory}:
 *
 * <ul>
 *   <li>{@code AUTHENTICATION} → 401
 *   <li>{@code AUTHORIZATION} → 403, with the denial reason as detail
 *   <li>{@code CONFLICT} → 409
 *   <li>{@code PROGRAMMING_ERROR}, {@code SECURITY_INCIDENT} → 500 with a generic detail
 * </ul>
 *
 * <p>The detail is always {@link TenantSecurityException#publicMessage()}; the internal message
 * only goes to the log. Every response carries a timestamp and the correlation ID.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String ERROR_TYPE_BASE = "https://lexguard.dev/errors/";

    @ExceptionHandler(TenantSecurityException.class)
    public ProblemDetail handleTenantSecurity(TenantSecurityException ex) {
        HttpStatus status;
        String type;
        switch (ex.category()) {
            case AUTHENTICATION -> {
                log.warn("Unauthenticated request: {}", ex.getMessage());
                status = HttpStatus.UNAUTHORIZED;
                type = "unauthenticated";
            }
            case AUTHORIZATION -> {
                log.warn("Permission denied: {}", ex.getMessage());
                status = HttpStatus.FORBIDDEN;
                type = "forbidden";
            }
            case CONFLICT -> {
                log.warn("Conflict: {}", ex.getMessage());
                status = HttpStatus.CONFLICT;
                type = "conflict";
            }
            default -> {
                log.error("Tenant isolation failure ({}): {}", ex.category(), ex.getMessage());
                status = HttpStatus.INTERNAL_SERVER_ERROR;
                type = "internal";
            }
        }
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, ex.publicMessage());
        problem.setTitle(status.getReasonPhrase());
        problem.setType(URI.create(ERROR_TYPE_BASE + type));
        if (ex.isRetryable()) {
            problem.setProperty("retryable", true);
        }
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return badRequest(ex.getMessage());
    }

    @ExceptionHandler({
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
    })
    public ProblemDetail handleUnreadableRequest(Exception ex) {
        log.warn("Unreadable request: {}", ex.getMessage());
        return badRequest("Malformed request");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
        problem.setTitle("Validation Error");
        problem.setType(URI.create(ERROR_TYPE_BASE + "validation"));
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        ProblemDetail problem =
                ProblemDetail.forStatusAndDetail(
                        HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
        problem.setTitle("Internal Server Error");
        problem.setType(URI.create(ERROR_TYPE_BASE + "internal"));
        enrichWithCorrelation(problem);
        return problem;
    }

    private ProblemDetail badRequest(String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
        problem.setTitle("Bad Request");
        problem.setType(URI.create(ERROR_TYPE_BASE + "bad-request"));
        enrichWithCorrelation(problem);
        return problem;
    }

    private void enrichWithCorrelation(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        RequestCorrelationHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
    }
}
