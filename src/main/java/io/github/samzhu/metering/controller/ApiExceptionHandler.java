package io.github.samzhu.metering.controller;

import java.net.URI;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import io.github.samzhu.metering.config.RequestIdFilter;
import io.github.samzhu.metering.exception.IdempotencyConflictException;
import io.github.samzhu.metering.exception.InvalidIdempotencyKeyException;
import io.github.samzhu.metering.exception.LimitExceededException;
import io.github.samzhu.metering.exception.OrgNotFoundException;
import io.github.samzhu.metering.exception.UnknownPlanException;

/**
 * API 例外處理，轉換為 RFC 7807 {@link ProblemDetail}。
 *
 * <p>用量超限回應範例：
 * <pre>
 * {
 *   "type": "https://metering.samzhu.github.io/errors/limit-exceeded",
 *   "title": "Limit Exceeded",
 *   "status": 429,
 *   "detail": "scans limit reached. Please upgrade your plan.",
 *   "code": "LIMIT_EXCEEDED",
 *   "resource": "scans",
 *   "limit": 1000,
 *   "current": 999,
 *   "requestId": "..."
 * }
 * </pre>
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private static final String ERROR_TYPE_BASE = "https://metering.samzhu.github.io/errors/";

    @ExceptionHandler(LimitExceededException.class)
    public ProblemDetail handleLimitExceeded(LimitExceededException ex) {
        ProblemDetail problem = problem(HttpStatus.TOO_MANY_REQUESTS, "Limit Exceeded", "limit-exceeded",
            ex.getMessage());
        problem.setProperty("code", ex.getCode());
        problem.setProperty("resource", ex.getResource());
        problem.setProperty("limit", ex.getLimit());
        problem.setProperty("current", ex.getCurrent());
        problem.setProperty("requested", ex.getRequested());
        return problem;
    }

    @ExceptionHandler(InvalidIdempotencyKeyException.class)
    public ProblemDetail handleInvalidIdempotencyKey(InvalidIdempotencyKeyException ex) {
        log.warn("Invalid idempotency key: {}", ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, "Invalid Idempotency Key",
            "invalid-idempotency-key", ex.getMessage());
        problem.setProperty("code", "INVALID_IDEMPOTENCY_KEY");
        return problem;
    }

    @ExceptionHandler(IdempotencyConflictException.class)
    public ProblemDetail handleIdempotencyConflict(IdempotencyConflictException ex) {
        ProblemDetail problem = problem(HttpStatus.CONFLICT, "Request In Progress", "request-in-progress",
            ex.getMessage());
        problem.setProperty("code", "REQUEST_IN_PROGRESS");
        return problem;
    }

    @ExceptionHandler(OrgNotFoundException.class)
    public ProblemDetail handleOrgNotFound(OrgNotFoundException ex) {
        ProblemDetail problem = problem(HttpStatus.NOT_FOUND, "Organization Not Found", "org-not-found",
            ex.getMessage());
        problem.setProperty("orgId", ex.getOrgId());
        return problem;
    }

    @ExceptionHandler(UnknownPlanException.class)
    public ProblemDetail handleUnknownPlan(UnknownPlanException ex) {
        log.error("Plan configuration error: {}", ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.UNPROCESSABLE_ENTITY, "Unknown Plan", "unknown-plan",
            ex.getMessage());
        problem.setProperty("planTier", ex.getPlanTier());
        return problem;
    }

    @ExceptionHandler({IllegalArgumentException.class, MissingRequestHeaderException.class})
    public ProblemDetail handleBadRequest(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        String detail = ex.getBindingResult().getFieldErrors().stream()
            .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
            .reduce((a, b) -> a + "; " + b)
            .orElse("Validation failed");
        log.warn("Validation failed: {}", detail);
        return problem(HttpStatus.BAD_REQUEST, "Validation Error", "validation", detail);
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal",
            "An unexpected error occurred");
    }

    private static ProblemDetail problem(HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(ERROR_TYPE_BASE + type));
        problem.setProperty("timestamp", Instant.now().toString());
        String requestId = RequestIdFilter.currentRequestId();
        if (requestId != null) {
            problem.setProperty("requestId", requestId);
        }
        return problem;
    }
}
