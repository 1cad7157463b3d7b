package com.reflex.service.infrastructure.web;

import com.reflex.common.ConnectionException;
import com.reflex.common.EventValidationException;
import com.reflex.common.ReflexException;
import com.reflex.common.ViewException;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to RFC 7807 ProblemDetail responses.
 *
 * <pre>
 * {
 *   "type": "https://reflex.dev/errors/connection",
 *   "title": "Store Unavailable",
 *   "status": 503,
 *   "detail": "timed out waiting for a session",
 *   "component": "connection-supervisor",
 *   "retryable": true,
 *   "timestamp": "2025-07-12T10:30:00Z"
 * }
 * </pre>
 *
 * <p>Mesh and view failures were already logged by the component that raised them, so they are only
 * logged here at debug level.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String ERROR_BASE = "https://reflex.dev/errors/";

    @ExceptionHandler(EventValidationException.class)
    public ProblemDetail handleEventValidation(EventValidationException ex) {
        log.debug("Rejected event: {}", ex.getMessage());
        ProblemDetail problem = reflexProblem(HttpStatus.BAD_REQUEST, "Invalid Event", "invalid-event", ex);
        problem.setProperty("eventType", ex.eventType());
        problem.setProperty("violations", ex.violations());
        problem.setProperty("missingFields", ex.missingFields());
        problem.setProperty("mismatchedFields", ex.mismatchedFields());
        return problem;
    }

    @ExceptionHandler(ConnectionException.class)
    public ProblemDetail handleConnection(ConnectionException ex) {
        log.debug("Store unavailable: {}", ex.getMessage());
        return reflexProblem(HttpStatus.SERVICE_UNAVAILABLE, "Store Unavailable", "connection", ex);
    }

    @ExceptionHandler(ViewException.class)
    public ProblemDetail handleView(ViewException ex) {
        log.debug("View failure ({}): {}", ex.kind(), ex.getMessage());
        ProblemDetail problem =
                ex.kind() == ViewException.Kind.UNKNOWN_VIEW
                        ? reflexProblem(HttpStatus.NOT_FOUND, "Unknown View", "unknown-view", ex)
                        : reflexProblem(HttpStatus.CONFLICT, "View Unavailable", "view", ex);
        problem.setProperty("view", ex.viewName());
        problem.setProperty("kind", ex.kind().name());
        return problem;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        ProblemDetail problem =
                ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setTitle("Bad Request");
        problem.setType(URI.create(ERROR_BASE + "bad-request"));
        stamp(problem);
        return problem;
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
        problem.setType(URI.create(ERROR_BASE + "validation"));
        stamp(problem);
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        ProblemDetail problem =
                ProblemDetail.forStatusAndDetail(
                        HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
        problem.setTitle("Internal Server Error");
        problem.setType(URI.create(ERROR_BASE + "internal"));
        stamp(problem);
        return problem;
    }

    private static ProblemDetail reflexProblem(
            HttpStatus status, String title, String type, ReflexException ex) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problem.setTitle(title);
        problem.setType(URI.create(ERROR_BASE + type));
        problem.setProperty("component", ex.component());
        problem.setProperty("retryable", ex.retryable());
        stamp(problem);
        return problem;
    }

    private static void stamp(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
    }
}
