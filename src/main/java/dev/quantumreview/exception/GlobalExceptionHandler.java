package dev.quantumreview.exception;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;
import java.time.Instant;

/**
 * RFC 7807 Problem Details for everything the webhook endpoint does not answer itself.
 * Internal exception messages stay in the logs.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MalformedPayloadException.class)
    public ProblemDetail handleMalformedPayload(MalformedPayloadException ex) {
        log.warn("Malformed webhook payload: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Invalid JSON payload", "malformed-payload", "Malformed Payload");
    }

    @ExceptionHandler(JobEnqueueException.class)
    public ProblemDetail handleEnqueueFailure(JobEnqueueException ex) {
        log.error("Could not enqueue {} job", ex.getJobType(), ex);
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Job queue unavailable. Please redeliver.",
                "queue-unavailable", "Queue Unavailable");
    }

    @ExceptionHandler(DataAccessException.class)
    public ProblemDetail handleStoreFailure(DataAccessException ex) {
        log.error("Shared store unavailable", ex);
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable. Please redeliver.",
                "store-unavailable", "Store Unavailable");
    }

    @ExceptionHandler(RequestNotPermitted.class)
    public ProblemDetail handleRateLimited(RequestNotPermitted ex) {
        log.warn("Rate limited: {}", ex.getMessage());
        return problem(HttpStatus.TOO_MANY_REQUESTS, "Too many requests. Please retry later.",
                "rate-limited", "Rate Limited");
    }

    @ExceptionHandler(CallNotPermittedException.class)
    public ProblemDetail handleCircuitOpen(CallNotPermittedException ex) {
        log.warn("Circuit breaker open: {}", ex.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable. Please retry later.",
                "service-unavailable", "Service Unavailable");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred. Please try again later.",
                "internal", "Internal Server Error");
    }

    private static ProblemDetail problem(HttpStatus status, String detail, String type, String title) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(URI.create("https://quantumreview.dev/errors/" + type));
        problem.setTitle(title);
        problem.setProperty("timestamp", Instant.now());
        return problem;
    }
}
