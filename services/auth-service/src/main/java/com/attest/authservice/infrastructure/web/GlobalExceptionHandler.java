package com.attest.authservice.infrastructure.web;

import com.attest.security.AuthException;
import com.attest.security.AuthFailure;
import com.attest.security.BearerTokenExtractor;
import com.attest.security.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps exceptions to RFC 7807 ProblemDetail responses.
 *
 * <pre>
 * {
 *   "type": "https://attest.dev/errors/forbidden",
 *   "title": "Forbidden",
 *   "status": 403,
 *   "detail": "Access to this resource is denied",
 *   "timestamp": "2025-07-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>Every {@link AuthException} becomes one of two fixed bodies, 401 or 403, whatever check
 * failed. A store outage is a 503, never an authentication failure.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(AuthException.class)
    public ResponseEntity<ProblemDetail> handleAuth(AuthException ex) {
        log.info("Request rejected: {}", ex.failure().tagValue());
        ProblemDetail problem = AuthProblemDetails.forOutcome(ex.outcome());
        ResponseEntity.BodyBuilder response = ResponseEntity.status(problem.getStatus());
        if (ex.outcome() == AuthFailure.Outcome.UNAUTHORIZED) {
            response.header(HttpHeaders.WWW_AUTHENTICATE, BearerTokenExtractor.SCHEME);
        }
        return response.body(problem);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ProblemDetail handleStoreUnavailable(StoreUnavailableException ex) {
        log.error("Backing store unavailable", ex);
        return AuthProblemDetails.create(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable",
                "The service is temporarily unavailable", "unavailable");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return AuthProblemDetails.create(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), "bad-request");
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ProblemDetail handleNotFound(NoResourceFoundException ex) {
        log.debug("No handler for {}", ex.getResourcePath());
        return AuthProblemDetails.create(HttpStatus.NOT_FOUND, "Not Found",
                "No resource at " + ex.getResourcePath(), "not-found");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return AuthProblemDetails.create(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred", "internal");
    }
}
