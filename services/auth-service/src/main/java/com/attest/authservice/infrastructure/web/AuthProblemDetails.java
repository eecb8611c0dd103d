package com.attest.authservice.infrastructure.web;

import com.attest.security.AuthFailure;
import java.net.URI;
import java.time.Instant;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

/**
 * RFC 7807 bodies for rejected requests.
 *
 * <p>Authentication and authorization failures get one fixed body per outcome. The specific check
 * that failed (expired, revoked, wrong organization, missing permission) stays in the server log.
 */
public final class AuthProblemDetails {

    public static final String ERROR_TYPE_BASE = "https://attest.dev/errors/";

    private AuthProblemDetails() {
        // utility class
    }

    public static ProblemDetail unauthorized() {
        return create(HttpStatus.UNAUTHORIZED, "Unauthorized", "Authentication is required", "unauthorized");
    }

    public static ProblemDetail forbidden() {
        return create(HttpStatus.FORBIDDEN, "Forbidden", "Access to this resource is denied", "forbidden");
    }

    public static ProblemDetail forOutcome(AuthFailure.Outcome outcome) {
        return outcome == AuthFailure.Outcome.FORBIDDEN ? forbidden() : unauthorized();
    }

    public static ProblemDetail create(HttpStatus status, String title, String detail, String type) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(ERROR_TYPE_BASE + type));
        problem.setProperty("timestamp", Instant.now().toString());
        String correlationId = MDC.get(CorrelationIdFilter.MDC_CORRELATION_ID);
        if (correlationId != null) {
            problem.setProperty("correlationId", correlationId);
        }
        return problem;
    }
}
