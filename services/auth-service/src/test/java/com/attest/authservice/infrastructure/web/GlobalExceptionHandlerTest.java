package com.attest.authservice.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.attest.security.AuthFailure;
import com.attest.security.CrossTenantAccessException;
import com.attest.security.InvalidCredentialsException;
import com.attest.security.PermissionCode;
import com.attest.security.PermissionDeniedException;
import com.attest.security.TokenException;
import com.attest.security.store.StoreUnavailableException;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;

/**
 * Unit tests for {@link GlobalExceptionHandler}, no Spring context.
 */
@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @AfterEach
    void cleanup() {
        MDC.clear();
    }

    @Nested
    @DisplayName("authentication and authorization failures")
    class AuthFailures {

        @Test
        @DisplayName("map every unauthorized failure to the same 401 body")
        void uniform401() {
            ResponseEntity<ProblemDetail> expired =
                    handler.handleAuth(new TokenException(AuthFailure.TOKEN_EXPIRED, "Token has expired"));
            ResponseEntity<ProblemDetail> credentials = handler.handleAuth(new InvalidCredentialsException());
            ResponseEntity<ProblemDetail> disabled =
                    handler.handleAuth(new InvalidCredentialsException(AuthFailure.ACCOUNT_DISABLED));

            for (ResponseEntity<ProblemDetail> response : List.of(expired, credentials, disabled)) {
                assertThat(response.getStatusCode().value()).isEqualTo(401);
                assertThat(response.getHeaders().getFirst("WWW-Authenticate")).isEqualTo("Bearer");
                assertThat(response.getBody().getTitle()).isEqualTo("Unauthorized");
                assertThat(response.getBody().getDetail()).isEqualTo("Authentication is required");
            }
        }

        @Test
        @DisplayName("map cross-tenant and missing permission to the same 403 body")
        void uniform403() {
            ResponseEntity<ProblemDetail> crossTenant =
                    handler.handleAuth(new CrossTenantAccessException("org-a", "org-b"));
            ResponseEntity<ProblemDetail> denied =
                    handler.handleAuth(new PermissionDeniedException("alice", PermissionCode.of("doc:delete")));

            assertThat(crossTenant.getStatusCode().value()).isEqualTo(403);
            assertThat(denied.getStatusCode().value()).isEqualTo(403);
            assertThat(crossTenant.getBody().getDetail()).isEqualTo(denied.getBody().getDetail());
            assertThat(crossTenant.getBody().getDetail()).doesNotContain("org-b");
            assertThat(crossTenant.getHeaders().containsKey("WWW-Authenticate")).isFalse();
        }
    }

    @Test
    @DisplayName("maps a store outage to 503")
    void storeUnavailable() {
        ProblemDetail result = handler.handleStoreUnavailable(new StoreUnavailableException("db down"));

        assertThat(result.getStatus()).isEqualTo(503);
        assertThat(result.getDetail()).doesNotContain("db down");
    }

    @Test
    @DisplayName("maps IllegalArgumentException to 400 Bad Request")
    void handlesIllegalArgumentAsBadRequest() {
        ProblemDetail result = handler.handleIllegalArgument(new IllegalArgumentException("invalid input"));

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getDetail()).isEqualTo("invalid input");
        assertThat(result.getTitle()).isEqualTo("Bad Request");
    }

    @Test
    @DisplayName("maps generic Exception to 500 Internal Server Error")
    void handlesGenericExceptionAsInternalError() {
        ProblemDetail result = handler.handleGeneric(new RuntimeException("something broke"));

        assertThat(result.getStatus()).isEqualTo(500);
        assertThat(result.getTitle()).isEqualTo("Internal Server Error");
    }

    @Test
    @DisplayName("error response includes timestamp and correlation ID")
    void includesTimestampAndCorrelationId() {
        MDC.put(CorrelationIdFilter.MDC_CORRELATION_ID, "corr-42");

        ProblemDetail result = handler.handleGeneric(new RuntimeException("oops"));

        assertThat(result.getProperties()).containsKey("timestamp").containsEntry("correlationId", "corr-42");
    }
}
