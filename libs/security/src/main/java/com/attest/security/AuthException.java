package com.attest.security;

/**
 * Base class for every recoverable authentication/authorization failure raised by the core.
 *
 * <p>Unchecked, like {@link CrossTenantAccessException}: the routing layer translates the {@link
 * #outcome()} into a uniform 401/403 response and the message never leaves the process.
 */
public abstract class AuthException extends RuntimeException {

    private final AuthFailure failure;

    protected AuthException(AuthFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    protected AuthException(AuthFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    /** The specific check that failed (for logs and audit only). */
    public AuthFailure failure() {
        return failure;
    }

    /** The coarse signal to report outward. */
    public AuthFailure.Outcome outcome() {
        return failure.outcome();
    }
}
