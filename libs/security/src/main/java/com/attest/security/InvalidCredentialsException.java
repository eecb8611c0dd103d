package com.attest.security;

/**
 * Thrown when a login or credential re-check fails.
 *
 * <p>"Unknown email" and "wrong secret" both produce {@link AuthFailure#INVALID_CREDENTIALS} with
 * the same message. {@link AuthFailure#ACCOUNT_DISABLED} is only raised after the secret has been
 * verified.
 */
public class InvalidCredentialsException extends AuthException {

    public InvalidCredentialsException() {
        this(AuthFailure.INVALID_CREDENTIALS);
    }

    public InvalidCredentialsException(AuthFailure failure) {
        super(failure, failure == AuthFailure.ACCOUNT_DISABLED
                ? "Account is disabled"
                : "Invalid credentials");
        if (failure != AuthFailure.INVALID_CREDENTIALS && failure != AuthFailure.ACCOUNT_DISABLED) {
            throw new IllegalArgumentException("Not a credential failure: " + failure);
        }
    }
}
