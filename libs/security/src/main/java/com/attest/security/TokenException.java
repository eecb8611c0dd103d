package com.attest.security;

/**
 * Thrown when a bearer token is rejected: malformed or badly signed, expired, revoked, or of the
 * wrong kind for the operation.
 */
public class TokenException extends AuthException {

    public TokenException(AuthFailure failure, String message) {
        super(requireTokenFailure(failure), message);
    }

    public TokenException(AuthFailure failure, String message, Throwable cause) {
        super(requireTokenFailure(failure), message, cause);
    }

    private static AuthFailure requireTokenFailure(AuthFailure failure) {
        if (failure == null || !failure.isTokenFailure()) {
            throw new IllegalArgumentException("Not a token failure: " + failure);
        }
        return failure;
    }
}
