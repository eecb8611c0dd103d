package com.attest.security;

import java.util.Locale;

/**
 * Internal classification of every way authentication or authorization can fail.
 *
 * <p>The distinctions exist for logging, metrics and audit only. Callers outside the core see the
 * coarse {@link Outcome}, so a client cannot learn which individual check rejected it.
 */
public enum AuthFailure {
    INVALID_CREDENTIALS(Outcome.UNAUTHORIZED),
    ACCOUNT_DISABLED(Outcome.UNAUTHORIZED),
    TOKEN_MALFORMED(Outcome.UNAUTHORIZED),
    TOKEN_EXPIRED(Outcome.UNAUTHORIZED),
    TOKEN_REVOKED(Outcome.UNAUTHORIZED),
    WRONG_TOKEN_KIND(Outcome.UNAUTHORIZED),
    CROSS_TENANT(Outcome.FORBIDDEN),
    PERMISSION_DENIED(Outcome.FORBIDDEN);

    /** The uniform signal a failure is reported as at the boundary. */
    public enum Outcome {
        UNAUTHORIZED,
        FORBIDDEN
    }

    private final Outcome outcome;

    AuthFailure(Outcome outcome) {
        this.outcome = outcome;
    }

    public Outcome outcome() {
        return outcome;
    }

    /** Lower-case form used as a metric tag and in log lines (e.g. "token_expired"). */
    public String tagValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Whether this failure can only be raised while validating a token. */
    public boolean isTokenFailure() {
        return this == TOKEN_MALFORMED
                || this == TOKEN_EXPIRED
                || this == TOKEN_REVOKED
                || this == WRONG_TOKEN_KIND;
    }
}
