package com.attest.security;

import java.util.Optional;

/** The two token kinds. Refresh tokens are only ever exchanged for new access tokens. */
public enum TokenKind {
    ACCESS("access"),
    REFRESH("refresh");

    private final String claimValue;

    TokenKind(String claimValue) {
        this.claimValue = claimValue;
    }

    /** Value written to the {@code kind} claim. */
    public String claimValue() {
        return claimValue;
    }

    public static Optional<TokenKind> fromClaim(String value) {
        for (TokenKind kind : values()) {
            if (kind.claimValue.equals(value)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
