package com.attest.security;

import java.time.Duration;

/**
 * Token lifetimes and validation tolerance, passed to {@link TokenService} at construction.
 *
 * @param issuer          value of the {@code iss} claim, required on validation
 * @param accessTokenTtl  lifetime of access tokens
 * @param refreshTokenTtl lifetime of refresh tokens
 * @param clockSkew       symmetric tolerance applied to expiry checks across validators
 */
public record TokenSettings(
        String issuer, Duration accessTokenTtl, Duration refreshTokenTtl, Duration clockSkew) {

    public static final String DEFAULT_ISSUER = "attest";
    public static final Duration DEFAULT_ACCESS_TTL = Duration.ofHours(1);
    public static final Duration DEFAULT_REFRESH_TTL = Duration.ofDays(30);
    public static final Duration DEFAULT_CLOCK_SKEW = Duration.ofSeconds(5);

    private static final Duration MIN_TTL = Duration.ofSeconds(1);

    public TokenSettings {
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalArgumentException("issuer must not be null or blank");
        }
        requirePositive(accessTokenTtl, "accessTokenTtl");
        requirePositive(refreshTokenTtl, "refreshTokenTtl");
        if (clockSkew == null || clockSkew.isNegative()) {
            throw new IllegalArgumentException("clockSkew must not be null or negative");
        }
    }

    public static TokenSettings defaults() {
        return new TokenSettings(
                DEFAULT_ISSUER, DEFAULT_ACCESS_TTL, DEFAULT_REFRESH_TTL, DEFAULT_CLOCK_SKEW);
    }

    public Duration ttlFor(TokenKind kind) {
        return kind == TokenKind.REFRESH ? refreshTokenTtl : accessTokenTtl;
    }

    /** Upper bound on how long any token issued now can still validate. */
    public Duration maxTokenLifetime() {
        Duration longest = refreshTokenTtl.compareTo(accessTokenTtl) >= 0 ? refreshTokenTtl : accessTokenTtl;
        return longest.plus(clockSkew);
    }

    /** Token times have whole-second granularity, so shorter lifetimes would expire on issue. */
    static void requirePositive(Duration duration, String name) {
        if (duration == null || duration.compareTo(MIN_TTL) < 0) {
            throw new IllegalArgumentException(name + " must be at least one second");
        }
    }
}
