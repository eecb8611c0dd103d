package com.attest.authservice.config;

import com.attest.security.CredentialVerifier;
import com.attest.security.PasswordPolicy;
import com.attest.security.TokenSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration of the authentication core, bound from {@code attest.auth.*}.
 *
 * <pre>
 * attest:
 *   auth:
 *     issuer: attest
 *     signing-keys:
 *       - id: 2025-03
 *         secret: ${ATTEST_SIGNING_SECRET}
 *     access-token-ttl: PT1H
 *     refresh-token-ttl: P30D
 *     clock-skew: PT5S
 *     bootstrap:
 *       organization-name: Attest
 *       admin-email: admin@attest.local
 *       admin-password: ${ATTEST_ADMIN_PASSWORD}
 * </pre>
 *
 * @param issuer                  {@code iss} claim written and required on tokens
 * @param signingKeys             HMAC keys, newest first; the first one signs
 * @param accessTokenTtl          access token lifetime (default 1 hour)
 * @param refreshTokenTtl         refresh token lifetime (default 30 days)
 * @param clockSkew               tolerance applied to expiry checks (default 5 seconds)
 * @param passwordMinLength       minimum length of new passwords (default 8)
 * @param bcryptStrength          BCrypt log rounds (default 12)
 * @param revocationPurgeInterval how often stale revocation records are dropped (default 10 minutes)
 * @param bootstrap               optional first administrator
 */
@ConfigurationProperties(prefix = "attest.auth")
@Validated
public record AuthProperties(
        String issuer,
        @NotEmpty @Valid List<SigningKey> signingKeys,
        Duration accessTokenTtl,
        Duration refreshTokenTtl,
        Duration clockSkew,
        @Min(1) int passwordMinLength,
        @Min(4) @Max(31) int bcryptStrength,
        Duration revocationPurgeInterval,
        @Valid Bootstrap bootstrap) {

    /**
     * Compact constructor: applies defaults for optional fields. Runs before Bean Validation, so
     * defaults satisfy the constraints.
     */
    public AuthProperties {
        if (issuer == null || issuer.isBlank()) {
            issuer = TokenSettings.DEFAULT_ISSUER;
        }
        if (accessTokenTtl == null) {
            accessTokenTtl = TokenSettings.DEFAULT_ACCESS_TTL;
        }
        if (refreshTokenTtl == null) {
            refreshTokenTtl = TokenSettings.DEFAULT_REFRESH_TTL;
        }
        if (clockSkew == null) {
            clockSkew = TokenSettings.DEFAULT_CLOCK_SKEW;
        }
        if (passwordMinLength <= 0) {
            passwordMinLength = PasswordPolicy.DEFAULT_MIN_LENGTH;
        }
        if (bcryptStrength <= 0) {
            bcryptStrength = CredentialVerifier.DEFAULT_STRENGTH;
        }
        if (revocationPurgeInterval == null) {
            revocationPurgeInterval = Duration.ofMinutes(10);
        }
        if (bootstrap == null) {
            bootstrap = new Bootstrap(null, null, null);
        }
        signingKeys = signingKeys == null ? List.of() : List.copyOf(signingKeys);
    }

    public TokenSettings tokenSettings() {
        return new TokenSettings(issuer, accessTokenTtl, refreshTokenTtl, clockSkew);
    }

    /**
     * @param id     {@code kid} header value
     * @param secret Base64 or raw text, at least 32 bytes
     */
    public record SigningKey(@NotBlank String id, @NotBlank String secret) {

        @Override
        public String toString() {
            return "SigningKey[id=" + id + "]";
        }
    }

    /**
     * First administrator created at startup when no user holds {@code adminEmail} yet.
     *
     * @param organizationName organization the administrator belongs to (default "Attest")
     * @param adminEmail       login email; seeding is skipped when blank
     * @param adminPassword    initial password; seeding is skipped when blank
     */
    public record Bootstrap(String organizationName, String adminEmail, String adminPassword) {

        public Bootstrap {
            if (organizationName == null || organizationName.isBlank()) {
                organizationName = "Attest";
            }
        }

        public boolean enabled() {
            return adminEmail != null && !adminEmail.isBlank()
                    && adminPassword != null && !adminPassword.isBlank();
        }

        @Override
        public String toString() {
            return "Bootstrap[organizationName=" + organizationName + ", adminEmail=" + adminEmail + "]";
        }
    }
}
