package com.attest.security;

import com.attest.security.store.RevocationStore;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwsHeader;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.LocatorAdapter;
import io.jsonwebtoken.MalformedJwtException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Issues and validates signed, time-bounded access and refresh tokens.
 *
 * <p>Tokens are compact JWS strings (HS256) carrying {@code iss, sub, org, kind, roles, iat, exp,
 * jti}. Validation order is fixed:
 *
 * <ol>
 *   <li>signature, with the key named by the {@code kid} header ({@link
 *       AuthFailure#TOKEN_MALFORMED} on any mismatch; no claim is read from an unverified token)
 *   <li>expiry, {@code now < exp + skew} ({@link AuthFailure#TOKEN_EXPIRED})
 *   <li>revocation, by token id or subject cutoff ({@link AuthFailure#TOKEN_REVOKED})
 * </ol>
 *
 * <p>Apart from the revocation lookup this class is a pure function of its inputs, the key ring
 * and the clock; it holds no mutable state and needs no locking.
 */
public class TokenService {

    private static final Logger log = LoggerFactory.getLogger(TokenService.class);

    static final String CLAIM_ORGANIZATION = "org";
    static final String CLAIM_KIND = "kind";
    static final String CLAIM_ROLES = "roles";

    private final SigningKeyRing keyRing;
    private final TokenSettings settings;
    private final RevocationStore revocations;
    private final Clock clock;
    private final AuthMetrics metrics;
    private final JwtParser parser;

    public TokenService(
            SigningKeyRing keyRing,
            TokenSettings settings,
            RevocationStore revocations,
            Clock clock,
            AuthMetrics metrics) {
        this.keyRing = Objects.requireNonNull(keyRing, "keyRing");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.revocations = Objects.requireNonNull(revocations, "revocations");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.parser = Jwts.parser()
                .keyLocator(new KeyRingLocator(keyRing))
                .requireIssuer(settings.issuer())
                .clock(() -> Date.from(clock.instant()))
                .clockSkewSeconds(settings.clockSkew().toSeconds())
                .build();
    }

    // ── Issuance ──

    /**
     * Signs a new token.
     *
     * @param subjectId      user id
     * @param organizationId organization the token is bound to
     * @param kind           access or refresh
     * @param ttl            lifetime from now, truncated to whole seconds
     * @param roleIds        role ids assigned to the subject at issuance
     */
    public IssuedToken issue(
            String subjectId,
            String organizationId,
            TokenKind kind,
            Duration ttl,
            Collection<String> roleIds) {
        requireText(subjectId, "subjectId");
        requireText(organizationId, "organizationId");
        Objects.requireNonNull(kind, "kind");
        TokenSettings.requirePositive(ttl, "ttl");

        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = issuedAt.plus(ttl).truncatedTo(ChronoUnit.SECONDS);
        String tokenId = UUID.randomUUID().toString();
        Set<String> roles = roleIds == null ? Set.of() : new TreeSet<>(roleIds);
        SigningKeyRing.SigningKey signingKey = keyRing.signingKey();

        String token = Jwts.builder()
                .header().keyId(signingKey.keyId()).and()
                .id(tokenId)
                .issuer(settings.issuer())
                .subject(subjectId)
                .claim(CLAIM_ORGANIZATION, organizationId)
                .claim(CLAIM_KIND, kind.claimValue())
                .claim(CLAIM_ROLES, List.copyOf(roles))
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(expiresAt))
                .signWith(signingKey.secretKey(), Jwts.SIG.HS256)
                .compact();

        log.debug("Issued {} token {} for subject {} in organization {}",
                kind.claimValue(), tokenId, subjectId, organizationId);
        return new IssuedToken(token, new TokenClaims(
                tokenId, subjectId, organizationId, kind, roles, issuedAt, expiresAt));
    }

    public IssuedToken issueAccessToken(
            String subjectId, String organizationId, Collection<String> roleIds) {
        return issue(subjectId, organizationId, TokenKind.ACCESS, settings.accessTokenTtl(), roleIds);
    }

    public IssuedToken issueRefreshToken(
            String subjectId, String organizationId, Collection<String> roleIds) {
        return issue(subjectId, organizationId, TokenKind.REFRESH, settings.refreshTokenTtl(), roleIds);
    }

    // ── Validation ──

    /**
     * Verifies signature, expiry and revocation, in that order.
     *
     * @return the verified claims
     * @throws TokenException when any check fails
     */
    public TokenClaims validate(String token) {
        try {
            TokenClaims claims = verify(token);
            metrics.tokenValidated();
            return claims;
        } catch (TokenException e) {
            metrics.tokenRejected(e.failure());
            log.debug("Token rejected: {}", e.failure().tagValue());
            throw e;
        }
    }

    /**
     * Validates and additionally requires the given kind.
     *
     * @throws TokenException with {@link AuthFailure#WRONG_TOKEN_KIND} on a kind mismatch
     */
    public TokenClaims validate(String token, TokenKind expectedKind) {
        TokenClaims claims = validate(token);
        if (claims.kind() != expectedKind) {
            metrics.tokenRejected(AuthFailure.WRONG_TOKEN_KIND);
            throw new TokenException(AuthFailure.WRONG_TOKEN_KIND,
                    "Expected a %s token".formatted(expectedKind.claimValue()));
        }
        return claims;
    }

    /** Validates an access token and builds the per-request identity context from it. */
    public SecurityContext contextFromToken(String accessToken) {
        return SecurityContext.fromClaims(validate(accessToken, TokenKind.ACCESS));
    }

    /**
     * Exchanges a refresh token for a new access token bound to the same subject, organization and
     * role claims. The refresh token's own lifetime is not extended.
     *
     * @throws TokenException with {@link AuthFailure#WRONG_TOKEN_KIND} when given an access token
     */
    public IssuedToken refresh(String refreshToken) {
        TokenClaims claims = validate(refreshToken, TokenKind.REFRESH);
        return issueAccessToken(claims.subjectId(), claims.organizationId(), claims.roleIds());
    }

    // ── Revocation ──

    /** Revokes one token. Tokens derived from it (access tokens from a refresh token) stay valid. */
    public void revoke(TokenClaims claims) {
        revoke(claims.tokenId(), claims.expiresAt());
    }

    public void revoke(String tokenId, Instant expiresAt) {
        requireText(tokenId, "tokenId");
        revocations.recordRevocation(tokenId, expiresAt.plus(settings.clockSkew()));
        log.info("Revoked token {}", tokenId);
    }

    /**
     * Revokes every token of the subject issued at or before the current second.
     */
    public void revokeAllSessions(String subjectId) {
        requireText(subjectId, "subjectId");
        Instant cutoff = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        revocations.revokeSubjectBefore(subjectId, cutoff, cutoff.plus(settings.maxTokenLifetime()));
        log.info("Revoked all sessions of subject {} issued at or before {}", subjectId, cutoff);
    }

    public TokenSettings settings() {
        return settings;
    }

    // ── Private Helpers ──

    private TokenClaims verify(String token) {
        if (token == null || token.isBlank()) {
            throw new TokenException(AuthFailure.TOKEN_MALFORMED, "Token is missing");
        }
        TokenClaims claims;
        try {
            claims = toClaims(parser.parseSignedClaims(token).getPayload());
        } catch (ExpiredJwtException e) {
            throw new TokenException(AuthFailure.TOKEN_EXPIRED, "Token has expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new TokenException(AuthFailure.TOKEN_MALFORMED, "Token could not be verified", e);
        }

        if (!clock.instant().isBefore(claims.expiresAt().plus(settings.clockSkew()))) {
            throw new TokenException(AuthFailure.TOKEN_EXPIRED, "Token has expired");
        }
        if (isRevoked(claims)) {
            throw new TokenException(AuthFailure.TOKEN_REVOKED, "Token has been revoked");
        }
        return claims;
    }

    private boolean isRevoked(TokenClaims claims) {
        if (revocations.isTokenRevoked(claims.tokenId())) {
            return true;
        }
        return revocations.subjectRevokedBefore(claims.subjectId())
                .map(cutoff -> !claims.issuedAt().isAfter(cutoff))
                .orElse(false);
    }

    private static TokenClaims toClaims(Claims body) {
        String tokenId = body.getId();
        String subjectId = body.getSubject();
        String organizationId = body.get(CLAIM_ORGANIZATION, String.class);
        TokenKind kind = TokenKind.fromClaim(body.get(CLAIM_KIND, String.class)).orElse(null);
        Date issuedAt = body.getIssuedAt();
        Date expiresAt = body.getExpiration();
        if (isBlank(tokenId) || isBlank(subjectId) || isBlank(organizationId)
                || kind == null || issuedAt == null || expiresAt == null) {
            throw new TokenException(AuthFailure.TOKEN_MALFORMED, "Token is missing required claims");
        }
        List<?> rolesClaim = body.get(CLAIM_ROLES, List.class);
        Set<String> roleIds = new TreeSet<>();
        if (rolesClaim != null) {
            for (Object role : rolesClaim) {
                if (role != null) {
                    roleIds.add(role.toString());
                }
            }
        }
        return new TokenClaims(tokenId, subjectId, organizationId, kind, roleIds,
                issuedAt.toInstant(), expiresAt.toInstant());
    }

    private static void requireText(String value, String name) {
        if (isBlank(value)) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    /** Picks the verification key named by the {@code kid} header. */
    private static final class KeyRingLocator extends LocatorAdapter<Key> {

        private final SigningKeyRing keyRing;

        KeyRingLocator(SigningKeyRing keyRing) {
            this.keyRing = keyRing;
        }

        @Override
        protected Key locate(JwsHeader header) {
            return keyRing.verificationKey(header.getKeyId())
                    .orElseThrow(() -> new MalformedJwtException("Unknown signing key id"));
        }
    }
}
