package com.attest.security;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable per-request identity, built once from a validated access token.
 *
 * <p>There is no public constructor: the only way to obtain one is {@link
 * TokenService#contextFromToken(String)} (or {@link AuthenticationService#contextFromToken(String)}),
 * so a context always stands for a token whose signature, expiry and revocation status were
 * checked. It is rebuilt for every request and never stored between requests.
 */
public final class SecurityContext {

    private final String subjectId;
    private final String organizationId;
    private final Set<String> roleIds;
    private final TokenKind tokenKind;
    private final String tokenId;
    private final Instant issuedAt;
    private final Instant expiresAt;

    private SecurityContext(TokenClaims claims) {
        this.subjectId = claims.subjectId();
        this.organizationId = claims.organizationId();
        this.roleIds = Set.copyOf(claims.roleIds());
        this.tokenKind = claims.kind();
        this.tokenId = claims.tokenId();
        this.issuedAt = claims.issuedAt();
        this.expiresAt = claims.expiresAt();
    }

    static SecurityContext fromClaims(TokenClaims claims) {
        return new SecurityContext(Objects.requireNonNull(claims, "claims"));
    }

    public String subjectId() {
        return subjectId;
    }

    public String organizationId() {
        return organizationId;
    }

    /** Role ids carried by the token. Authorization always re-resolves from the store. */
    public Set<String> roleIds() {
        return roleIds;
    }

    public TokenKind tokenKind() {
        return tokenKind;
    }

    public String tokenId() {
        return tokenId;
    }

    public Instant issuedAt() {
        return issuedAt;
    }

    public Instant expiresAt() {
        return expiresAt;
    }

    public boolean belongsTo(String organizationId) {
        return this.organizationId.equals(organizationId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SecurityContext other)) {
            return false;
        }
        return tokenId.equals(other.tokenId)
                && subjectId.equals(other.subjectId)
                && organizationId.equals(other.organizationId)
                && roleIds.equals(other.roleIds)
                && tokenKind == other.tokenKind
                && issuedAt.equals(other.issuedAt)
                && expiresAt.equals(other.expiresAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tokenId, subjectId, organizationId, roleIds, tokenKind, issuedAt, expiresAt);
    }

    @Override
    public String toString() {
        return "SecurityContext[subjectId=" + subjectId
                + ", organizationId=" + organizationId
                + ", roleIds=" + roleIds
                + ", tokenKind=" + tokenKind
                + ", expiresAt=" + expiresAt + "]";
    }
}
