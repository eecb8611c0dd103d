package com.attest.security;

import java.time.Instant;
import java.util.Set;

/**
 * Verified, decoded contents of a token. Only {@link TokenService} produces instances from a
 * presented token, after the signature, expiry and revocation checks have passed.
 *
 * <p>Role ids are carried, never permissions: permission changes take effect at the next
 * resolution.
 *
 * @param tokenId        unique identifier ({@code jti}) used for revocation
 * @param subjectId      user id ({@code sub})
 * @param organizationId tenant the token is bound to ({@code org})
 * @param kind           access or refresh ({@code kind})
 * @param roleIds        role ids assigned at issuance ({@code roles})
 * @param issuedAt       {@code iat}, second precision
 * @param expiresAt      {@code exp}, second precision
 */
public record TokenClaims(
        String tokenId,
        String subjectId,
        String organizationId,
        TokenKind kind,
        Set<String> roleIds,
        Instant issuedAt,
        Instant expiresAt) {

    public TokenClaims {
        roleIds = roleIds == null ? Set.of() : Set.copyOf(roleIds);
    }
}
