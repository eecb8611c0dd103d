package com.attest.security.store;

import java.time.Instant;
import java.util.Optional;

/**
 * Durable record of revoked tokens.
 *
 * <p>Two shapes are kept: single tokens by id ({@code jti}) and a per-subject cutoff revoking every
 * token of that subject issued at or before it. A revocation must be visible to every validation
 * that starts after the recording call returns.
 */
public interface RevocationStore {

    boolean isTokenRevoked(String tokenId);

    /**
     * @param tokenId   the revoked token's id
     * @param expiresAt after this instant the record may be purged, since the token fails expiry
     */
    void recordRevocation(String tokenId, Instant expiresAt);

    /**
     * Revokes every token of the subject issued at or before {@code cutoff}. A later cutoff
     * replaces an earlier one; an earlier one never replaces a later one.
     *
     * @param retainUntil after this instant the record may be purged
     */
    void revokeSubjectBefore(String subjectId, Instant cutoff, Instant retainUntil);

    Optional<Instant> subjectRevokedBefore(String subjectId);

    /**
     * Drops records that can no longer affect validation.
     *
     * @return number of records removed
     */
    int purgeExpired(Instant now);
}
