package com.attest.security.store;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Revocation records held in concurrent maps.
 *
 * <p>Records survive until {@link #purgeExpired(Instant)} drops them. Suitable for a single node;
 * a multi-node deployment needs a shared implementation of {@link RevocationStore}.
 */
public class InMemoryRevocationStore implements RevocationStore {

    private final ConcurrentHashMap<String, Instant> revokedTokens = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, SubjectCutoff> subjectCutoffs = new ConcurrentHashMap<>();

    @Override
    public boolean isTokenRevoked(String tokenId) {
        return tokenId != null && revokedTokens.containsKey(tokenId);
    }

    @Override
    public void recordRevocation(String tokenId, Instant expiresAt) {
        revokedTokens.merge(tokenId, expiresAt, (existing, added) -> existing.isAfter(added) ? existing : added);
    }

    @Override
    public void revokeSubjectBefore(String subjectId, Instant cutoff, Instant retainUntil) {
        subjectCutoffs.merge(subjectId, new SubjectCutoff(cutoff, retainUntil), SubjectCutoff::later);
    }

    @Override
    public Optional<Instant> subjectRevokedBefore(String subjectId) {
        if (subjectId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(subjectCutoffs.get(subjectId)).map(SubjectCutoff::cutoff);
    }

    @Override
    public int purgeExpired(Instant now) {
        int removed = 0;
        for (Map.Entry<String, Instant> entry : revokedTokens.entrySet()) {
            if (now.isAfter(entry.getValue()) && revokedTokens.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        for (Map.Entry<String, SubjectCutoff> entry : subjectCutoffs.entrySet()) {
            if (now.isAfter(entry.getValue().retainUntil())
                    && subjectCutoffs.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    private record SubjectCutoff(Instant cutoff, Instant retainUntil) {

        SubjectCutoff later(SubjectCutoff other) {
            Instant latestCutoff = cutoff.isAfter(other.cutoff) ? cutoff : other.cutoff;
            Instant latestRetain = retainUntil.isAfter(other.retainUntil) ? retainUntil : other.retainUntil;
            return new SubjectCutoff(latestCutoff, latestRetain);
        }
    }
}
