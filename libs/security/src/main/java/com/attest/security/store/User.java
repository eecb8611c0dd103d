package com.attest.security.store;

import java.time.Instant;
import java.util.Set;

/**
 * An account. Belongs to exactly one organization; deactivation is terminal.
 *
 * @param id             stable identifier
 * @param email          login name, unique case-insensitively
 * @param passwordHash   one-way salted hash, never the plaintext
 * @param active         inactive users cannot authenticate or refresh
 * @param organizationId the owning organization
 * @param roleIds        assigned roles, each global or owned by the same organization
 * @param lastLoginAt    time of the last successful authentication, {@code null} if never
 */
public record User(
        String id,
        String email,
        String passwordHash,
        boolean active,
        String organizationId,
        Set<String> roleIds,
        Instant lastLoginAt) {

    public User {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email must not be null or blank");
        }
        if (organizationId == null || organizationId.isBlank()) {
            throw new IllegalArgumentException("organizationId must not be null or blank");
        }
        roleIds = roleIds == null ? Set.of() : Set.copyOf(roleIds);
    }

    public static User active(
            String id, String email, String passwordHash, String organizationId, Set<String> roleIds) {
        return new User(id, email, passwordHash, true, organizationId, roleIds, null);
    }

    public User withPasswordHash(String hash) {
        return new User(id, email, hash, active, organizationId, roleIds, lastLoginAt);
    }

    public User withLastLoginAt(Instant instant) {
        return new User(id, email, passwordHash, active, organizationId, roleIds, instant);
    }

    public User withRoleIds(Set<String> ids) {
        return new User(id, email, passwordHash, active, organizationId, ids, lastLoginAt);
    }

    public User deactivated() {
        return new User(id, email, passwordHash, false, organizationId, roleIds, lastLoginAt);
    }

    @Override
    public String toString() {
        return "User[id=" + id
                + ", email=" + email
                + ", active=" + active
                + ", organizationId=" + organizationId
                + ", roleIds=" + roleIds
                + ", lastLoginAt=" + lastLoginAt + "]";
    }
}
