package com.attest.security.store;

/**
 * A tenant. Owns users and tenant-scoped roles.
 *
 * @param id     stable identifier
 * @param name   display name
 * @param active inactive organizations cannot authenticate
 */
public record Organization(String id, String name, boolean active) {

    public Organization {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
    }

    public static Organization active(String id, String name) {
        return new Organization(id, name, true);
    }

    public Organization deactivated() {
        return new Organization(id, name, false);
    }
}
