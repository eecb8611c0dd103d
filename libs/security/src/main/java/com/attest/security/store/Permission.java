package com.attest.security.store;

import com.attest.security.PermissionCode;

/**
 * A registered permission. The code is the stable identifier and never changes once roles
 * reference it.
 */
public record Permission(PermissionCode code, String description) {

    public Permission {
        if (code == null) {
            throw new IllegalArgumentException("code must not be null");
        }
        description = description == null ? "" : description;
    }

    public static Permission of(String code, String description) {
        return new Permission(PermissionCode.of(code), description);
    }
}
