package com.attest.security;

/**
 * Inconsistency in stored access-control data found during permission resolution.
 *
 * <p>Violations are reported, not thrown: the offending role or code is left out of the result
 * and resolution continues with what remains.
 *
 * @param kind   what is wrong
 * @param roleId the role at which the problem was found
 * @param detail human-readable description
 */
public record IntegrityViolation(Kind kind, String roleId, String detail) {

    public enum Kind {
        /** An assigned or included role does not exist. */
        UNKNOWN_ROLE,
        /** A role owned by another organization is reachable from the user. */
        ROLE_OUTSIDE_ORGANIZATION,
        /** A role lists a code that is not a registered permission. */
        UNKNOWN_PERMISSION,
        /** Role inclusion loops back on itself. */
        ROLE_CYCLE,
        /** A tenant role claims the cross-tenant capability, which only global roles may hold. */
        TENANT_ROLE_MARKED_CROSS_TENANT
    }
}
