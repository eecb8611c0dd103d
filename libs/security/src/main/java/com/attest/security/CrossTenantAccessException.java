package com.attest.security;

/**
 * Thrown when a request attempts to act on a resource owned by a different organization.
 *
 * <p>Raised regardless of the permissions the caller holds; only a global cross-tenant role lifts
 * the check.
 */
public class CrossTenantAccessException extends AuthException {

    private final String callerOrganizationId;
    private final String resourceOrganizationId;

    public CrossTenantAccessException(String callerOrganizationId, String resourceOrganizationId) {
        super(AuthFailure.CROSS_TENANT,
                "Tenant mismatch: organization '%s' cannot access resource of organization '%s'"
                        .formatted(callerOrganizationId, resourceOrganizationId));
        this.callerOrganizationId = callerOrganizationId;
        this.resourceOrganizationId = resourceOrganizationId;
    }

    public String callerOrganizationId() {
        return callerOrganizationId;
    }

    public String resourceOrganizationId() {
        return resourceOrganizationId;
    }
}
