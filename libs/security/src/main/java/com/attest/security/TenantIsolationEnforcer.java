package com.attest.security;

/**
 * Enforces tenant isolation by comparing the caller's organization against a resource's
 * organization.
 *
 * <p>This check is mandatory and separate from the permission check: holding {@code doc:read}
 * never grants reading another organization's documents. The only bypass is an explicit
 * cross-tenant grant, which comes from a global role. A resource without an organization is
 * treated as foreign.
 */
public final class TenantIsolationEnforcer {

    private TenantIsolationEnforcer() {
        // utility class
    }

    /**
     * @return allowed when both organization ids are present and equal
     */
    public static AccessDecision scoped(String callerOrganizationId, String resourceOrganizationId) {
        if (callerOrganizationId == null || resourceOrganizationId == null) {
            return AccessDecision.deny(AuthFailure.CROSS_TENANT);
        }
        return callerOrganizationId.equals(resourceOrganizationId)
                ? AccessDecision.allow()
                : AccessDecision.deny(AuthFailure.CROSS_TENANT);
    }

    public static AccessDecision check(SecurityContext context, String resourceOrganizationId) {
        return check(context, resourceOrganizationId, false);
    }

    /**
     * @param crossTenantGranted whether the caller's effective roles include a cross-tenant global
     *                           role
     */
    public static AccessDecision check(
            SecurityContext context, String resourceOrganizationId, boolean crossTenantGranted) {
        if (crossTenantGranted && resourceOrganizationId != null) {
            return AccessDecision.allow();
        }
        return scoped(context.organizationId(), resourceOrganizationId);
    }

    /**
     * @throws CrossTenantAccessException if the organizations differ
     */
    public static void enforce(SecurityContext context, String resourceOrganizationId) {
        enforce(context, resourceOrganizationId, false);
    }

    public static void enforce(
            SecurityContext context, String resourceOrganizationId, boolean crossTenantGranted) {
        if (check(context, resourceOrganizationId, crossTenantGranted).isDenied()) {
            throw new CrossTenantAccessException(context.organizationId(), resourceOrganizationId);
        }
    }
}
