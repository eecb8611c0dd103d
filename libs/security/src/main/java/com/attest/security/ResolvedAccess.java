package com.attest.security;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Everything one permission resolution produced for a user in an organization.
 *
 * @param subjectId      the user
 * @param organizationId the organization resolved against
 * @param roleIds        effective roles, assigned and included, that passed the checks
 * @param globalRoleNames       names of the effective global roles
 * @param organizationRoleNames names of the effective roles owned by the organization
 * @param permissions    union of the permission codes the effective roles grant
 * @param crossTenant    whether an effective global role carries the cross-tenant capability
 * @param violations     integrity problems skipped during resolution
 */
public record ResolvedAccess(
        String subjectId,
        String organizationId,
        Set<String> roleIds,
        Set<String> globalRoleNames,
        Set<String> organizationRoleNames,
        Set<PermissionCode> permissions,
        boolean crossTenant,
        List<IntegrityViolation> violations) {

    public ResolvedAccess {
        roleIds = Set.copyOf(roleIds);
        globalRoleNames = Set.copyOf(globalRoleNames);
        organizationRoleNames = Set.copyOf(organizationRoleNames);
        permissions = Set.copyOf(permissions);
        violations = List.copyOf(violations);
    }

    /** No roles and no permissions. */
    public static ResolvedAccess none(String subjectId, String organizationId) {
        return new ResolvedAccess(subjectId, organizationId, Set.of(), Set.of(), Set.of(), Set.of(), false, List.of());
    }

    /** Whether some granted code implies {@code required}. */
    public boolean grants(PermissionCode required) {
        return permissions.stream().anyMatch(granted -> granted.implies(required));
    }

    /**
     * Names of all effective roles. A global role and an organization role may share a name, so
     * use the namespaced sets for role checks.
     */
    public Set<String> roleNames() {
        Set<String> names = new HashSet<>(globalRoleNames);
        names.addAll(organizationRoleNames);
        return Set.copyOf(names);
    }

    public boolean hasViolations() {
        return !violations.isEmpty();
    }
}
