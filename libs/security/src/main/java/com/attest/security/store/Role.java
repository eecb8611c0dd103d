package com.attest.security.store;

import java.util.Set;

/**
 * A named set of permission codes, either global or owned by one organization.
 *
 * <p>{@code includedRoleIds} lists roles whose permissions this role also grants. The {@code
 * crossTenant} flag lets holders act on resources of other organizations; it is only honored on
 * global roles.
 *
 * @param id              stable identifier
 * @param name            unique within its namespace (global, or the owning organization)
 * @param organizationId  owning organization, {@code null} for a global role
 * @param permissionCodes codes granted directly
 * @param includedRoleIds roles whose permissions are granted transitively
 * @param crossTenant     whether holders bypass tenant isolation
 */
public record Role(
        String id,
        String name,
        String organizationId,
        Set<String> permissionCodes,
        Set<String> includedRoleIds,
        boolean crossTenant) {

    public Role {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        permissionCodes = permissionCodes == null ? Set.of() : Set.copyOf(permissionCodes);
        includedRoleIds = includedRoleIds == null ? Set.of() : Set.copyOf(includedRoleIds);
    }

    public static Role global(String id, String name, Set<String> permissionCodes) {
        return new Role(id, name, null, permissionCodes, Set.of(), false);
    }

    public static Role tenant(String id, String name, String organizationId, Set<String> permissionCodes) {
        if (organizationId == null || organizationId.isBlank()) {
            throw new IllegalArgumentException("organizationId must not be null or blank");
        }
        return new Role(id, name, organizationId, permissionCodes, Set.of(), false);
    }

    public boolean isGlobal() {
        return organizationId == null;
    }

    /** Global roles are visible to every organization; tenant roles only to their owner. */
    public boolean visibleTo(String organizationId) {
        return isGlobal() || this.organizationId.equals(organizationId);
    }

    public Role withPermissionCodes(Set<String> codes) {
        return new Role(id, name, organizationId, codes, includedRoleIds, crossTenant);
    }

    public Role withIncludedRoleIds(Set<String> roleIds) {
        return new Role(id, name, organizationId, permissionCodes, roleIds, crossTenant);
    }

    public Role withCrossTenant(boolean crossTenant) {
        return new Role(id, name, organizationId, permissionCodes, includedRoleIds, crossTenant);
    }
}
