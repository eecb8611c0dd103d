package com.attest.security;

import com.attest.security.store.AccessControlReader;
import com.attest.security.store.AccessControlStore;
import com.attest.security.store.Permission;
import com.attest.security.store.Role;
import com.attest.security.store.User;
import com.attest.security.store.UserStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Computes a user's effective permissions inside one organization from the current store state.
 *
 * <p>Nothing is cached: every call reloads the user and reads roles and permissions from a single
 * {@link AccessControlStore#snapshot()}, so a role change is visible on the next call and a
 * concurrent change is seen whole or not at all.
 *
 * <p>Roles are followed through {@code includedRoleIds} depth-first. A role is used only when it
 * is global or owned by the organization being resolved; anything else found on the way (missing
 * roles, foreign roles, unregistered codes, inclusion cycles) is skipped and reported as an {@link
 * IntegrityViolation}.
 */
public class PermissionResolver {

    private static final Logger log = LoggerFactory.getLogger(PermissionResolver.class);

    private final UserStore users;
    private final AccessControlStore accessControl;

    public PermissionResolver(UserStore users, AccessControlStore accessControl) {
        this.users = Objects.requireNonNull(users, "users");
        this.accessControl = Objects.requireNonNull(accessControl, "accessControl");
    }

    /**
     * @return the permission codes granted to the user in the organization; empty for unknown or
     *         inactive users and for users of another organization
     */
    public Set<PermissionCode> resolve(String userId, String organizationId) {
        return resolveAccess(userId, organizationId).permissions();
    }

    /** Whether the user holds a code implying {@code required} in the organization. */
    public boolean authorize(String userId, String organizationId, PermissionCode required) {
        Objects.requireNonNull(required, "required");
        return resolveAccess(userId, organizationId).grants(required);
    }

    public ResolvedAccess resolveAccess(String userId, String organizationId) {
        if (userId == null || organizationId == null) {
            return ResolvedAccess.none(userId, organizationId);
        }
        User user = users.findUserById(userId).orElse(null);
        if (user == null || !user.active() || !organizationId.equals(user.organizationId())) {
            log.debug("No access for subject {} in organization {}", userId, organizationId);
            return ResolvedAccess.none(userId, organizationId);
        }

        Resolution resolution = new Resolution(organizationId, accessControl.snapshot());
        resolution.loadRoleGraph(user.roleIds());
        for (String roleId : sorted(user.roleIds())) {
            resolution.visit(roleId);
        }
        resolution.collectPermissions();

        ResolvedAccess access = resolution.toAccess(userId);
        for (IntegrityViolation violation : access.violations()) {
            log.warn("Access-control integrity violation for subject {} in organization {}: {} at role {} ({})",
                    userId, organizationId, violation.kind(), violation.roleId(), violation.detail());
        }
        return access;
    }

    private static List<String> sorted(Set<String> ids) {
        List<String> list = new ArrayList<>(ids);
        list.sort(null);
        return list;
    }

    /** Working state of one resolution. */
    private static final class Resolution {

        private final String organizationId;
        private final AccessControlReader reader;
        private final Map<String, Role> roles = new HashMap<>();
        private final Set<String> missing = new HashSet<>();
        private final Set<String> visiting = new HashSet<>();
        private final Set<String> visited = new HashSet<>();
        private final Set<Role> accepted = new LinkedHashSet<>();
        private final Set<PermissionCode> permissions = new HashSet<>();
        private final List<IntegrityViolation> violations = new ArrayList<>();
        private boolean crossTenant;

        Resolution(String organizationId, AccessControlReader reader) {
            this.organizationId = organizationId;
            this.reader = reader;
        }

        /** Loads every role reachable from the assigned ones, one batch per inclusion level. */
        void loadRoleGraph(Set<String> assigned) {
            Set<String> frontier = new HashSet<>(assigned);
            while (!frontier.isEmpty()) {
                Map<String, Role> batch = reader.findRolesByIds(frontier);
                roles.putAll(batch);
                Set<String> next = new HashSet<>();
                for (String roleId : frontier) {
                    Role role = batch.get(roleId);
                    if (role == null) {
                        missing.add(roleId);
                        continue;
                    }
                    for (String included : role.includedRoleIds()) {
                        if (!roles.containsKey(included) && !missing.contains(included)) {
                            next.add(included);
                        }
                    }
                }
                frontier = next;
            }
        }

        void visit(String roleId) {
            if (visited.contains(roleId)) {
                return;
            }
            if (visiting.contains(roleId)) {
                violations.add(new IntegrityViolation(
                        IntegrityViolation.Kind.ROLE_CYCLE, roleId, "role inclusion cycle"));
                return;
            }
            Role role = roles.get(roleId);
            if (role == null) {
                visited.add(roleId);
                violations.add(new IntegrityViolation(
                        IntegrityViolation.Kind.UNKNOWN_ROLE, roleId, "role does not exist"));
                return;
            }
            if (!role.visibleTo(organizationId)) {
                visited.add(roleId);
                violations.add(new IntegrityViolation(
                        IntegrityViolation.Kind.ROLE_OUTSIDE_ORGANIZATION, roleId,
                        "role belongs to organization " + role.organizationId()));
                return;
            }

            visiting.add(roleId);
            accepted.add(role);
            if (role.crossTenant()) {
                if (role.isGlobal()) {
                    crossTenant = true;
                } else {
                    violations.add(new IntegrityViolation(
                            IntegrityViolation.Kind.TENANT_ROLE_MARKED_CROSS_TENANT, roleId,
                            "cross-tenant flag ignored on a tenant role"));
                }
            }
            for (String included : sorted(role.includedRoleIds())) {
                visit(included);
            }
            visiting.remove(roleId);
            visited.add(roleId);
        }

        void collectPermissions() {
            for (Role role : accepted) {
                Set<PermissionCode> registered = new HashSet<>();
                for (Permission permission : reader.findPermissionsByRoleId(role.id())) {
                    registered.add(permission.code());
                }
                for (String code : sorted(role.permissionCodes())) {
                    PermissionCode parsed = parse(role.id(), code);
                    if (parsed == null) {
                        continue;
                    }
                    if (registered.contains(parsed)) {
                        permissions.add(parsed);
                    } else {
                        violations.add(new IntegrityViolation(
                                IntegrityViolation.Kind.UNKNOWN_PERMISSION, role.id(),
                                "permission " + code + " is not registered"));
                    }
                }
            }
        }

        private PermissionCode parse(String roleId, String code) {
            try {
                return PermissionCode.of(code);
            } catch (IllegalArgumentException e) {
                violations.add(new IntegrityViolation(
                        IntegrityViolation.Kind.UNKNOWN_PERMISSION, roleId, e.getMessage()));
                return null;
            }
        }

        ResolvedAccess toAccess(String subjectId) {
            Set<String> roleIds = new HashSet<>();
            Set<String> globalRoleNames = new HashSet<>();
            Set<String> organizationRoleNames = new HashSet<>();
            for (Role role : accepted) {
                roleIds.add(role.id());
                if (role.isGlobal()) {
                    globalRoleNames.add(role.name());
                } else {
                    organizationRoleNames.add(role.name());
                }
            }
            return new ResolvedAccess(subjectId, organizationId, roleIds, globalRoleNames,
                    organizationRoleNames, permissions, crossTenant, violations);
        }
    }
}
