package com.attest.security.store;

import com.attest.security.PermissionCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Users, organizations, roles and permissions held in memory.
 *
 * <p>All data lives in one immutable {@link State}. Writers build a new state under a lock and
 * publish it through a volatile field; readers never lock. {@link #snapshot()} hands out the
 * current state itself, so a resolution never observes half of a role update.
 *
 * <p>Writes enforce the directory's integrity rules:
 * <ul>
 *   <li>email addresses are unique ignoring case
 *   <li>role names are unique within their namespace (global, or one organization)
 *   <li>a user may only hold roles that are global or owned by the user's organization
 *   <li>only global roles may be marked cross-tenant
 * </ul>
 */
public class InMemoryDirectory implements UserStore, OrganizationStore, AccessControlStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDirectory.class);

    private final Object writeLock = new Object();
    private volatile State state = State.EMPTY;

    // ── Reads ──

    @Override
    public Optional<User> findUserByEmail(String email) {
        if (email == null) {
            return Optional.empty();
        }
        State current = state;
        return Optional.ofNullable(current.userIdsByEmail().get(normalize(email)))
                .map(current.users()::get);
    }

    @Override
    public Optional<User> findUserById(String userId) {
        return Optional.ofNullable(userId).map(state.users()::get);
    }

    @Override
    public Optional<Organization> findOrganizationById(String organizationId) {
        return Optional.ofNullable(organizationId).map(state.organizations()::get);
    }

    public Optional<Role> findRoleById(String roleId) {
        return Optional.ofNullable(roleId).map(state.roles()::get);
    }

    /** Looks a role up by name in the given namespace ({@code null} for global). */
    public Optional<Role> findRoleByName(String name, String organizationId) {
        return state.roles().values().stream()
                .filter(role -> role.name().equals(name))
                .filter(role -> Objects.equals(role.organizationId(), organizationId))
                .findFirst();
    }

    public Optional<Permission> findPermission(PermissionCode code) {
        return Optional.ofNullable(code).map(state.permissions()::get);
    }

    @Override
    public AccessControlReader snapshot() {
        return state;
    }

    // ── Organizations & permissions ──

    public Organization saveOrganization(Organization organization) {
        update(s -> s.withOrganizations(put(s.organizations(), organization.id(), organization)));
        return organization;
    }

    public Permission savePermission(Permission permission) {
        update(s -> s.withPermissions(put(s.permissions(), permission.code(), permission)));
        return permission;
    }

    /**
     * Removes a permission. Roles keep listing the code; resolution skips it and reports an
     * integrity violation until the roles are updated.
     */
    public void removePermission(PermissionCode code) {
        update(s -> s.withPermissions(remove(s.permissions(), code)));
    }

    // ── Roles ──

    /**
     * Creates or replaces a role.
     *
     * @throws IllegalArgumentException if the owning organization does not exist, the name is taken
     *                                  in the role's namespace, or a tenant role is marked
     *                                  cross-tenant
     */
    public Role saveRole(Role role) {
        update(s -> {
            if (!role.isGlobal() && !s.organizations().containsKey(role.organizationId())) {
                throw new IllegalArgumentException("Unknown organization: " + role.organizationId());
            }
            if (role.crossTenant() && !role.isGlobal()) {
                throw new IllegalArgumentException("Only global roles may be cross-tenant: " + role.id());
            }
            boolean nameTaken = s.roles().values().stream()
                    .anyMatch(other -> !other.id().equals(role.id())
                            && other.name().equals(role.name())
                            && Objects.equals(other.organizationId(), role.organizationId()));
            if (nameTaken) {
                throw new IllegalArgumentException("Role name already exists in this namespace: " + role.name());
            }
            return s.withRoles(put(s.roles(), role.id(), role));
        });
        log.debug("Saved role {} ({})", role.id(), role.isGlobal() ? "global" : role.organizationId());
        return role;
    }

    /** Replaces the permission codes of a role in one atomic step. */
    public Role updateRolePermissions(String roleId, Set<String> permissionCodes) {
        Role[] updated = new Role[1];
        update(s -> {
            Role existing = requireRole(s, roleId);
            updated[0] = existing.withPermissionCodes(permissionCodes);
            return s.withRoles(put(s.roles(), roleId, updated[0]));
        });
        return updated[0];
    }

    /** Deletes a role and unassigns it from every user. */
    public void removeRole(String roleId) {
        update(s -> {
            requireRole(s, roleId);
            Map<String, User> users = new LinkedHashMap<>();
            s.users().forEach((id, user) -> {
                if (user.roleIds().contains(roleId)) {
                    Set<String> remaining = new HashSet<>(user.roleIds());
                    remaining.remove(roleId);
                    users.put(id, user.withRoleIds(remaining));
                } else {
                    users.put(id, user);
                }
            });
            return s.withRoles(remove(s.roles(), roleId)).withUsers(users);
        });
    }

    // ── Users ──

    /**
     * Creates or replaces a user.
     *
     * @throws IllegalArgumentException if the organization does not exist, the email is taken by
     *                                  another user, an assigned role is not visible to the user's
     *                                  organization, or the user was deactivated and the
     *                                  replacement is active
     */
    @Override
    public User save(User user) {
        update(s -> storeUser(s, user));
        return user;
    }

    /**
     * Applies {@code change} to the current user under the write lock. The result goes through the
     * same checks as {@link #save(User)} and must keep the user's id.
     */
    @Override
    public Optional<User> update(String userId, UnaryOperator<User> change) {
        User[] updated = new User[1];
        update(s -> {
            User existing = userId == null ? null : s.users().get(userId);
            if (existing == null) {
                return s;
            }
            User next = change.apply(existing);
            if (!existing.id().equals(next.id())) {
                throw new IllegalArgumentException("An update must not change the user id: " + userId);
            }
            updated[0] = next;
            return storeUser(s, next);
        });
        return Optional.ofNullable(updated[0]);
    }

    /**
     * @throws IllegalArgumentException if the role belongs to another organization
     */
    public User assignRole(String userId, String roleId) {
        return updateUser(userId, (s, user) -> {
            requireAssignable(s, roleId, user.organizationId());
            Set<String> roleIds = new HashSet<>(user.roleIds());
            roleIds.add(roleId);
            return user.withRoleIds(roleIds);
        });
    }

    public User unassignRole(String userId, String roleId) {
        return updateUser(userId, (s, user) -> {
            Set<String> roleIds = new HashSet<>(user.roleIds());
            roleIds.remove(roleId);
            return user.withRoleIds(roleIds);
        });
    }

    public User deactivateUser(String userId) {
        User user = updateUser(userId, (s, existing) -> existing.deactivated());
        log.info("Deactivated user {}", userId);
        return user;
    }

    // ── Private Helpers ──

    private User updateUser(String userId, UserUpdate change) {
        User[] updated = new User[1];
        update(s -> {
            User existing = userId == null ? null : s.users().get(userId);
            if (existing == null) {
                throw new IllegalArgumentException("Unknown user: " + userId);
            }
            updated[0] = change.apply(s, existing);
            return s.withUsers(put(s.users(), userId, updated[0]));
        });
        return updated[0];
    }

    private static State storeUser(State s, User user) {
        if (!s.organizations().containsKey(user.organizationId())) {
            throw new IllegalArgumentException("Unknown organization: " + user.organizationId());
        }
        User previous = s.users().get(user.id());
        if (previous != null && !previous.active() && user.active()) {
            throw new IllegalArgumentException("Deactivated users cannot be reactivated: " + user.id());
        }
        String emailKey = normalize(user.email());
        String owner = s.userIdsByEmail().get(emailKey);
        if (owner != null && !owner.equals(user.id())) {
            throw new IllegalArgumentException("Email already registered: " + user.email());
        }
        for (String roleId : user.roleIds()) {
            requireAssignable(s, roleId, user.organizationId());
        }
        Map<String, String> emails = new HashMap<>(s.userIdsByEmail());
        if (previous != null) {
            emails.remove(normalize(previous.email()));
        }
        emails.put(emailKey, user.id());
        return s.withUsers(put(s.users(), user.id(), user)).withUserIdsByEmail(emails);
    }

    private void update(UnaryOperator<State> change) {
        synchronized (writeLock) {
            state = change.apply(state);
        }
    }

    private static Role requireRole(State s, String roleId) {
        Role role = roleId == null ? null : s.roles().get(roleId);
        if (role == null) {
            throw new IllegalArgumentException("Unknown role: " + roleId);
        }
        return role;
    }

    private static void requireAssignable(State s, String roleId, String organizationId) {
        Role role = requireRole(s, roleId);
        if (!role.visibleTo(organizationId)) {
            throw new IllegalArgumentException(
                    "Role " + roleId + " belongs to another organization than " + organizationId);
        }
    }

    private static String normalize(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }

    private static <K, V> Map<K, V> put(Map<K, V> source, K key, V value) {
        Map<K, V> copy = new LinkedHashMap<>(source);
        copy.put(key, value);
        return copy;
    }

    private static <K, V> Map<K, V> remove(Map<K, V> source, K key) {
        Map<K, V> copy = new LinkedHashMap<>(source);
        copy.remove(key);
        return copy;
    }

    @FunctionalInterface
    private interface UserUpdate {
        User apply(State state, User user);
    }

    /** One committed version of the directory. Never mutated after construction. */
    private record State(
            Map<String, Organization> organizations,
            Map<String, User> users,
            Map<String, String> userIdsByEmail,
            Map<String, Role> roles,
            Map<PermissionCode, Permission> permissions) implements AccessControlReader {

        static final State EMPTY = new State(Map.of(), Map.of(), Map.of(), Map.of(), Map.of());

        State {
            organizations = Map.copyOf(organizations);
            users = Map.copyOf(users);
            userIdsByEmail = Map.copyOf(userIdsByEmail);
            roles = Map.copyOf(roles);
            permissions = Map.copyOf(permissions);
        }

        State withOrganizations(Map<String, Organization> value) {
            return new State(value, users, userIdsByEmail, roles, permissions);
        }

        State withUsers(Map<String, User> value) {
            return new State(organizations, value, userIdsByEmail, roles, permissions);
        }

        State withUserIdsByEmail(Map<String, String> value) {
            return new State(organizations, users, value, roles, permissions);
        }

        State withRoles(Map<String, Role> value) {
            return new State(organizations, users, userIdsByEmail, value, permissions);
        }

        State withPermissions(Map<PermissionCode, Permission> value) {
            return new State(organizations, users, userIdsByEmail, roles, value);
        }

        @Override
        public Map<String, Role> findRolesByIds(Collection<String> roleIds) {
            Map<String, Role> found = new LinkedHashMap<>();
            for (String roleId : roleIds) {
                Role role = roleId == null ? null : roles.get(roleId);
                if (role != null) {
                    found.put(roleId, role);
                }
            }
            return found;
        }

        @Override
        public List<Permission> findPermissionsByRoleId(String roleId) {
            Role role = roleId == null ? null : roles.get(roleId);
            if (role == null) {
                return List.of();
            }
            return role.permissionCodes().stream()
                    .map(State::parseOrNull)
                    .filter(Objects::nonNull)
                    .map(permissions::get)
                    .filter(Objects::nonNull)
                    .toList();
        }

        private static PermissionCode parseOrNull(String code) {
            try {
                return PermissionCode.of(code);
            } catch (IllegalArgumentException e) {
                // unparseable codes can never be registered, so they resolve to nothing
                return null;
            }
        }
    }
}
