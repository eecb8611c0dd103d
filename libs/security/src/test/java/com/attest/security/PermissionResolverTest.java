package com.attest.security;

import com.attest.security.store.AccessControlReader;
import com.attest.security.store.AccessControlStore;
import com.attest.security.store.InMemoryDirectory;
import com.attest.security.store.Organization;
import com.attest.security.store.Permission;
import com.attest.security.store.Role;
import com.attest.security.store.StoreUnavailableException;
import com.attest.security.store.User;
import com.attest.security.store.UserStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("PermissionResolver")
class PermissionResolverTest {

    private static final PermissionCode DOC_READ = PermissionCode.of("doc:read");
    private static final PermissionCode DOC_WRITE = PermissionCode.of("doc:write");
    private static final PermissionCode DOC_DELETE = PermissionCode.of("doc:delete");
    private static final PermissionCode USER_MANAGE = PermissionCode.of("user:manage");

    private InMemoryDirectory directory;
    private PermissionResolver resolver;

    @BeforeEach
    void setUp() {
        directory = new InMemoryDirectory();
        directory.saveOrganization(Organization.active("org-a", "Acme"));
        directory.saveOrganization(Organization.active("org-b", "Globex"));
        for (String code : List.of("doc:read", "doc:write", "doc:delete", "doc:*", "user:manage", "*")) {
            directory.savePermission(Permission.of(code, code));
        }
        directory.saveRole(Role.tenant("viewer-a", "viewer", "org-a", Set.of("doc:read")));
        directory.saveRole(Role.tenant("editor-a", "editor", "org-a", Set.of("doc:read", "doc:write")));
        directory.saveRole(Role.tenant("viewer-b", "viewer", "org-b", Set.of("doc:read")));
        directory.saveRole(Role.global("admin", "admin", Set.of("*")));
        directory.saveRole(Role.global("doc-owner", "doc-owner", Set.of("doc:*")));
        resolver = new PermissionResolver(directory, directory);
    }

    private void user(String id, String organizationId, String... roleIds) {
        directory.save(User.active(id, id + "@example.com", "hash", organizationId, Set.of(roleIds)));
    }

    @Nested
    @DisplayName("resolve()")
    class Resolve {

        @Test
        @DisplayName("is the union of the permissions of all assigned roles")
        void union() {
            directory.saveRole(Role.tenant("manager-a", "manager", "org-a", Set.of("user:manage")));
            user("bob", "org-a", "editor-a", "manager-a");

            assertThat(resolver.resolve("bob", "org-a")).containsExactlyInAnyOrder(DOC_READ, DOC_WRITE, USER_MANAGE);
        }

        @Test
        @DisplayName("returns an empty set for a user with no roles")
        void zeroRoles() {
            user("carol", "org-a");
            assertThat(resolver.resolve("carol", "org-a")).isEmpty();
            assertThat(resolver.authorize("carol", "org-a", DOC_READ)).isFalse();
        }

        @Test
        @DisplayName("grants nothing to unknown, inactive or foreign users")
        void noAccess() {
            user("alice", "org-a", "viewer-a");
            user("dave", "org-a", "viewer-a");
            directory.deactivateUser("dave");

            assertThat(resolver.resolve("nobody", "org-a")).isEmpty();
            assertThat(resolver.resolve("dave", "org-a")).isEmpty();
            assertThat(resolver.resolve("alice", "org-b")).isEmpty();
            assertThat(resolver.resolve(null, "org-a")).isEmpty();
        }

        @Test
        @DisplayName("adding a role never shrinks the permission set")
        void monotonic() {
            user("bob", "org-a", "viewer-a");
            Set<PermissionCode> before = resolver.resolve("bob", "org-a");

            directory.assignRole("bob", "editor-a");

            assertThat(resolver.resolve("bob", "org-a")).containsAll(before).contains(DOC_WRITE);
        }

        @Test
        @DisplayName("reflects a role's permission removal on the next call")
        void removalVisibleImmediately() {
            user("bob", "org-a", "editor-a");
            assertThat(resolver.authorize("bob", "org-a", DOC_WRITE)).isTrue();

            directory.updateRolePermissions("editor-a", Set.of("doc:read"));

            assertThat(resolver.authorize("bob", "org-a", DOC_WRITE)).isFalse();
            assertThat(resolver.authorize("bob", "org-a", DOC_READ)).isTrue();
        }

        @Test
        @DisplayName("unassigning a role removes exactly the permissions only that role granted")
        void unassignRemovesUniquePermissions() {
            user("bob", "org-a", "viewer-a", "editor-a");
            assertThat(resolver.resolve("bob", "org-a")).containsExactlyInAnyOrder(DOC_READ, DOC_WRITE);

            directory.unassignRole("bob", "editor-a");

            assertThat(resolver.resolve("bob", "org-a")).containsExactly(DOC_READ);
            assertThat(resolver.authorize("bob", "org-a", DOC_WRITE)).isFalse();
        }

        @Test
        @DisplayName("follows included roles transitively")
        void includedRoles() {
            directory.saveRole(Role.tenant("lead-a", "lead", "org-a", Set.of("user:manage"))
                    .withIncludedRoleIds(Set.of("editor-a")));
            user("erin", "org-a", "lead-a");

            ResolvedAccess access = resolver.resolveAccess("erin", "org-a");

            assertThat(access.permissions()).containsExactlyInAnyOrder(USER_MANAGE, DOC_READ, DOC_WRITE);
            assertThat(access.roleIds()).containsExactlyInAnyOrder("lead-a", "editor-a");
            assertThat(access.roleNames()).containsExactlyInAnyOrder("lead", "editor");
            assertThat(access.organizationRoleNames()).containsExactlyInAnyOrder("lead", "editor");
            assertThat(access.globalRoleNames()).isEmpty();
            assertThat(access.hasViolations()).isFalse();
        }
    }

    @Nested
    @DisplayName("authorize()")
    class Authorize {

        @Test
        @DisplayName("the global wildcard grants everything")
        void adminWildcard() {
            user("root", "org-a", "admin");
            assertThat(resolver.authorize("root", "org-a", DOC_DELETE)).isTrue();
            assertThat(resolver.authorize("root", "org-a", USER_MANAGE)).isTrue();
        }

        @Test
        @DisplayName("a resource wildcard grants only its resource")
        void resourceWildcard() {
            user("owner", "org-a", "doc-owner");
            assertThat(resolver.authorize("owner", "org-a", DOC_DELETE)).isTrue();
            assertThat(resolver.authorize("owner", "org-a", USER_MANAGE)).isFalse();
        }
    }

    @Nested
    @DisplayName("integrity")
    class Integrity {

        @Test
        @DisplayName("ignores a role that moved to another organization and reports it")
        void roleOutsideOrganization() {
            user("alice", "org-a", "viewer-a", "editor-a");
            directory.saveRole(Role.tenant("viewer-a", "viewer-moved", "org-b", Set.of("doc:read", "doc:delete")));

            ResolvedAccess access = resolver.resolveAccess("alice", "org-a");

            assertThat(access.permissions()).containsExactlyInAnyOrder(DOC_READ, DOC_WRITE);
            assertThat(access.grants(DOC_DELETE)).isFalse();
            assertThat(access.violations())
                    .extracting(IntegrityViolation::kind, IntegrityViolation::roleId)
                    .containsExactly(tuple(
                            IntegrityViolation.Kind.ROLE_OUTSIDE_ORGANIZATION, "viewer-a"));
        }

        @Test
        @DisplayName("skips permission codes that are no longer registered")
        void danglingPermission() {
            user("bob", "org-a", "editor-a");
            directory.removePermission(DOC_WRITE);

            ResolvedAccess access = resolver.resolveAccess("bob", "org-a");

            assertThat(access.permissions()).containsExactly(DOC_READ);
            assertThat(access.violations()).singleElement()
                    .satisfies(v -> {
                        assertThat(v.kind()).isEqualTo(IntegrityViolation.Kind.UNKNOWN_PERMISSION);
                        assertThat(v.roleId()).isEqualTo("editor-a");
                        assertThat(v.detail()).contains("doc:write");
                    });
        }

        @Test
        @DisplayName("terminates on an inclusion cycle and keeps both roles")
        void cycle() {
            directory.saveRole(Role.tenant("x", "x", "org-a", Set.of("doc:read")).withIncludedRoleIds(Set.of("y")));
            directory.saveRole(Role.tenant("y", "y", "org-a", Set.of("doc:write")).withIncludedRoleIds(Set.of("x")));
            user("frank", "org-a", "x");

            ResolvedAccess access = resolver.resolveAccess("frank", "org-a");

            assertThat(access.permissions()).containsExactlyInAnyOrder(DOC_READ, DOC_WRITE);
            assertThat(access.violations()).extracting(IntegrityViolation::kind)
                    .containsExactly(IntegrityViolation.Kind.ROLE_CYCLE);
        }

        @Test
        @DisplayName("reports an included role that does not exist")
        void unknownIncludedRole() {
            directory.saveRole(Role.tenant("lead-a", "lead", "org-a", Set.of("user:manage"))
                    .withIncludedRoleIds(Set.of("ghost")));
            user("erin", "org-a", "lead-a");

            ResolvedAccess access = resolver.resolveAccess("erin", "org-a");

            assertThat(access.permissions()).containsExactly(USER_MANAGE);
            assertThat(access.violations()).extracting(IntegrityViolation::kind, IntegrityViolation::roleId)
                    .containsExactly(tuple(
                            IntegrityViolation.Kind.UNKNOWN_ROLE, "ghost"));
        }
    }

    @Nested
    @DisplayName("cross-tenant capability")
    class CrossTenant {

        @Test
        @DisplayName("is granted by a global cross-tenant role")
        void globalRole() {
            directory.saveRole(Role.global("auditor", "auditor", Set.of("doc:read")).withCrossTenant(true));
            user("gina", "org-a", "auditor");

            assertThat(resolver.resolveAccess("gina", "org-a").crossTenant()).isTrue();
        }

        @Test
        @DisplayName("is ignored on a tenant role found in stored data")
        void tenantRoleIgnored() {
            Role rogue = Role.tenant("rogue", "rogue", "org-a", Set.of("doc:read")).withCrossTenant(true);
            UserStore users = mock(UserStore.class);
            AccessControlStore store = mock(AccessControlStore.class);
            AccessControlReader reader = mock(AccessControlReader.class);
            when(users.findUserById("hank"))
                    .thenReturn(Optional.of(User.active("hank", "hank@example.com", "hash", "org-a", Set.of("rogue"))));
            when(store.snapshot()).thenReturn(reader);
            when(reader.findRolesByIds(anyCollection())).thenReturn(Map.of("rogue", rogue));
            when(reader.findPermissionsByRoleId("rogue")).thenReturn(List.of(Permission.of("doc:read", "")));

            ResolvedAccess access = new PermissionResolver(users, store).resolveAccess("hank", "org-a");

            assertThat(access.crossTenant()).isFalse();
            assertThat(access.permissions()).containsExactly(DOC_READ);
            assertThat(access.violations()).extracting(IntegrityViolation::kind)
                    .containsExactly(IntegrityViolation.Kind.TENANT_ROLE_MARKED_CROSS_TENANT);
        }
    }

    @Test
    @DisplayName("propagates a store outage instead of denying")
    void storeOutage() {
        UserStore users = mock(UserStore.class);
        when(users.findUserById(any())).thenThrow(new StoreUnavailableException("directory down"));
        PermissionResolver failing = new PermissionResolver(users, directory);

        assertThatThrownBy(() -> failing.authorize("bob", "org-a", DOC_READ))
                .isInstanceOf(StoreUnavailableException.class);
    }
}
