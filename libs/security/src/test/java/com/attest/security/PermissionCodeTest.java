package com.attest.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PermissionCode")
class PermissionCodeTest {

    @Nested
    @DisplayName("format")
    class Format {

        @ParameterizedTest
        @ValueSource(strings = {"doc:read", "doc:*", "*", "submission.review:approve", "user_admin:manage-roles"})
        @DisplayName("accepts resource:action codes and wildcards")
        void valid(String code) {
            assertThat(PermissionCode.of(code).value()).isEqualTo(code);
        }

        @ParameterizedTest
        @ValueSource(strings = {"", " ", "doc", "doc:", ":read", "Doc:read", "doc:read:extra", "*:read", "doc read"})
        @DisplayName("rejects anything else")
        void invalid(String code) {
            assertThatThrownBy(() -> PermissionCode.of(code)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("splits into resource and action")
        void parts() {
            PermissionCode code = PermissionCode.of("doc:read");
            assertThat(code.resource()).isEqualTo("doc");
            assertThat(code.action()).isEqualTo("read");
            assertThat(code).hasToString("doc:read");
        }
    }

    @Nested
    @DisplayName("implies()")
    class Implies {

        @Test
        @DisplayName("an exact code implies only itself")
        void exact() {
            PermissionCode read = PermissionCode.of("doc:read");
            assertThat(read.implies(PermissionCode.of("doc:read"))).isTrue();
            assertThat(read.implies(PermissionCode.of("doc:write"))).isFalse();
            assertThat(read.implies(PermissionCode.of("doc:*"))).isFalse();
        }

        @Test
        @DisplayName("a resource wildcard implies every action on that resource")
        void resourceWildcard() {
            PermissionCode anyDoc = PermissionCode.of("doc:*");
            assertThat(anyDoc.isWildcard()).isTrue();
            assertThat(anyDoc.implies(PermissionCode.of("doc:delete"))).isTrue();
            assertThat(anyDoc.implies(PermissionCode.of("user:manage"))).isFalse();
            assertThat(anyDoc.implies(PermissionCode.all())).isFalse();
        }

        @Test
        @DisplayName("the global wildcard implies everything")
        void globalWildcard() {
            assertThat(PermissionCode.all().implies(PermissionCode.of("user:manage"))).isTrue();
            assertThat(PermissionCode.all().implies(PermissionCode.of("doc:*"))).isTrue();
        }
    }
}
