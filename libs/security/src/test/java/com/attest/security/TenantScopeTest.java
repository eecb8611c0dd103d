package com.attest.security;

import com.attest.security.testing.TestSecurityContextFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TenantScope")
class TenantScopeTest {

    private record Document(String id, String organizationId) {
    }

    private static final List<Document> DOCUMENTS = List.of(
            new Document("d1", "org-a"),
            new Document("d2", "org-b"),
            new Document("d3", "org-a"),
            new Document("d4", null));

    private final TenantScope scope = TenantScope.of(TestSecurityContextFactory.createForOrganization("org-a"));

    @Test
    @DisplayName("filter() keeps only the caller's organization")
    void filter() {
        assertThat(scope.filter(DOCUMENTS, Document::organizationId))
                .extracting(Document::id)
                .containsExactly("d1", "d3");
    }

    @Test
    @DisplayName("query() passes the caller's organization id")
    void query() {
        List<Document> found = scope.query(org -> DOCUMENTS.stream()
                .filter(d -> org.equals(d.organizationId()))
                .toList());
        assertThat(found).extracting(Document::id).containsExactly("d1", "d3");
        assertThat(scope.organizationId()).isEqualTo("org-a");
    }

    @Test
    @DisplayName("require() returns a resource of the caller's organization")
    void requireOwn() {
        assertThat(scope.require(DOCUMENTS.get(0), Document::organizationId)).isSameAs(DOCUMENTS.get(0));
        assertThat(scope.require(Optional.of(DOCUMENTS.get(2)), Document::organizationId)).contains(DOCUMENTS.get(2));
        assertThat(scope.require(Optional.<Document>empty(), Document::organizationId)).isEmpty();
    }

    @Test
    @DisplayName("require() rejects a resource of another organization")
    void requireForeign() {
        assertThatThrownBy(() -> scope.require(DOCUMENTS.get(1), Document::organizationId))
                .isInstanceOf(CrossTenantAccessException.class);
        assertThatThrownBy(() -> scope.require(Optional.of(DOCUMENTS.get(3)), Document::organizationId))
                .isInstanceOf(CrossTenantAccessException.class);
    }
}
