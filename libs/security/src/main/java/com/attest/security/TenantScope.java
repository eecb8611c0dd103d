package com.attest.security;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Confines lookups to the caller's organization.
 *
 * <p>Listing goes through {@link #filter} or {@link #query}, which only ever see the caller's
 * organization. Fetching a resource referenced by id goes through {@link #require}, which rejects a
 * resource of another organization instead of returning it.
 *
 * <pre>{@code
 * TenantScope scope = TenantScope.of(context);
 * List<Document> docs = scope.query(documents::findByOrganizationId);
 * Document doc = scope.require(documents.findById(id), Document::organizationId);
 * }</pre>
 */
public final class TenantScope {

    private final SecurityContext context;

    private TenantScope(SecurityContext context) {
        this.context = context;
    }

    public static TenantScope of(SecurityContext context) {
        return new TenantScope(Objects.requireNonNull(context, "context"));
    }

    public String organizationId() {
        return context.organizationId();
    }

    /** Runs a query parameterized by the caller's organization id. */
    public <R> R query(Function<String, R> byOrganization) {
        return byOrganization.apply(context.organizationId());
    }

    /** Keeps only the resources owned by the caller's organization. */
    public <T> List<T> filter(Collection<T> resources, Function<T, String> organizationOf) {
        return resources.stream()
                .filter(resource -> TenantIsolationEnforcer
                        .scoped(context.organizationId(), organizationOf.apply(resource))
                        .allowed())
                .toList();
    }

    /**
     * @throws CrossTenantAccessException if the resource belongs to another organization
     */
    public <T> T require(T resource, Function<T, String> organizationOf) {
        Objects.requireNonNull(resource, "resource");
        TenantIsolationEnforcer.enforce(context, organizationOf.apply(resource));
        return resource;
    }

    /**
     * Same as {@link #require(Object, Function)} for an optional lookup result; an absent resource
     * stays absent.
     */
    public <T> Optional<T> require(Optional<T> resource, Function<T, String> organizationOf) {
        return resource.map(value -> require(value, organizationOf));
    }
}
