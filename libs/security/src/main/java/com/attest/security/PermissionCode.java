package com.attest.security;

import java.util.regex.Pattern;

/**
 * Stable identifier of one atomic capability, in {@code resource:action} form (e.g. {@code
 * doc:read}).
 *
 * <p>Two wildcard shapes exist so that administrator roles stay ordinary roles: {@code
 * resource:*} grants every action on one resource and {@code *} grants everything.
 *
 * @param value the canonical code
 */
public record PermissionCode(String value) {

    /** Grants every permission. */
    public static final String WILDCARD = "*";

    private static final String SEPARATOR = ":";
    private static final Pattern FORMAT =
            Pattern.compile("\\*|[a-z][a-z0-9_.-]*:(\\*|[a-z][a-z0-9_.-]*)");

    public PermissionCode {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("permission code must not be null or blank");
        }
        if (!FORMAT.matcher(value).matches()) {
            throw new IllegalArgumentException(
                    "permission code must look like 'resource:action', 'resource:*' or '*': " + value);
        }
    }

    public static PermissionCode of(String value) {
        return new PermissionCode(value);
    }

    public static PermissionCode all() {
        return new PermissionCode(WILDCARD);
    }

    public boolean isWildcard() {
        return WILDCARD.equals(value) || value.endsWith(SEPARATOR + WILDCARD);
    }

    /** The resource part, or {@code *} for the global wildcard. */
    public String resource() {
        int idx = value.indexOf(SEPARATOR);
        return idx < 0 ? value : value.substring(0, idx);
    }

    /** The action part, or {@code *} for the global wildcard. */
    public String action() {
        int idx = value.indexOf(SEPARATOR);
        return idx < 0 ? value : value.substring(idx + 1);
    }

    /**
     * Whether holding this code grants {@code required}.
     *
     * <p>{@code *} implies everything, {@code doc:*} implies {@code doc:<anything>}, and any other
     * code implies only itself.
     */
    public boolean implies(PermissionCode required) {
        if (WILDCARD.equals(value) || value.equals(required.value())) {
            return true;
        }
        return WILDCARD.equals(action()) && resource().equals(required.resource());
    }

    @Override
    public String toString() {
        return value;
    }
}
