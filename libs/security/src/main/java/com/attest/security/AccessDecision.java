package com.attest.security;

/**
 * Result of an authorization or tenancy check: allowed, or denied with the failing check.
 *
 * @param allowed whether access is granted
 * @param reason  the failing check when denied, {@code null} when allowed
 */
public record AccessDecision(boolean allowed, AuthFailure reason) {

    private static final AccessDecision ALLOW = new AccessDecision(true, null);

    public AccessDecision {
        if (allowed && reason != null) {
            throw new IllegalArgumentException("an allowed decision carries no reason");
        }
        if (!allowed && reason == null) {
            throw new IllegalArgumentException("a denied decision must carry a reason");
        }
    }

    public static AccessDecision allow() {
        return ALLOW;
    }

    public static AccessDecision deny(AuthFailure reason) {
        return new AccessDecision(false, reason);
    }

    public boolean isDenied() {
        return !allowed;
    }
}
