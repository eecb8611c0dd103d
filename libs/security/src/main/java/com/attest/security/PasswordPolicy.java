package com.attest.security;

import java.nio.charset.StandardCharsets;

/**
 * Rules a new password must satisfy before it is hashed.
 *
 * @param minLength minimum number of characters
 */
public record PasswordPolicy(int minLength) {

    public static final int DEFAULT_MIN_LENGTH = 8;

    /** BCrypt ignores input beyond 72 bytes. */
    public static final int MAX_BYTES = 72;

    public PasswordPolicy {
        if (minLength < 1) {
            throw new IllegalArgumentException("minLength must be at least 1");
        }
    }

    public static PasswordPolicy defaults() {
        return new PasswordPolicy(DEFAULT_MIN_LENGTH);
    }

    /**
     * @throws IllegalArgumentException if the password does not satisfy the policy
     */
    public void validate(String password) {
        if (password == null || password.length() < minLength) {
            throw new IllegalArgumentException(
                    "Password must be at least " + minLength + " characters long");
        }
        if (password.getBytes(StandardCharsets.UTF_8).length > MAX_BYTES) {
            throw new IllegalArgumentException(
                    "Password must be at most " + MAX_BYTES + " bytes long");
        }
        if (password.isBlank()) {
            throw new IllegalArgumentException("Password must not be blank");
        }
    }
}
