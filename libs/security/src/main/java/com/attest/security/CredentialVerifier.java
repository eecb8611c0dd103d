package com.attest.security;

import java.security.SecureRandom;
import java.util.UUID;
import java.util.regex.Pattern;

import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

/**
 * Checks presented secrets against stored BCrypt hashes.
 *
 * <p>Every call performs exactly one BCrypt comparison. When there is no usable stored hash
 * (unknown user, or a value that is not a BCrypt hash) the comparison runs against a dummy hash
 * computed at construction and the result is discarded, so "no such user" and "wrong password"
 * take the same time. The result is only ever a boolean; plaintext and hashes are never logged.
 */
public class CredentialVerifier {

    public static final int DEFAULT_STRENGTH = 12;

    private static final Pattern BCRYPT_SHAPE =
            Pattern.compile("\\A\\$2([ayb])?\\$(\\d\\d)\\$[./0-9A-Za-z]{53}");

    private final BCryptPasswordEncoder encoder;
    private final PasswordPolicy policy;
    private final String dummyHash;

    public CredentialVerifier() {
        this(DEFAULT_STRENGTH, PasswordPolicy.defaults());
    }

    /**
     * @param strength BCrypt log rounds (4 to 31)
     * @param policy   rules applied by {@link #hash(String)}
     */
    public CredentialVerifier(int strength, PasswordPolicy policy) {
        this.encoder = new BCryptPasswordEncoder(strength, new SecureRandom());
        this.policy = policy;
        this.dummyHash = encoder.encode(UUID.randomUUID().toString());
    }

    /**
     * @param plaintext  the presented secret (may be null)
     * @param storedHash the stored hash, or null when the user does not exist
     * @return true only if both are present and match
     */
    public boolean verify(String plaintext, String storedHash) {
        boolean usableHash = storedHash != null && BCRYPT_SHAPE.matcher(storedHash).matches();
        String candidate = plaintext == null ? "" : plaintext;
        boolean matches = encoder.matches(candidate, usableHash ? storedHash : dummyHash);
        return usableHash && plaintext != null && matches;
    }

    /**
     * Validates the password against the policy and hashes it with a fresh salt.
     *
     * @throws IllegalArgumentException if the policy rejects the password
     */
    public String hash(String plaintext) {
        policy.validate(plaintext);
        return encoder.encode(plaintext);
    }

    /**
     * Whether the stored hash was produced with fewer rounds than this verifier uses. Hashes that
     * are not BCrypt hashes never need a rehash; they can never verify either.
     */
    public boolean needsRehash(String storedHash) {
        return storedHash != null
                && BCRYPT_SHAPE.matcher(storedHash).matches()
                && encoder.upgradeEncoding(storedHash);
    }

    /** Re-encodes an already accepted secret at the current strength, bypassing the policy. */
    String rehash(String acceptedPlaintext) {
        return encoder.encode(acceptedPlaintext);
    }

    public PasswordPolicy policy() {
        return policy;
    }
}
