package com.attest.security;

import io.jsonwebtoken.security.Keys;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import javax.crypto.SecretKey;

/**
 * Ordered set of HMAC keys used to sign and verify tokens.
 *
 * <p>The first key signs every new token and its id goes into the {@code kid} header. All keys
 * verify, so a rotated-out key keeps validating tokens issued before the rollover until it is
 * removed from configuration.
 */
public final class SigningKeyRing {

    /** HS256 requires at least 256 bits of key material. */
    public static final int MIN_SECRET_BYTES = 32;

    /**
     * One named signing key.
     *
     * @param keyId     value of the {@code kid} header
     * @param secretKey HMAC key material
     */
    public record SigningKey(String keyId, SecretKey secretKey) {

        public SigningKey {
            if (keyId == null || keyId.isBlank()) {
                throw new IllegalArgumentException("keyId must not be null or blank");
            }
            if (secretKey == null) {
                throw new IllegalArgumentException("secretKey must not be null");
            }
        }

        @Override
        public String toString() {
            return "SigningKey[keyId=" + keyId + "]";
        }
    }

    private final List<SigningKey> keys;
    private final Map<String, SecretKey> keysById;

    public SigningKeyRing(List<SigningKey> keys) {
        if (keys == null || keys.isEmpty()) {
            throw new IllegalArgumentException("at least one signing key is required");
        }
        Map<String, SecretKey> byId = new LinkedHashMap<>();
        for (SigningKey key : keys) {
            if (byId.putIfAbsent(key.keyId(), key.secretKey()) != null) {
                throw new IllegalArgumentException("duplicate signing key id: " + key.keyId());
            }
        }
        this.keys = List.copyOf(keys);
        this.keysById = Map.copyOf(byId);
    }

    /** Single-key ring. */
    public static SigningKeyRing of(String keyId, String secret) {
        return new SigningKeyRing(List.of(key(keyId, secret)));
    }

    /**
     * Builds a key from configuration text. The secret is read as Base64 when it decodes cleanly,
     * otherwise as raw UTF-8 bytes.
     *
     * @throws IllegalArgumentException if the secret is shorter than {@value #MIN_SECRET_BYTES}
     *                                  bytes
     */
    public static SigningKey key(String keyId, String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("secret for key '" + keyId + "' must not be blank");
        }
        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(secret);
        } catch (IllegalArgumentException ex) {
            keyBytes = secret.getBytes(StandardCharsets.UTF_8);
        }
        if (keyBytes.length < MIN_SECRET_BYTES) {
            throw new IllegalArgumentException(
                    "secret for key '%s' must provide at least %d bytes, got %d"
                            .formatted(keyId, MIN_SECRET_BYTES, keyBytes.length));
        }
        return new SigningKey(keyId, Keys.hmacShaKeyFor(keyBytes));
    }

    /** The newest key, used for signing. */
    public SigningKey signingKey() {
        return keys.get(0);
    }

    /** Key for verifying a token that names {@code keyId} in its header. */
    public Optional<SecretKey> verificationKey(String keyId) {
        if (keyId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(keysById.get(keyId));
    }

    /** Key ids, newest first. */
    public List<String> keyIds() {
        List<String> ids = new ArrayList<>(keys.size());
        for (SigningKey key : keys) {
            ids.add(key.keyId());
        }
        return ids;
    }
}
