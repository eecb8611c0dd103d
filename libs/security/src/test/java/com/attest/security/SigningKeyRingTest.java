package com.attest.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Base64;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SigningKeyRing")
class SigningKeyRingTest {

    private static final String RAW_SECRET = "0123456789abcdef0123456789abcdef-raw";

    @Test
    @DisplayName("decodes Base64 secrets")
    void base64Secret() {
        String secret = Base64.getEncoder().encodeToString(new byte[32]);
        SigningKeyRing.SigningKey key = SigningKeyRing.key("k1", secret);
        assertThat(key.secretKey().getEncoded()).hasSize(32);
    }

    @Test
    @DisplayName("falls back to the raw UTF-8 bytes when the secret is not Base64")
    void rawSecret() {
        SigningKeyRing.SigningKey key = SigningKeyRing.key("k1", RAW_SECRET);
        assertThat(key.secretKey().getEncoded()).hasSize(RAW_SECRET.length());
    }

    @Test
    @DisplayName("rejects secrets shorter than 256 bits")
    void shortSecret() {
        assertThatThrownBy(() -> SigningKeyRing.key("k1", "too-short-secret"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least 32 bytes");
    }

    @Test
    @DisplayName("signs with the first key and verifies with all of them")
    void rotationOrder() {
        SigningKeyRing ring = new SigningKeyRing(List.of(
                SigningKeyRing.key("new", RAW_SECRET + "-new"),
                SigningKeyRing.key("old", RAW_SECRET + "-old")));

        assertThat(ring.signingKey().keyId()).isEqualTo("new");
        assertThat(ring.keyIds()).containsExactly("new", "old");
        assertThat(ring.verificationKey("old")).isPresent();
        assertThat(ring.verificationKey("gone")).isEmpty();
        assertThat(ring.verificationKey(null)).isEmpty();
    }

    @Test
    @DisplayName("rejects an empty ring and duplicate key ids")
    void invalidRings() {
        assertThatThrownBy(() -> new SigningKeyRing(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SigningKeyRing(List.of(
                SigningKeyRing.key("k1", RAW_SECRET), SigningKeyRing.key("k1", RAW_SECRET))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("duplicate");
    }

    @Test
    @DisplayName("never prints key material")
    void toStringHidesKey() {
        assertThat(SigningKeyRing.key("k1", RAW_SECRET).toString()).isEqualTo("SigningKey[keyId=k1]");
    }
}
