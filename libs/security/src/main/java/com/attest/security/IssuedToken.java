package com.attest.security;

/**
 * A freshly signed token together with the claims it carries.
 *
 * @param token  compact, URL-safe serialization sent as a bearer credential
 * @param claims the claims inside {@code token}
 */
public record IssuedToken(String token, TokenClaims claims) {

    @Override
    public String toString() {
        return "IssuedToken[kind=" + claims.kind() + ", tokenId=" + claims.tokenId() + "]";
    }
}
