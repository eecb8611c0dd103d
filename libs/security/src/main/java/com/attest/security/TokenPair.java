package com.attest.security;

/**
 * Access and refresh token returned by a successful login.
 *
 * @param access  short-lived access token
 * @param refresh long-lived refresh token
 */
public record TokenPair(IssuedToken access, IssuedToken refresh) {

    public static final String TOKEN_TYPE = "Bearer";

    public String accessToken() {
        return access.token();
    }

    public String refreshToken() {
        return refresh.token();
    }

    public String tokenType() {
        return TOKEN_TYPE;
    }
}
