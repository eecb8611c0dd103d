package com.attest.security;

import java.util.Optional;

/**
 * Extracts the bearer credential from an HTTP {@code Authorization} header value.
 *
 * <p>Accepts {@code Bearer <token>} with a case-insensitive scheme and one or more spaces. The
 * token must be a single run of non-whitespace characters; anything else yields empty.
 */
public final class BearerTokenExtractor {

    public static final String AUTHORIZATION_HEADER = "Authorization";
    public static final String SCHEME = "Bearer";

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * @param authorizationHeader the full header value (may be null)
     * @return the token, or empty if the header is missing, uses another scheme, or is malformed
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String trimmed = authorizationHeader.strip();
        if (!trimmed.regionMatches(true, 0, SCHEME, 0, SCHEME.length())) {
            return Optional.empty();
        }
        String rest = trimmed.substring(SCHEME.length());
        // "Bearerabc" is not the bearer scheme
        if (rest.isEmpty() || !Character.isWhitespace(rest.charAt(0))) {
            return Optional.empty();
        }
        String token = rest.strip();
        if (token.isEmpty() || token.chars().anyMatch(Character::isWhitespace)) {
            return Optional.empty();
        }
        return Optional.of(token);
    }
}
