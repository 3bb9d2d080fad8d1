package com.tasktrack.api.security;

import java.util.Optional;

/**
 * Pulls the token out of an {@code Authorization: Bearer <token>} header value.
 */
public final class BearerTokenExtractor {

    private static final String SCHEME = "Bearer";

    private BearerTokenExtractor() {}

    /**
     * @param authorizationHeader the raw header value, may be null
     * @return the token, or empty if the header is missing, uses another scheme, or carries no
     *     single token after the scheme
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        var trimmed = authorizationHeader.strip();
        int split = indexOfWhitespace(trimmed);
        if (split < 0 || !trimmed.substring(0, split).equalsIgnoreCase(SCHEME)) {
            return Optional.empty();
        }
        var token = trimmed.substring(split).strip();
        if (token.isEmpty() || indexOfWhitespace(token) >= 0) {
            return Optional.empty();
        }
        return Optional.of(token);
    }

    private static int indexOfWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
