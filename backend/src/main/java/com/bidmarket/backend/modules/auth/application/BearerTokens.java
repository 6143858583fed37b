package com.bidmarket.backend.modules.auth.application;

import java.util.Optional;

/**
 * Extracts the credential from an {@code Authorization} header value.
 */
public final class BearerTokens {

    private static final String BEARER_PREFIX = "Bearer ";

    private BearerTokens() {
    }

    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.length() <= BEARER_PREFIX.length()) {
            return Optional.empty();
        }
        if (!authorizationHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return Optional.empty();
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}
