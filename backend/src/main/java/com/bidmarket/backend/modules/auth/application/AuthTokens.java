package com.bidmarket.backend.modules.auth.application;

import java.time.Instant;
import java.util.UUID;

/**
 * Credentials handed to a client after login, refresh or password change.
 *
 * @param expiresIn access-token lifetime in seconds
 */
public record AuthTokens(
        String accessToken,
        String tokenType,
        long expiresIn,
        Instant accessTokenExpiresAt,
        String refreshToken,
        UUID sessionId,
        UUID userId
) {

    public static final String DEFAULT_TOKEN_TYPE = "Bearer";

    @Override
    public String toString() {
        return "AuthTokens[tokenType=" + tokenType + ", expiresIn=" + expiresIn + ", sessionId=" + sessionId
                + ", userId=" + userId + "]";
    }
}
