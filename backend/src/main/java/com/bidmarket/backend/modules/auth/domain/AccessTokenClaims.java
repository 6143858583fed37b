package com.bidmarket.backend.modules.auth.domain;

import java.time.Instant;
import java.util.UUID;

/**
 * Claims recovered from a verified access token.
 */
public record AccessTokenClaims(
        UUID subject,
        String email,
        String role,
        String issuer,
        Instant issuedAt,
        Instant expiresAt
) {
}
