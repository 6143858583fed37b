package com.bidmarket.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;

/**
 * One refresh-token lineage. Immutable; rotation produces a new value.
 *
 * @param previousSelector selector replaced by the last rotation, kept only for reuse detection
 * @param lastRotatedAt    null until the first rotation
 */
public record Session(
        UUID id,
        UUID userId,
        String tokenSelector,
        String tokenVerifierHash,
        String previousSelector,
        OffsetDateTime expiresAt,
        OffsetDateTime createdAt,
        OffsetDateTime lastRotatedAt,
        String userAgent,
        String ipAddress
) {

    public Session {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(tokenSelector, "tokenSelector");
        Objects.requireNonNull(tokenVerifierHash, "tokenVerifierHash");
        Objects.requireNonNull(expiresAt, "expiresAt");
        Objects.requireNonNull(createdAt, "createdAt");
    }

    public boolean isExpiredAt(OffsetDateTime now) {
        return !expiresAt.isAfter(now);
    }

    public Session rotatedTo(String newSelector, String newVerifierHash, OffsetDateTime rotatedAt,
            OffsetDateTime newExpiresAt) {
        return new Session(id, userId, newSelector, newVerifierHash, tokenSelector, newExpiresAt, createdAt,
                rotatedAt, userAgent, ipAddress);
    }

    @Override
    public String toString() {
        return "Session[id=" + id + ", userId=" + userId + ", tokenSelector=" + tokenSelector
                + ", previousSelector=" + previousSelector + ", expiresAt=" + expiresAt + "]";
    }
}
