package com.bidmarket.backend.modules.auth.application;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.bidmarket.backend.modules.auth.domain.Session;

/**
 * Session summary safe to show to its owner. Carries no selector or verifier material.
 */
public record SessionInfo(
        UUID id,
        String userAgent,
        String ipAddress,
        OffsetDateTime createdAt,
        OffsetDateTime expiresAt,
        OffsetDateTime lastRotatedAt,
        boolean current
) {

    static SessionInfo of(Session session, UUID currentSessionId) {
        return new SessionInfo(
                session.id(),
                session.userAgent(),
                session.ipAddress(),
                session.createdAt(),
                session.expiresAt(),
                session.lastRotatedAt(),
                session.id().equals(currentSessionId)
        );
    }
}
