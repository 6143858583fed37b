package com.bidmarket.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.bidmarket.backend.modules.auth.domain.Session;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

@Entity
@Table(name = "user_session", indexes = {
        @Index(name = "ix_user_session_previous_selector", columnList = "previous_selector"),
        @Index(name = "ix_user_session_user_id", columnList = "user_id")
})
public class UserSessionEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID userId;

    @Column(name = "token_selector", nullable = false, unique = true, length = 32)
    private String tokenSelector;

    @Column(name = "token_verifier_hash", nullable = false, length = 72)
    private String tokenVerifierHash;

    @Column(name = "previous_selector", length = 32)
    private String previousSelector;

    @Column(name = "expires_at", nullable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "last_rotated_at")
    private OffsetDateTime lastRotatedAt;

    @Column(name = "user_agent", length = 512)
    private String userAgent;

    @Column(name = "ip_address", length = 64)
    private String ipAddress;

    protected UserSessionEntity() {
    }

    static UserSessionEntity from(Session session) {
        UserSessionEntity entity = new UserSessionEntity();
        entity.id = session.id();
        entity.userId = session.userId();
        entity.tokenSelector = session.tokenSelector();
        entity.tokenVerifierHash = session.tokenVerifierHash();
        entity.previousSelector = session.previousSelector();
        entity.expiresAt = session.expiresAt();
        entity.createdAt = session.createdAt();
        entity.lastRotatedAt = session.lastRotatedAt();
        entity.userAgent = session.userAgent();
        entity.ipAddress = session.ipAddress();
        return entity;
    }

    Session toSession() {
        return new Session(id, userId, tokenSelector, tokenVerifierHash, previousSelector, expiresAt, createdAt,
                lastRotatedAt, userAgent, ipAddress);
    }

    public UUID getId() {
        return id;
    }

    public UUID getUserId() {
        return userId;
    }

    public String getTokenSelector() {
        return tokenSelector;
    }

    public String getPreviousSelector() {
        return previousSelector;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }
}
