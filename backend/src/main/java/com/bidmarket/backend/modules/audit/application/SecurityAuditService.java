package com.bidmarket.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.bidmarket.backend.modules.audit.domain.AuditSeverity;
import com.bidmarket.backend.modules.audit.domain.SecurityAuditLog;
import com.bidmarket.backend.modules.audit.domain.SecurityEventType;
import com.bidmarket.backend.modules.audit.infrastructure.SecurityAuditLogRepository;
import com.bidmarket.backend.modules.auth.domain.ClientInfo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Persists authentication events. A failed audit write is logged and never fails the operation
 * being audited.
 */
@Service
public class SecurityAuditService {

    private static final Logger log = LoggerFactory.getLogger(SecurityAuditService.class);
    private static final String UNKNOWN = "unknown";

    private final SecurityAuditLogRepository auditLogRepository;
    private final Clock clock;

    public SecurityAuditService(SecurityAuditLogRepository auditLogRepository, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.clock = clock;
    }

    public void record(SecurityAuditEvent event) {
        Objects.requireNonNull(event.type(), "type is required");

        SecurityAuditLog entry = new SecurityAuditLog();
        entry.setEventType(event.type());
        entry.setSeverity(event.severity() != null ? event.severity() : AuditSeverity.INFO);
        entry.setUserId(event.userId());
        entry.setEmail(event.email());
        ClientInfo client = event.client() != null ? event.client() : ClientInfo.UNKNOWN_CLIENT;
        entry.setIpAddress(client.ipAddress() != null ? client.ipAddress() : UNKNOWN);
        entry.setUserAgent(client.userAgent() != null ? client.userAgent() : UNKNOWN);
        if (event.detail() != null && !event.detail().isEmpty()) {
            entry.setDetail(new HashMap<>(event.detail()));
        }
        entry.setCreatedAt(OffsetDateTime.now(clock));

        try {
            auditLogRepository.save(entry);
        } catch (DataAccessException ex) {
            log.error("Failed to persist {} audit event for user {}", event.type(), event.userId(), ex);
        }
    }

    public record SecurityAuditEvent(
            SecurityEventType type,
            AuditSeverity severity,
            UUID userId,
            String email,
            ClientInfo client,
            Map<String, Object> detail
    ) {

        public static SecurityAuditEvent of(SecurityEventType type, AuditSeverity severity, UUID userId,
                String email, ClientInfo client) {
            return new SecurityAuditEvent(type, severity, userId, email, client, Map.of());
        }

        public SecurityAuditEvent withDetail(String key, Object value) {
            Map<String, Object> merged = new HashMap<>(detail != null ? detail : Map.of());
            merged.put(key, value);
            return new SecurityAuditEvent(type, severity, userId, email, client, merged);
        }
    }
}
