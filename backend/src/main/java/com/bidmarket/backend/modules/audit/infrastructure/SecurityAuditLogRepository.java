package com.bidmarket.backend.modules.audit.infrastructure;

import java.util.List;
import java.util.UUID;

import com.bidmarket.backend.modules.audit.domain.SecurityAuditLog;
import com.bidmarket.backend.modules.audit.domain.SecurityEventType;

import org.springframework.data.jpa.repository.JpaRepository;

public interface SecurityAuditLogRepository extends JpaRepository<SecurityAuditLog, UUID> {

    List<SecurityAuditLog> findByUserIdAndEventTypeOrderByCreatedAtAsc(UUID userId, SecurityEventType eventType);
}
