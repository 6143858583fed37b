package com.bidmarket.backend.modules.audit.domain;

public enum AuditSeverity {
    INFO,
    WARNING,
    CRITICAL
}
