package com.bidmarket.backend.modules.audit.domain;

public enum SecurityEventType {
    LOGIN_SUCCESS,
    LOGIN_FAILED,
    LOGOUT,
    TOKEN_REFRESH,
    PASSWORD_CHANGE,
    SESSION_REVOKED,
    TOKEN_REUSE_DETECTED,
    RATE_LIMIT_EXCEEDED,
    SESSION_LIMIT_REACHED
}
