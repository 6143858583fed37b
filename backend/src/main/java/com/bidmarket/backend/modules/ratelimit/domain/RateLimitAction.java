package com.bidmarket.backend.modules.ratelimit.domain;

/**
 * Authentication actions that are counted separately.
 */
public enum RateLimitAction {
    LOGIN,
    REFRESH,
    PASSWORD_CHANGE
}
