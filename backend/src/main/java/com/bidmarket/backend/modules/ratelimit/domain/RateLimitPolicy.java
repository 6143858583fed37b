package com.bidmarket.backend.modules.ratelimit.domain;

import java.time.Duration;

public record RateLimitPolicy(int maxAttempts, Duration window) {

    public RateLimitPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
    }
}
