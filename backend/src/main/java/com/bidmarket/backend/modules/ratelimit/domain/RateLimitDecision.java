package com.bidmarket.backend.modules.ratelimit.domain;

import java.time.Duration;
import java.time.Instant;

/**
 * @param remaining  attempts left in the current window, never negative
 * @param resetAt    end of the current window
 * @param retryAfter time until the window ends; zero when the attempt was allowed
 */
public record RateLimitDecision(
        boolean allowed,
        int remaining,
        int limit,
        Instant resetAt,
        Duration retryAfter
) {
}
