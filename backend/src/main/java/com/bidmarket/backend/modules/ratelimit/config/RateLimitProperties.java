package com.bidmarket.backend.modules.ratelimit.config;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

import com.bidmarket.backend.modules.ratelimit.domain.RateLimitAction;
import com.bidmarket.backend.modules.ratelimit.domain.RateLimitPolicy;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings bound from {@code bidmarket.rate-limit.*}. Actions without an entry fall back to the
 * built-in defaults.
 */
@ConfigurationProperties(prefix = "bidmarket.rate-limit")
public record RateLimitProperties(
        Map<RateLimitAction, Limit> actions,
        Duration idleEviction
) {

    private static final Map<RateLimitAction, RateLimitPolicy> DEFAULTS = Map.of(
            RateLimitAction.LOGIN, new RateLimitPolicy(5, Duration.ofMinutes(15)),
            RateLimitAction.REFRESH, new RateLimitPolicy(30, Duration.ofMinutes(15)),
            RateLimitAction.PASSWORD_CHANGE, new RateLimitPolicy(5, Duration.ofMinutes(15))
    );

    public RateLimitProperties {
        actions = actions != null ? actions : Map.of();
        idleEviction = idleEviction != null ? idleEviction : Duration.ofMinutes(30);
    }

    public Map<RateLimitAction, RateLimitPolicy> policies() {
        Map<RateLimitAction, RateLimitPolicy> resolved = new EnumMap<>(DEFAULTS);
        actions.forEach((action, limit) -> resolved.put(action, new RateLimitPolicy(limit.maxAttempts(), limit.window())));
        return resolved;
    }

    public record Limit(int maxAttempts, Duration window) {
    }
}
