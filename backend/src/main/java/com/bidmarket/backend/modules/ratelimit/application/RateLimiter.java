package com.bidmarket.backend.modules.ratelimit.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.bidmarket.backend.modules.ratelimit.config.RateLimitProperties;
import com.bidmarket.backend.modules.ratelimit.domain.RateLimitAction;
import com.bidmarket.backend.modules.ratelimit.domain.RateLimitDecision;
import com.bidmarket.backend.modules.ratelimit.domain.RateLimitKey;
import com.bidmarket.backend.modules.ratelimit.domain.RateLimitPolicy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Fixed-window attempt counter per (action, identity).
 *
 * <p>The first attempt opens a window of the action's length. Attempt {@code n} inside a window is
 * allowed while {@code n <= maxAttempts}. An attempt after the window ended opens a new one.
 * Each check counts as an attempt, so callers consult the limiter before doing the guarded work.
 */
@Component
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final Map<RateLimitAction, RateLimitPolicy> policies;
    private final Duration idleEviction;
    private final Clock clock;
    private final ConcurrentHashMap<RateLimitKey, Window> windows = new ConcurrentHashMap<>();

    @Autowired
    public RateLimiter(RateLimitProperties properties, Clock clock) {
        this(properties.policies(), properties.idleEviction(), clock);
    }

    public RateLimiter(Map<RateLimitAction, RateLimitPolicy> policies, Duration idleEviction, Clock clock) {
        this.policies = new EnumMap<>(policies);
        this.idleEviction = idleEviction;
        this.clock = clock;
    }

    public RateLimitDecision check(RateLimitKey key) {
        RateLimitPolicy policy = policyFor(key.action());
        Instant now = clock.instant();

        // compute() runs atomically per key, so concurrent attempts are never undercounted
        Window window = windows.compute(key, (k, existing) -> {
            if (existing == null || existing.hasEndedAt(now)) {
                return new Window(1, now, now.plus(policy.window()), now);
            }
            return existing.increment(now);
        });

        boolean allowed = window.attemptCount() <= policy.maxAttempts();
        int remaining = Math.max(0, policy.maxAttempts() - window.attemptCount());
        Duration retryAfter = allowed ? Duration.ZERO : Duration.between(now, window.endsAt());
        if (!allowed && window.attemptCount() == policy.maxAttempts() + 1) {
            log.warn("Rate limit reached for {} ({} attempts per {}), blocked until {}",
                    key.action(), policy.maxAttempts(), policy.window(), window.endsAt());
        }
        return new RateLimitDecision(allowed, remaining, policy.maxAttempts(), window.endsAt(), retryAfter);
    }

    /**
     * Current state without counting an attempt.
     */
    public RateLimitDecision peek(RateLimitKey key) {
        RateLimitPolicy policy = policyFor(key.action());
        Instant now = clock.instant();
        Window window = windows.get(key);
        if (window == null || window.hasEndedAt(now)) {
            return new RateLimitDecision(true, policy.maxAttempts(), policy.maxAttempts(),
                    now.plus(policy.window()), Duration.ZERO);
        }
        boolean allowed = window.attemptCount() < policy.maxAttempts();
        return new RateLimitDecision(allowed, Math.max(0, policy.maxAttempts() - window.attemptCount()),
                policy.maxAttempts(), window.endsAt(), allowed ? Duration.ZERO : Duration.between(now, window.endsAt()));
    }

    public void reset(RateLimitKey key) {
        windows.remove(key);
    }

    /**
     * Drops windows that ended and saw no attempt for the idle period. Returns how many were dropped.
     */
    public int evictIdle() {
        Instant now = clock.instant();
        Instant idleCutoff = now.minus(idleEviction);
        int before = windows.size();
        windows.entrySet().removeIf(entry -> entry.getValue().hasEndedAt(now)
                && entry.getValue().lastAttemptAt().isBefore(idleCutoff));
        return Math.max(0, before - windows.size());
    }

    int trackedKeys() {
        return windows.size();
    }

    private RateLimitPolicy policyFor(RateLimitAction action) {
        RateLimitPolicy policy = policies.get(action);
        if (policy == null) {
            throw new IllegalStateException("No rate limit policy configured for " + action);
        }
        return policy;
    }

    private record Window(int attemptCount, Instant windowStart, Instant endsAt, Instant lastAttemptAt) {

        boolean hasEndedAt(Instant now) {
            return !now.isBefore(endsAt);
        }

        Window increment(Instant now) {
            int next = attemptCount == Integer.MAX_VALUE ? attemptCount : attemptCount + 1;
            return new Window(next, windowStart, endsAt, now);
        }
    }
}
