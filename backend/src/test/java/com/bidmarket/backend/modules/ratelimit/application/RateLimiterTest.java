package com.bidmarket.backend.modules.ratelimit.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.bidmarket.backend.modules.ratelimit.config.RateLimitProperties;
import com.bidmarket.backend.modules.ratelimit.domain.RateLimitAction;
import com.bidmarket.backend.modules.ratelimit.domain.RateLimitDecision;
import com.bidmarket.backend.modules.ratelimit.domain.RateLimitKey;
import com.bidmarket.backend.modules.ratelimit.domain.RateLimitPolicy;
import com.bidmarket.backend.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RateLimiterTest {

    private static final Duration WINDOW = Duration.ofMinutes(15);
    private static final RateLimitKey LOGIN_KEY = RateLimitKey.of(RateLimitAction.LOGIN, "203.0.113.10");

    private MutableClock clock;
    private RateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        rateLimiter = new RateLimiter(new RateLimitProperties(null, null), clock);
    }

    @Test
    void sixthAttemptInWindowIsBlocked() {
        for (int attempt = 1; attempt <= 5; attempt++) {
            RateLimitDecision decision = rateLimiter.check(LOGIN_KEY);
            assertThat(decision.allowed()).isTrue();
            assertThat(decision.remaining()).isEqualTo(5 - attempt);
            assertThat(decision.limit()).isEqualTo(5);
        }

        clock.advance(Duration.ofMinutes(5));
        RateLimitDecision blocked = rateLimiter.check(LOGIN_KEY);

        assertThat(blocked.allowed()).isFalse();
        assertThat(blocked.remaining()).isZero();
        assertThat(blocked.resetAt()).isEqualTo(Instant.parse("2025-01-01T00:15:00Z"));
        assertThat(blocked.retryAfter()).isEqualTo(Duration.ofMinutes(10));
    }

    @Test
    void windowResetsAfterItElapses() {
        for (int attempt = 0; attempt < 6; attempt++) {
            rateLimiter.check(LOGIN_KEY);
        }
        assertThat(rateLimiter.check(LOGIN_KEY).allowed()).isFalse();

        clock.advance(WINDOW);

        RateLimitDecision decision = rateLimiter.check(LOGIN_KEY);
        assertThat(decision.allowed()).isTrue();
        assertThat(decision.remaining()).isEqualTo(4);
        assertThat(decision.resetAt()).isEqualTo(clock.instant().plus(WINDOW));
    }

    @Test
    void keysAreIndependent() {
        for (int attempt = 0; attempt < 6; attempt++) {
            rateLimiter.check(LOGIN_KEY);
        }

        assertThat(rateLimiter.check(RateLimitKey.of(RateLimitAction.LOGIN, "203.0.113.11")).allowed()).isTrue();
        assertThat(rateLimiter.check(RateLimitKey.of(RateLimitAction.REFRESH, "203.0.113.10")).allowed()).isTrue();
    }

    @Test
    void resetClearsTheCounter() {
        for (int attempt = 0; attempt < 6; attempt++) {
            rateLimiter.check(LOGIN_KEY);
        }

        rateLimiter.reset(LOGIN_KEY);

        assertThat(rateLimiter.check(LOGIN_KEY).remaining()).isEqualTo(4);
    }

    @Test
    void peekDoesNotCountAnAttempt() {
        rateLimiter.check(LOGIN_KEY);

        RateLimitDecision first = rateLimiter.peek(LOGIN_KEY);
        RateLimitDecision second = rateLimiter.peek(LOGIN_KEY);

        assertThat(first.remaining()).isEqualTo(4);
        assertThat(second.remaining()).isEqualTo(4);
        assertThat(second.allowed()).isTrue();
    }

    @Test
    void concurrentAttemptsAreNeverUndercounted() throws InterruptedException {
        rateLimiter = new RateLimiter(Map.of(RateLimitAction.REFRESH, new RateLimitPolicy(50, WINDOW)),
                Duration.ofMinutes(30), clock);
        RateLimitKey key = RateLimitKey.of(RateLimitAction.REFRESH, "198.51.100.1");
        int threads = 8;
        int attemptsPerThread = 25;
        AtomicInteger allowed = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                start.await();
                for (int i = 0; i < attemptsPerThread; i++) {
                    if (rateLimiter.check(key).allowed()) {
                        allowed.incrementAndGet();
                    }
                }
                return null;
            });
        }
        start.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(allowed.get()).isEqualTo(50);
    }

    @Test
    void evictIdleDropsOnlyEndedAndIdleWindows() {
        rateLimiter.check(LOGIN_KEY);
        clock.advance(Duration.ofMinutes(40));
        RateLimitKey recent = RateLimitKey.of(RateLimitAction.LOGIN, "203.0.113.99");
        rateLimiter.check(recent);

        assertThat(rateLimiter.evictIdle()).isEqualTo(1);
        assertThat(rateLimiter.trackedKeys()).isEqualTo(1);
        assertThat(rateLimiter.peek(recent).remaining()).isEqualTo(4);
    }

    @Test
    void configuredLimitsOverrideDefaults() {
        RateLimitProperties properties = new RateLimitProperties(
                Map.of(RateLimitAction.LOGIN, new RateLimitProperties.Limit(2, Duration.ofMinutes(1))), null);
        rateLimiter = new RateLimiter(properties, clock);

        rateLimiter.check(LOGIN_KEY);
        rateLimiter.check(LOGIN_KEY);

        assertThat(rateLimiter.check(LOGIN_KEY).allowed()).isFalse();
        assertThat(properties.policies().get(RateLimitAction.REFRESH).maxAttempts()).isEqualTo(30);
    }

    @Test
    void missingPolicyIsAConfigurationError() {
        rateLimiter = new RateLimiter(Map.of(RateLimitAction.LOGIN, new RateLimitPolicy(5, WINDOW)),
                Duration.ofMinutes(30), clock);

        assertThatThrownBy(() -> rateLimiter.check(RateLimitKey.of(RateLimitAction.REFRESH, "x")))
                .isInstanceOf(IllegalStateException.class);
    }
}
