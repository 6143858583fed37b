package com.bidmarket.backend.modules.ratelimit.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class RateLimitEvictionScheduler {

    private static final Logger log = LoggerFactory.getLogger(RateLimitEvictionScheduler.class);

    private final RateLimiter rateLimiter;

    public RateLimitEvictionScheduler(RateLimiter rateLimiter) {
        this.rateLimiter = rateLimiter;
    }

    @Scheduled(fixedDelayString = "${bidmarket.rate-limit.eviction-interval:PT5M}")
    public void evictIdleWindows() {
        int evicted = rateLimiter.evictIdle();
        if (evicted > 0) {
            log.info("Evicted {} idle rate limit windows", evicted);
        }
    }
}
