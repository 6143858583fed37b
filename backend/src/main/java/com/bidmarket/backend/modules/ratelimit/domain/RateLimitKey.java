package com.bidmarket.backend.modules.ratelimit.domain;

import java.util.Objects;

/**
 * Counter key. {@code identity} is a client IP for unauthenticated actions and a user id otherwise.
 */
public record RateLimitKey(RateLimitAction action, String identity) {

    public RateLimitKey {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(identity, "identity");
    }

    public static RateLimitKey of(RateLimitAction action, String identity) {
        return new RateLimitKey(action, identity);
    }
}
