package com.bidmarket.backend.global.error;

/**
 * RFC 7807 body. {@code retryAfterSeconds} is null unless the problem is retryable.
 */
public record ProblemResponse(
        String type,
        String title,
        int status,
        String detail,
        String instance,
        String code,
        Long retryAfterSeconds
) {
}
