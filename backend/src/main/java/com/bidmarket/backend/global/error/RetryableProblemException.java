package com.bidmarket.backend.global.error;

import java.time.Duration;

import org.springframework.http.HttpStatus;

/**
 * Problem that the client may retry after a delay, rendered with a {@code Retry-After} header.
 */
public class RetryableProblemException extends ProblemException {

    private final long retryAfterSeconds;

    public RetryableProblemException(ErrorCode errorCode, Duration retryAfter) {
        this(errorCode.status(), errorCode.publicCode(), errorCode.publicDetail(), retryAfter);
    }

    public RetryableProblemException(HttpStatus status, String code, String detail, Duration retryAfter) {
        super(status, code, detail);
        if (retryAfter == null || retryAfter.isNegative()) {
            throw new IllegalArgumentException("retryAfter must be >= 0");
        }
        // Round up so a client never retries a fraction of a second too early
        long seconds = retryAfter.getSeconds();
        this.retryAfterSeconds = retryAfter.getNano() > 0 ? seconds + 1 : seconds;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    @Override
    public ProblemResponse toResponse(String instance) {
        ProblemResponse base = super.toResponse(instance);
        return new ProblemResponse(base.type(), base.title(), base.status(), base.detail(), instance, base.code(),
                retryAfterSeconds);
    }
}
