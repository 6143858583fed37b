package com.bidmarket.backend.modules.auth.application;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

import com.bidmarket.backend.global.error.ProblemException;
import com.bidmarket.backend.global.error.RetryableProblemException;

/**
 * Outcome of an authentication operation: a value or a tagged {@link AuthFailure}.
 */
public sealed interface AuthResult<T> {

    record Success<T>(T value) implements AuthResult<T> {
        public Success {
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * @param retryAfter set only for {@link AuthFailure#RATE_LIMITED}
     */
    record Failure<T>(AuthFailure reason, Duration retryAfter) implements AuthResult<T> {
        public Failure {
            Objects.requireNonNull(reason, "reason");
        }
    }

    static <T> AuthResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> AuthResult<T> failure(AuthFailure reason) {
        return new Failure<>(reason, null);
    }

    static <T> AuthResult<T> rateLimited(Duration retryAfter) {
        return new Failure<>(AuthFailure.RATE_LIMITED, retryAfter);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default Optional<T> toOptional() {
        return this instanceof Success<T> success ? Optional.of(success.value()) : Optional.empty();
    }

    default Optional<AuthFailure> failureReason() {
        return this instanceof Failure<T> failure ? Optional.of(failure.reason()) : Optional.empty();
    }

    default <U> AuthResult<U> map(Function<? super T, ? extends U> mapper) {
        if (this instanceof Success<T> success) {
            return new Success<>(mapper.apply(success.value()));
        }
        Failure<T> failure = (Failure<T>) this;
        return new Failure<>(failure.reason(), failure.retryAfter());
    }

    /**
     * Unwraps the value or throws the problem exception the route layer renders.
     */
    default T orElseThrow() {
        if (this instanceof Success<T> success) {
            return success.value();
        }
        Failure<T> failure = (Failure<T>) this;
        if (failure.retryAfter() != null) {
            throw new RetryableProblemException(failure.reason(), failure.retryAfter());
        }
        throw new ProblemException(failure.reason());
    }
}
