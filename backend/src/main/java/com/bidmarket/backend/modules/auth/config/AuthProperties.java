package com.bidmarket.backend.modules.auth.config;

import java.time.Duration;

import com.bidmarket.backend.modules.auth.domain.ReusePolicy;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings bound from {@code bidmarket.auth.*}.
 */
@Validated
@ConfigurationProperties(prefix = "bidmarket.auth")
public record AuthProperties(
        @Valid @NotNull Jwt jwt,
        @Valid Session session,
        @Valid Password password
) {

    public AuthProperties {
        session = session != null ? session : new Session(null, 0, null, 0, true);
        password = password != null ? password : new Password(0, 0);
    }

    public record Jwt(
            @NotBlank String secret,
            String issuer,
            Duration accessTokenTtl
    ) {
        public Jwt {
            issuer = (issuer == null || issuer.isBlank()) ? "bidmarket-api" : issuer;
            accessTokenTtl = accessTokenTtl != null ? accessTokenTtl : Duration.ofMinutes(15);
        }
    }

    public record Session(
            Duration refreshTokenTtl,
            @Min(0) int maxPerUser,
            ReusePolicy reusePolicy,
            @Min(0) int selectorRetryLimit,
            Boolean resetRateLimitOnLogin
    ) {
        public Session {
            refreshTokenTtl = refreshTokenTtl != null ? refreshTokenTtl : Duration.ofDays(7);
            maxPerUser = maxPerUser > 0 ? maxPerUser : 5;
            reusePolicy = reusePolicy != null ? reusePolicy : ReusePolicy.REVOKE_ALL_USER_SESSIONS;
            selectorRetryLimit = selectorRetryLimit > 0 ? selectorRetryLimit : 3;
            resetRateLimitOnLogin = resetRateLimitOnLogin != null ? resetRateLimitOnLogin : Boolean.TRUE;
        }
    }

    public record Password(
            @Min(0) int bcryptStrength,
            @Min(0) int minLength
    ) {
        public Password {
            bcryptStrength = bcryptStrength > 0 ? bcryptStrength : 10;
            minLength = minLength > 0 ? minLength : 8;
        }
    }
}
