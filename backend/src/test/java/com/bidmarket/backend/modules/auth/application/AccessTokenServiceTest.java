package com.bidmarket.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;

import com.bidmarket.backend.modules.auth.domain.AccessTokenClaims;
import com.bidmarket.backend.modules.auth.domain.Role;
import com.bidmarket.backend.modules.auth.domain.UserAccount;
import com.bidmarket.backend.modules.auth.infrastructure.jwt.JwtSigningKeyProvider;
import com.bidmarket.backend.support.MutableClock;
import com.bidmarket.backend.support.TestUsers;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AccessTokenServiceTest {

    private static final String SECRET = "test-secret-for-access-tokens-0123456789";
    private static final String ISSUER = "bidmarket-api";
    private static final Duration TTL = Duration.ofMinutes(15);

    private MutableClock clock;
    private JwtSigningKeyProvider keyProvider;
    private AccessTokenService service;
    private UserAccount user;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        keyProvider = new JwtSigningKeyProvider(SECRET);
        service = new AccessTokenService(keyProvider, ISSUER, TTL, clock);
        user = TestUsers.user("buyer@example.com", "unused", Role.CONTRACTOR);
    }

    @Test
    @DisplayName("issued token round-trips subject, email and role")
    void issueAndVerify() {
        IssuedAccessToken issued = service.issue(user);

        AccessTokenClaims claims = service.verify(issued.token()).orElseThrow();
        assertThat(claims.subject()).isEqualTo(user.getId());
        assertThat(claims.email()).isEqualTo("buyer@example.com");
        assertThat(claims.role()).isEqualTo("CONTRACTOR");
        assertThat(claims.issuer()).isEqualTo(ISSUER);
        assertThat(claims.issuedAt()).isEqualTo(clock.instant());
    }

    @Test
    void expiryIsIssueTimePlusTtl() {
        IssuedAccessToken issued = service.issue(user);

        assertThat(issued.expiresAt()).isEqualTo(clock.instant().plus(TTL));
        assertThat(service.verify(issued.token()).orElseThrow().expiresAt()).isEqualTo(issued.expiresAt());
    }

    @Test
    void expiredTokenIsReportedAsExpired() {
        IssuedAccessToken issued = service.issue(user);

        clock.advance(TTL.plusSeconds(1));

        AccessTokenVerification verification = service.inspect(issued.token());
        assertThat(verification.status()).isEqualTo(AccessTokenVerification.Status.EXPIRED);
        assertThat(verification.claims()).isNull();
        assertThat(service.verify(issued.token())).isEmpty();
    }

    @Test
    void tokenFromAnotherIssuerIsInvalid() {
        AccessTokenService foreign = new AccessTokenService(keyProvider, "someone-else", TTL, clock);

        String token = foreign.issue(user).token();

        assertThat(service.inspect(token).status()).isEqualTo(AccessTokenVerification.Status.INVALID);
    }

    @Test
    void tokenSignedWithAnotherKeyIsInvalid() {
        AccessTokenService foreign = new AccessTokenService(
                new JwtSigningKeyProvider("another-secret-for-access-tokens-9876543210"), ISSUER, TTL, clock);

        String token = foreign.issue(user).token();

        assertThat(service.inspect(token).status()).isEqualTo(AccessTokenVerification.Status.INVALID);
    }

    @Test
    void tamperedOrGarbageTokensAreInvalid() {
        String token = service.issue(user).token();
        String[] parts = token.split("\\.");
        String tampered = parts[0] + "." + parts[1] + "x." + parts[2];

        assertThat(service.inspect(tampered).status()).isEqualTo(AccessTokenVerification.Status.INVALID);
        assertThat(service.inspect("not-a-jwt").status()).isEqualTo(AccessTokenVerification.Status.INVALID);
        assertThat(service.inspect("").status()).isEqualTo(AccessTokenVerification.Status.INVALID);
        assertThat(service.inspect(null).status()).isEqualTo(AccessTokenVerification.Status.INVALID);
    }
}
