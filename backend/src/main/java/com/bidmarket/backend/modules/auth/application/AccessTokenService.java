package com.bidmarket.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;

import com.bidmarket.backend.modules.auth.config.AuthProperties;
import com.bidmarket.backend.modules.auth.domain.AccessTokenClaims;
import com.bidmarket.backend.modules.auth.domain.UserAccount;
import com.bidmarket.backend.modules.auth.infrastructure.jwt.JwtSigningKeyProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Issues and verifies short-lived HS256 access tokens. Nothing is stored server side.
 */
@Service
public class AccessTokenService {

    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_ROLE = "role";

    private final JwtSigningKeyProvider keyProvider;
    private final String issuer;
    private final Duration accessTokenTtl;
    private final Clock clock;
    private final JwtParser parser;

    @Autowired
    public AccessTokenService(JwtSigningKeyProvider keyProvider, AuthProperties authProperties, Clock clock) {
        this(keyProvider, authProperties.jwt().issuer(), authProperties.jwt().accessTokenTtl(), clock);
    }

    public AccessTokenService(JwtSigningKeyProvider keyProvider, String issuer, Duration accessTokenTtl, Clock clock) {
        this.keyProvider = keyProvider;
        this.issuer = issuer;
        this.accessTokenTtl = accessTokenTtl;
        this.clock = clock;
        this.parser = Jwts.parser()
                .verifyWith(keyProvider.getSecretKey())
                .requireIssuer(issuer)
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    public IssuedAccessToken issue(UserAccount user) {
        Instant now = clock.instant();
        Instant expiry = now.plus(accessTokenTtl);

        String token = Jwts.builder()
                .subject(user.getId().toString())
                .issuer(issuer)
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry))
                .claim(CLAIM_EMAIL, user.getEmail())
                .claim(CLAIM_ROLE, user.getRole().name())
                .signWith(keyProvider.getSecretKey(), SIG.HS256)
                .compact();

        return new IssuedAccessToken(token, now, expiry);
    }

    /**
     * Returns the claims of a token with a valid signature, the expected issuer and an expiry in the
     * future; empty for anything else.
     */
    public Optional<AccessTokenClaims> verify(String token) {
        AccessTokenVerification verification = inspect(token);
        return Optional.ofNullable(verification.claims());
    }

    public AccessTokenVerification inspect(String token) {
        if (token == null || token.isBlank()) {
            return AccessTokenVerification.invalid();
        }
        try {
            Claims claims = parser.parseSignedClaims(token).getPayload();
            if (claims.getExpiration() == null || claims.getSubject() == null) {
                return AccessTokenVerification.invalid();
            }
            AccessTokenClaims parsed = new AccessTokenClaims(
                    UUID.fromString(claims.getSubject()),
                    claims.get(CLAIM_EMAIL, String.class),
                    claims.get(CLAIM_ROLE, String.class),
                    claims.getIssuer(),
                    claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : null,
                    claims.getExpiration().toInstant()
            );
            return AccessTokenVerification.valid(parsed);
        } catch (ExpiredJwtException ex) {
            return AccessTokenVerification.expired();
        } catch (JwtException | IllegalArgumentException ex) {
            return AccessTokenVerification.invalid();
        }
    }

    public Duration getAccessTokenTtl() {
        return accessTokenTtl;
    }
}
