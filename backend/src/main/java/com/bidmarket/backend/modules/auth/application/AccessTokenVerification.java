package com.bidmarket.backend.modules.auth.application;

import com.bidmarket.backend.modules.auth.domain.AccessTokenClaims;

/**
 * Outcome of checking an access token. {@code claims} is set only when {@code status} is VALID.
 */
public record AccessTokenVerification(Status status, AccessTokenClaims claims) {

    public enum Status {
        VALID,
        EXPIRED,
        INVALID
    }

    static AccessTokenVerification valid(AccessTokenClaims claims) {
        return new AccessTokenVerification(Status.VALID, claims);
    }

    static AccessTokenVerification expired() {
        return new AccessTokenVerification(Status.EXPIRED, null);
    }

    static AccessTokenVerification invalid() {
        return new AccessTokenVerification(Status.INVALID, null);
    }
}
