package com.bidmarket.backend.modules.auth.application;

import java.time.Instant;

public record IssuedAccessToken(String token, Instant issuedAt, Instant expiresAt) {

    @Override
    public String toString() {
        return "IssuedAccessToken[issuedAt=" + issuedAt + ", expiresAt=" + expiresAt + "]";
    }
}
