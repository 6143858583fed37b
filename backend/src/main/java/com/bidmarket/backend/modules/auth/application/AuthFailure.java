package com.bidmarket.backend.modules.auth.application;

import com.bidmarket.backend.global.error.ErrorCode;

import org.springframework.http.HttpStatus;

/**
 * Every way an authentication operation can fail. Refresh-token lookup failures are distinct here
 * for logging and auditing but share one public code so clients cannot tell them apart.
 */
public enum AuthFailure implements ErrorCode {

    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "AUTH_INVALID_CREDENTIALS", "Invalid email or password"),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, "AUTH_RATE_LIMITED", "Too many attempts, try again later"),
    TOKEN_MALFORMED(HttpStatus.UNAUTHORIZED, PublicCodes.INVALID_REFRESH_TOKEN, PublicCodes.INVALID_REFRESH_DETAIL),
    TOKEN_NOT_FOUND(HttpStatus.UNAUTHORIZED, PublicCodes.INVALID_REFRESH_TOKEN, PublicCodes.INVALID_REFRESH_DETAIL),
    TOKEN_EXPIRED(HttpStatus.UNAUTHORIZED, PublicCodes.INVALID_REFRESH_TOKEN, PublicCodes.INVALID_REFRESH_DETAIL),
    TOKEN_MISMATCH(HttpStatus.UNAUTHORIZED, PublicCodes.INVALID_REFRESH_TOKEN, PublicCodes.INVALID_REFRESH_DETAIL),
    TOKEN_REUSE_DETECTED(HttpStatus.UNAUTHORIZED, "AUTH_TOKEN_REUSED", "Refresh token reuse detected, sessions revoked"),
    ACCESS_TOKEN_INVALID(HttpStatus.UNAUTHORIZED, "AUTH_TOKEN_INVALID", "Access token is invalid"),
    ACCESS_TOKEN_EXPIRED(HttpStatus.UNAUTHORIZED, "AUTH_TOKEN_EXPIRED", "Access token has expired"),
    INSUFFICIENT_ROLE(HttpStatus.FORBIDDEN, "AUTH_FORBIDDEN", "Insufficient role"),
    EMAIL_ALREADY_REGISTERED(HttpStatus.BAD_REQUEST, "AUTH_EMAIL_EXISTS", "Email already registered"),
    WEAK_PASSWORD(HttpStatus.BAD_REQUEST, "AUTH_WEAK_PASSWORD", "Password does not meet the policy"),
    INVALID_ACCOUNT_DETAILS(HttpStatus.BAD_REQUEST, "AUTH_INVALID_ACCOUNT_DETAILS", "Email or name is missing or malformed"),
    USER_NOT_FOUND(HttpStatus.NOT_FOUND, "AUTH_USER_NOT_FOUND", "User not found");

    private final HttpStatus status;
    private final String publicCode;
    private final String publicDetail;

    AuthFailure(HttpStatus status, String publicCode, String publicDetail) {
        this.status = status;
        this.publicCode = publicCode;
        this.publicDetail = publicDetail;
    }

    @Override
    public HttpStatus status() {
        return status;
    }

    @Override
    public String publicCode() {
        return publicCode;
    }

    @Override
    public String publicDetail() {
        return publicDetail;
    }

    public boolean isRefreshTokenRejection() {
        return this == TOKEN_MALFORMED || this == TOKEN_NOT_FOUND || this == TOKEN_EXPIRED || this == TOKEN_MISMATCH;
    }

    private static final class PublicCodes {
        static final String INVALID_REFRESH_TOKEN = "AUTH_INVALID_REFRESH_TOKEN";
        static final String INVALID_REFRESH_DETAIL = "Session has expired or is invalid";
    }
}
