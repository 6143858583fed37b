package com.bidmarket.backend.modules.auth.domain;

/**
 * What to revoke when a rotated-out refresh token is presented again.
 */
public enum ReusePolicy {
    /** Only the session whose previous selector matched. */
    REVOKE_SESSION,
    /** Every session of the owning user. */
    REVOKE_ALL_USER_SESSIONS
}
