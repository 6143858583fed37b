package com.bidmarket.backend.modules.auth.application;

import com.bidmarket.backend.modules.auth.domain.Session;

/**
 * Result of presenting a refresh token to {@link SessionStore#validateAndConsume(String)}.
 */
public sealed interface SessionValidation {

    /** The token matches the session's current selector and verifier. */
    record Valid(Session session) implements SessionValidation {
    }

    /**
     * The selector was rotated out of {@code session}. Revocation per the configured policy has
     * already happened when this is returned.
     */
    record ReuseDetected(Session session, int revokedCount) implements SessionValidation {
    }

    /** Ordinary failure; {@code reason} is one of the refresh-token rejection kinds. */
    record Rejected(AuthFailure reason) implements SessionValidation {
    }
}
