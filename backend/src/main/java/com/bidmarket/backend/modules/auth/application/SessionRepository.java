package com.bidmarket.backend.modules.auth.application;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.bidmarket.backend.modules.auth.domain.Session;

/**
 * Keyed session storage. Implementations index sessions by selector, previous selector and user.
 */
public interface SessionRepository {

    /**
     * @throws SelectorCollisionException when {@code session.tokenSelector()} is already stored
     */
    void insert(Session session);

    Optional<Session> findById(UUID sessionId);

    Optional<Session> findBySelector(String selector);

    Optional<Session> findByPreviousSelector(String selector);

    /**
     * Replaces the session with {@code rotated} only if its stored selector still equals
     * {@code expectedSelector}. Returns false when another rotation or a revoke got there first.
     *
     * @throws SelectorCollisionException when {@code rotated.tokenSelector()} is already stored
     */
    boolean compareAndRotate(UUID sessionId, String expectedSelector, Session rotated);

    boolean deleteById(UUID sessionId);

    int deleteByUserId(UUID userId);

    int deleteByUserIdExcept(UUID userId, UUID keepSessionId);

    /**
     * Sessions of the user that have not expired at {@code now}, oldest first.
     */
    List<Session> findActiveByUserId(UUID userId, OffsetDateTime now);

    int deleteExpired(OffsetDateTime now);
}
