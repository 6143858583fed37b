package com.bidmarket.backend.support;

import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.bidmarket.backend.modules.auth.application.SelectorCollisionException;
import com.bidmarket.backend.modules.auth.application.SessionRepository;
import com.bidmarket.backend.modules.auth.domain.Session;

/**
 * Map-backed {@link SessionRepository} for unit tests. Every method holds the instance lock, which
 * gives the same all-or-nothing rotation the database update provides.
 */
public class InMemorySessionRepository implements SessionRepository {

    private final Map<UUID, Session> sessions = new LinkedHashMap<>();

    @Override
    public synchronized void insert(Session session) {
        if (selectorInUse(session.tokenSelector())) {
            throw new SelectorCollisionException(session.tokenSelector());
        }
        sessions.put(session.id(), session);
    }

    @Override
    public synchronized Optional<Session> findById(UUID sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public synchronized Optional<Session> findBySelector(String selector) {
        return sessions.values().stream()
                .filter(session -> session.tokenSelector().equals(selector))
                .findFirst();
    }

    @Override
    public synchronized Optional<Session> findByPreviousSelector(String selector) {
        return sessions.values().stream()
                .filter(session -> selector.equals(session.previousSelector()))
                .findFirst();
    }

    @Override
    public synchronized boolean compareAndRotate(UUID sessionId, String expectedSelector, Session rotated) {
        Session stored = sessions.get(sessionId);
        if (stored == null || !stored.tokenSelector().equals(expectedSelector)) {
            return false;
        }
        if (selectorInUse(rotated.tokenSelector())) {
            throw new SelectorCollisionException(rotated.tokenSelector());
        }
        sessions.put(sessionId, rotated);
        return true;
    }

    @Override
    public synchronized boolean deleteById(UUID sessionId) {
        return sessions.remove(sessionId) != null;
    }

    @Override
    public synchronized int deleteByUserId(UUID userId) {
        int before = sessions.size();
        sessions.values().removeIf(session -> session.userId().equals(userId));
        return before - sessions.size();
    }

    @Override
    public synchronized int deleteByUserIdExcept(UUID userId, UUID keepSessionId) {
        int before = sessions.size();
        sessions.values().removeIf(session -> session.userId().equals(userId) && !session.id().equals(keepSessionId));
        return before - sessions.size();
    }

    @Override
    public synchronized List<Session> findActiveByUserId(UUID userId, OffsetDateTime now) {
        return sessions.values().stream()
                .filter(session -> session.userId().equals(userId))
                .filter(session -> !session.isExpiredAt(now))
                .sorted(Comparator.comparing(Session::createdAt))
                .toList();
    }

    @Override
    public synchronized int deleteExpired(OffsetDateTime now) {
        int before = sessions.size();
        sessions.values().removeIf(session -> session.isExpiredAt(now));
        return before - sessions.size();
    }

    public synchronized int size() {
        return sessions.size();
    }

    private boolean selectorInUse(String selector) {
        return sessions.values().stream().anyMatch(session -> session.tokenSelector().equals(selector));
    }
}
