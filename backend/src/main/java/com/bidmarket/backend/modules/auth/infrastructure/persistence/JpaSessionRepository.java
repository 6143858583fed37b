package com.bidmarket.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.bidmarket.backend.modules.auth.application.SelectorCollisionException;
import com.bidmarket.backend.modules.auth.application.SessionRepository;
import com.bidmarket.backend.modules.auth.domain.Session;

import jakarta.persistence.EntityManager;

import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * PostgreSQL-backed sessions. {@code token_selector} carries a unique constraint, so a collision
 * that slips past the existence check still fails rather than overwriting.
 */
@Repository
@Transactional
public class JpaSessionRepository implements SessionRepository {

    private final UserSessionJpaRepository jpaRepository;
    private final EntityManager entityManager;

    public JpaSessionRepository(UserSessionJpaRepository jpaRepository, EntityManager entityManager) {
        this.jpaRepository = jpaRepository;
        this.entityManager = entityManager;
    }

    @Override
    public void insert(Session session) {
        if (jpaRepository.existsByTokenSelector(session.tokenSelector())) {
            throw new SelectorCollisionException(session.tokenSelector());
        }
        entityManager.persist(UserSessionEntity.from(session));
        entityManager.flush();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Session> findById(UUID sessionId) {
        return jpaRepository.findById(sessionId).map(UserSessionEntity::toSession);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Session> findBySelector(String selector) {
        return jpaRepository.findByTokenSelector(selector).map(UserSessionEntity::toSession);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Session> findByPreviousSelector(String selector) {
        return jpaRepository.findFirstByPreviousSelector(selector).map(UserSessionEntity::toSession);
    }

    @Override
    public boolean compareAndRotate(UUID sessionId, String expectedSelector, Session rotated) {
        if (jpaRepository.existsByTokenSelector(rotated.tokenSelector())) {
            throw new SelectorCollisionException(rotated.tokenSelector());
        }
        int updated = jpaRepository.rotate(
                sessionId,
                expectedSelector,
                rotated.tokenSelector(),
                rotated.tokenVerifierHash(),
                rotated.lastRotatedAt(),
                rotated.expiresAt()
        );
        return updated == 1;
    }

    @Override
    public boolean deleteById(UUID sessionId) {
        return jpaRepository.deleteSession(sessionId) > 0;
    }

    @Override
    public int deleteByUserId(UUID userId) {
        return jpaRepository.deleteAllByUserId(userId);
    }

    @Override
    public int deleteByUserIdExcept(UUID userId, UUID keepSessionId) {
        return jpaRepository.deleteAllByUserIdExcept(userId, keepSessionId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Session> findActiveByUserId(UUID userId, OffsetDateTime now) {
        return jpaRepository.findActiveByUserId(userId, now).stream()
                .map(UserSessionEntity::toSession)
                .toList();
    }

    @Override
    public int deleteExpired(OffsetDateTime now) {
        return jpaRepository.deleteExpired(now);
    }
}
