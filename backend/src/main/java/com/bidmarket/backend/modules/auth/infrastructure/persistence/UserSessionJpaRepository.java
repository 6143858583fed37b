package com.bidmarket.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserSessionJpaRepository extends JpaRepository<UserSessionEntity, UUID> {

    Optional<UserSessionEntity> findByTokenSelector(String tokenSelector);

    Optional<UserSessionEntity> findFirstByPreviousSelector(String previousSelector);

    boolean existsByTokenSelector(String tokenSelector);

    @Query("""
            select us
              from UserSessionEntity us
             where us.userId = :userId
               and us.expiresAt > :now
             order by us.createdAt asc, us.id asc
            """)
    List<UserSessionEntity> findActiveByUserId(@Param("userId") UUID userId, @Param("now") OffsetDateTime now);

    /**
     * Conditional rotation; matches zero rows when the selector moved on since it was read.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update UserSessionEntity us
               set us.tokenSelector = :newSelector,
                   us.tokenVerifierHash = :newVerifierHash,
                   us.previousSelector = :expectedSelector,
                   us.lastRotatedAt = :rotatedAt,
                   us.expiresAt = :expiresAt
             where us.id = :id
               and us.tokenSelector = :expectedSelector
            """)
    int rotate(@Param("id") UUID id,
               @Param("expectedSelector") String expectedSelector,
               @Param("newSelector") String newSelector,
               @Param("newVerifierHash") String newVerifierHash,
               @Param("rotatedAt") OffsetDateTime rotatedAt,
               @Param("expiresAt") OffsetDateTime expiresAt);

    @Modifying(clearAutomatically = true)
    @Query("delete from UserSessionEntity us where us.id = :id")
    int deleteSession(@Param("id") UUID id);

    @Modifying(clearAutomatically = true)
    @Query("delete from UserSessionEntity us where us.userId = :userId")
    int deleteAllByUserId(@Param("userId") UUID userId);

    @Modifying(clearAutomatically = true)
    @Query("delete from UserSessionEntity us where us.userId = :userId and us.id <> :keepSessionId")
    int deleteAllByUserIdExcept(@Param("userId") UUID userId, @Param("keepSessionId") UUID keepSessionId);

    @Modifying(clearAutomatically = true)
    @Query("delete from UserSessionEntity us where us.expiresAt <= :now")
    int deleteExpired(@Param("now") OffsetDateTime now);
}
