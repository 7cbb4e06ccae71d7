package com.storefront.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.storefront.backend.modules.auth.domain.UserSession;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserSessionRepository extends JpaRepository<UserSession, UUID> {

    @Query("select us from UserSession us join fetch us.user where us.refreshTokenHash = :refreshTokenHash")
    Optional<UserSession> findByRefreshTokenHash(@Param("refreshTokenHash") String refreshTokenHash);

    /**
     * Revokes one live session. Returns 0 when another request revoked it first.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update UserSession us
               set us.revokedAt = :revokedAt,
                   us.revokedReason = :reason
             where us.id = :sessionId
               and us.revokedAt is null
            """)
    int revokeIfActive(@Param("sessionId") UUID sessionId,
                       @Param("revokedAt") OffsetDateTime revokedAt,
                       @Param("reason") String reason);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update UserSession us
               set us.revokedAt = :now,
                   us.revokedReason = :reason
             where us.user.id = :userId
               and us.revokedAt is null
               and us.expiresAt <= :now
            """)
    int revokeExpiredSessions(@Param("userId") UUID userId,
                              @Param("now") OffsetDateTime now,
                              @Param("reason") String reason);
}
