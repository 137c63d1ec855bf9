package com.sarkariexams.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.sarkariexams.backend.modules.auth.domain.AdminSession;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AdminSessionRepository extends JpaRepository<AdminSession, UUID> {

    @Query("""
            select s
              from AdminSession s
              join fetch s.adminUser u
             where s.id = :id
            """)
    Optional<AdminSession> findWithUserById(@Param("id") UUID id);

    @Query("""
            select s
              from AdminSession s
             where s.adminUser.id = :userId
               and s.revokedAt is null
               and s.expiresAt > :now
               and s.lastActivityAt > :idleCutoff
             order by s.lastActivityAt desc
            """)
    List<AdminSession> findActiveByUserId(@Param("userId") UUID userId,
                                          @Param("now") OffsetDateTime now,
                                          @Param("idleCutoff") OffsetDateTime idleCutoff);

    @Modifying
    @Query("""
            update AdminSession s
               set s.lastActivityAt = :now
             where s.id = :id
               and s.revokedAt is null
            """)
    int touch(@Param("id") UUID id, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            update AdminSession s
               set s.revokedAt = :revokedAt,
                   s.revokedReason = :reason
             where s.id = :id
               and s.revokedAt is null
            """)
    int revoke(@Param("id") UUID id,
               @Param("revokedAt") OffsetDateTime revokedAt,
               @Param("reason") String reason);

    @Query("""
            select s.id
              from AdminSession s
             where s.adminUser.id = :userId
               and s.id <> :keepSessionId
               and s.revokedAt is null
            """)
    List<UUID> findOtherOpenSessionIds(@Param("userId") UUID userId,
                                       @Param("keepSessionId") UUID keepSessionId);

    @Modifying
    @Query("""
            update AdminSession s
               set s.revokedAt = :revokedAt,
                   s.revokedReason = :reason
             where s.id in :ids
               and s.revokedAt is null
            """)
    int revokeAll(@Param("ids") List<UUID> ids,
                  @Param("revokedAt") OffsetDateTime revokedAt,
                  @Param("reason") String reason);
}
