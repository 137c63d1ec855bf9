package com.sarkariexams.backend.modules.stepup.infrastructure;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

import com.sarkariexams.backend.modules.stepup.domain.StepUpGrant;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface StepUpGrantRepository extends JpaRepository<StepUpGrant, UUID> {

    Optional<StepUpGrant> findByTokenHash(String tokenHash);

    @Modifying
    @Query("""
            update StepUpGrant g
               set g.consumedAt = :now
             where g.id = :id
               and g.consumedAt is null
               and g.revokedAt is null
               and g.expiresAt > :now
            """)
    int consume(@Param("id") UUID id, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            update StepUpGrant g
               set g.revokedAt = :now
             where g.sessionId in :sessionIds
               and g.revokedAt is null
            """)
    int revokeBySessionIds(@Param("sessionIds") Collection<UUID> sessionIds, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("delete from StepUpGrant g where g.expiresAt < :cutoff")
    int deleteExpiredBefore(@Param("cutoff") OffsetDateTime cutoff);
}
