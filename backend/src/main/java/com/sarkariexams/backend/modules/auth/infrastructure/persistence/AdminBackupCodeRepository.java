package com.sarkariexams.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.sarkariexams.backend.modules.auth.domain.AdminBackupCode;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AdminBackupCodeRepository extends JpaRepository<AdminBackupCode, UUID> {

    // 0 when the code is unknown or already spent
    @Modifying
    @Query("""
            update AdminBackupCode bc
               set bc.usedAt = :usedAt
             where bc.adminUser.id = :userId
               and bc.codeHash = :codeHash
               and bc.usedAt is null
            """)
    int consume(@Param("userId") UUID userId,
                @Param("codeHash") String codeHash,
                @Param("usedAt") OffsetDateTime usedAt);
}
