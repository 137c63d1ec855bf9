package com.sarkariexams.backend.modules.audit.infrastructure;

import java.util.UUID;

import com.sarkariexams.backend.modules.audit.domain.AuditLog;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AuditLogRepository extends JpaRepository<AuditLog, UUID> {

    @Query("""
            select a
              from AuditLog a
             where (:announcementId is null or a.announcementId = :announcementId)
               and (:action is null or a.action = :action)
             order by a.createdAt desc
            """)
    Page<AuditLog> search(@Param("announcementId") UUID announcementId,
                          @Param("action") String action,
                          Pageable pageable);
}
