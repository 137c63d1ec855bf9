package com.sarkariexams.backend.modules.audit.application;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.sarkariexams.backend.global.web.RequestIdFilter;
import com.sarkariexams.backend.modules.audit.domain.AuditLog;
import com.sarkariexams.backend.modules.audit.infrastructure.AuditLogRepository;

import org.slf4j.MDC;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AuditLogService {

    private static final String REQUEST_ID_MDC_KEY = RequestIdFilter.REQUEST_ID_MDC_KEY;

    private final AuditLogRepository auditLogRepository;

    public AuditLogService(AuditLogRepository auditLogRepository) {
        this.auditLogRepository = auditLogRepository;
    }

    /**
     * Appends within the caller's transaction, so the entry commits or rolls back with the
     * mutation it describes.
     */
    @Transactional
    public AuditLog record(AuditEntry entry) {
        return auditLogRepository.save(toEntity(entry));
    }

    /**
     * Appends in its own transaction. Used for denials, which must survive the failing request.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public AuditLog recordDetached(AuditEntry entry) {
        return auditLogRepository.save(toEntity(entry));
    }

    @Transactional(readOnly = true)
    public Page<AuditLog> search(UUID announcementId, String action, Pageable pageable) {
        String normalizedAction = action == null || action.isBlank() ? null : action.trim();
        return auditLogRepository.search(announcementId, normalizedAction, pageable);
    }

    private AuditLog toEntity(AuditEntry entry) {
        Objects.requireNonNull(entry.action(), "action is required");
        Objects.requireNonNull(entry.resourceType(), "resourceType is required");

        AuditLog auditLog = new AuditLog();
        auditLog.setAction(entry.action());
        auditLog.setResourceType(entry.resourceType());
        auditLog.setResourceKey(entry.resourceKey());
        auditLog.setAnnouncementId(entry.announcementId());
        auditLog.setUserId(entry.userId());
        auditLog.setNote(entry.note());
        auditLog.setCorrelationId(MDC.get(REQUEST_ID_MDC_KEY));
        if (entry.metadata() != null && !entry.metadata().isEmpty()) {
            auditLog.setMetadata(new LinkedHashMap<>(entry.metadata()));
        }
        return auditLog;
    }

    public record AuditEntry(
            String action,
            String resourceType,
            String resourceKey,
            UUID announcementId,
            UUID userId,
            String note,
            Map<String, Object> metadata
    ) {
    }
}
