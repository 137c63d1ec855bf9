package com.sarkariexams.backend.modules.audit.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.sarkariexams.backend.modules.audit.domain.AuditLog;

public record AuditLogResponse(
        UUID id,
        String action,
        String resourceType,
        String resourceKey,
        UUID announcementId,
        UUID userId,
        String note,
        String correlationId,
        Map<String, Object> metadata,
        OffsetDateTime createdAt
) {

    public static AuditLogResponse from(AuditLog log) {
        return new AuditLogResponse(
                log.getId(),
                log.getAction(),
                log.getResourceType(),
                log.getResourceKey(),
                log.getAnnouncementId(),
                log.getUserId(),
                log.getNote(),
                log.getCorrelationId(),
                log.getMetadata() == null ? Map.of() : log.getMetadata(),
                log.getCreatedAt()
        );
    }
}
