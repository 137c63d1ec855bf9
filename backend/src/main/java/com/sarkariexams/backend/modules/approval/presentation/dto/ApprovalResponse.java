package com.sarkariexams.backend.modules.approval.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.sarkariexams.backend.modules.approval.domain.ApprovalRequest;

public record ApprovalResponse(
        UUID id,
        String action,
        String actionClass,
        String targetKey,
        String status,
        UUID requestedBy,
        UUID reviewedBy,
        UUID executedBy,
        String method,
        String endpoint,
        String note,
        String reviewNote,
        Map<String, Object> payload,
        OffsetDateTime createdAt,
        OffsetDateTime expiresAt,
        OffsetDateTime decidedAt,
        OffsetDateTime executedAt
) {

    public static ApprovalResponse from(ApprovalRequest request) {
        return new ApprovalResponse(
                request.getId(),
                request.getActionType(),
                request.getActionClass(),
                request.getTargetKey(),
                request.getStatus().code(),
                request.getRequesterUserId(),
                request.getReviewerUserId(),
                request.getExecutedByUserId(),
                request.getMethod(),
                request.getEndpoint(),
                request.getNote(),
                request.getReviewNote(),
                request.getPayload(),
                request.getCreatedAt(),
                request.getExpiresAt(),
                request.getDecidedAt(),
                request.getExecutedAt()
        );
    }
}
