package com.sarkariexams.backend.modules.admin.presentation;

import java.util.Map;
import java.util.UUID;

import com.sarkariexams.backend.global.security.ActorContext;
import com.sarkariexams.backend.global.web.DataResponse;
import com.sarkariexams.backend.modules.admin.application.GateRequest;
import com.sarkariexams.backend.modules.admin.application.GuardedResult;
import com.sarkariexams.backend.modules.admin.domain.GuardedAction;
import com.sarkariexams.backend.modules.admin.domain.RequestIntent;
import com.sarkariexams.backend.modules.admin.presentation.dto.ApprovalRequiredResponse;
import com.sarkariexams.backend.modules.approval.presentation.dto.ApprovalResponse;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Boundary between HTTP and the policy gate: reads the admin headers once and maps guarded
 * results back onto status codes.
 */
public final class GuardedRequests {

    public static final String STEP_UP_TOKEN_HEADER = "X-Admin-Step-Up-Token";
    public static final String APPROVAL_ID_HEADER = "X-Admin-Approval-Id";
    public static final String BREAK_GLASS_REASON_HEADER = "X-Admin-Break-Glass-Reason";

    private GuardedRequests() {
    }

    public static GateRequest gateRequest(
            HttpServletRequest http,
            ActorContext actor,
            GuardedAction action,
            String targetKey,
            UUID announcementId,
            Map<String, Object> payload,
            String note
    ) {
        return new GateRequest(
                actor,
                action,
                targetKey,
                announcementId,
                intentOf(http),
                http.getHeader(STEP_UP_TOKEN_HEADER),
                payload,
                http.getMethod(),
                http.getRequestURI(),
                note
        );
    }

    public static RequestIntent intentOf(HttpServletRequest http) {
        return RequestIntent.fromHeaders(http.getHeader(APPROVAL_ID_HEADER), http.getHeader(BREAK_GLASS_REASON_HEADER));
    }

    public static <T> ResponseEntity<?> toResponse(GuardedResult<T> result, HttpStatus executedStatus) {
        if (result.isQueued()) {
            return ResponseEntity.status(HttpStatus.ACCEPTED)
                    .body(ApprovalRequiredResponse.of(ApprovalResponse.from(result.approval())));
        }
        HttpStatus status = result.approval() != null ? HttpStatus.OK : executedStatus;
        return ResponseEntity.status(status).body(DataResponse.of(result.data()));
    }
}
