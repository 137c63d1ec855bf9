package com.sarkariexams.backend.modules.auth.presentation;

import java.util.List;
import java.util.Map;

import com.sarkariexams.backend.global.security.ActorContext;
import com.sarkariexams.backend.global.security.SecurityUtils;
import com.sarkariexams.backend.modules.admin.application.AdminActionGuard;
import com.sarkariexams.backend.modules.admin.application.GuardedResult;
import com.sarkariexams.backend.modules.admin.domain.GuardedAction;
import com.sarkariexams.backend.modules.admin.presentation.GuardedRequests;
import com.sarkariexams.backend.modules.audit.application.AuditLogService;
import com.sarkariexams.backend.modules.audit.application.AuditLogService.AuditEntry;
import com.sarkariexams.backend.modules.auth.application.AdminSessionService;
import com.sarkariexams.backend.modules.auth.application.AdminSessionService.SessionView;
import com.sarkariexams.backend.modules.auth.presentation.dto.SessionListResponse;
import com.sarkariexams.backend.modules.auth.presentation.dto.TerminateSessionRequest;
import com.sarkariexams.backend.modules.auth.presentation.dto.TerminateSessionsResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/sessions")
@Tag(name = "Admin sessions", description = "Caller's active sessions")
public class AdminSessionController {

    private final AdminSessionService adminSessionService;
    private final AdminActionGuard adminActionGuard;
    private final AuditLogService auditLogService;

    public AdminSessionController(
            AdminSessionService adminSessionService,
            AdminActionGuard adminActionGuard,
            AuditLogService auditLogService
    ) {
        this.adminSessionService = adminSessionService;
        this.adminActionGuard = adminActionGuard;
        this.auditLogService = auditLogService;
    }

    @GetMapping
    @Operation(summary = "List the caller's active sessions")
    public ResponseEntity<SessionListResponse> list() {
        List<SessionView> sessions = adminSessionService.listActive(SecurityUtils.currentActor());
        return ResponseEntity.ok(new SessionListResponse(sessions, new SessionListResponse.Meta(sessions.size())));
    }

    @PostMapping("/terminate")
    @Operation(summary = "Terminate one of the caller's other sessions", description = "Requires a step-up token")
    public ResponseEntity<TerminateSessionsResponse> terminate(
            @Valid @RequestBody TerminateSessionRequest request,
            HttpServletRequest http
    ) {
        ActorContext actor = SecurityUtils.currentActor();
        GuardedResult<TerminateSessionsResponse> result = adminActionGuard.run(
                GuardedRequests.gateRequest(http, actor, GuardedAction.TERMINATE_SESSIONS,
                        "session:" + request.sessionId(), null, Map.of("sessionId", request.sessionId().toString()), null),
                TerminateSessionsResponse.class,
                execution -> {
                    adminSessionService.terminate(actor, request.sessionId());
                    auditLogService.record(new AuditEntry("terminate_session", "admin_session",
                            request.sessionId().toString(), null, actor.userId(), null,
                            execution.auditMetadataWith(Map.of())));
                    return new TerminateSessionsResponse(true, null);
                }
        );
        return ResponseEntity.ok(result.data());
    }

    @PostMapping("/terminate-others")
    @Operation(summary = "Terminate every other session of the caller", description = "Requires a step-up token")
    public ResponseEntity<TerminateSessionsResponse> terminateOthers(HttpServletRequest http) {
        ActorContext actor = SecurityUtils.currentActor();
        GuardedResult<TerminateSessionsResponse> result = adminActionGuard.run(
                GuardedRequests.gateRequest(http, actor, GuardedAction.TERMINATE_SESSIONS,
                        "sessions:" + actor.userId(), null, null, null),
                TerminateSessionsResponse.class,
                execution -> {
                    int removed = adminSessionService.terminateOthers(actor);
                    auditLogService.record(new AuditEntry("terminate_other_sessions", "admin_session",
                            actor.sessionId().toString(), null, actor.userId(), null,
                            execution.auditMetadataWith(Map.of("removed", removed))));
                    return new TerminateSessionsResponse(true, removed);
                }
        );
        return ResponseEntity.ok(result.data());
    }
}
