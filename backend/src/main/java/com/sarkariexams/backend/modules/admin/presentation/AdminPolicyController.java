package com.sarkariexams.backend.modules.admin.presentation;

import com.sarkariexams.backend.global.security.ActorContext;
import com.sarkariexams.backend.global.security.SecurityUtils;
import com.sarkariexams.backend.global.web.DataResponse;
import com.sarkariexams.backend.modules.admin.application.AdminActionGuard;
import com.sarkariexams.backend.modules.admin.application.AdminPolicyService;
import com.sarkariexams.backend.modules.admin.application.GuardedResult;
import com.sarkariexams.backend.modules.admin.domain.GuardedAction;
import com.sarkariexams.backend.modules.admin.presentation.dto.PolicyResponse;
import com.sarkariexams.backend.modules.admin.presentation.dto.UpdatePolicyRequest;
import com.sarkariexams.backend.modules.audit.application.AuditLogService;
import com.sarkariexams.backend.modules.audit.application.AuditLogService.AuditEntry;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/policies")
@Tag(name = "Admin policies", description = "Runtime security policy")
public class AdminPolicyController {

    private final AdminPolicyService adminPolicyService;
    private final AdminActionGuard adminActionGuard;
    private final AuditLogService auditLogService;

    public AdminPolicyController(
            AdminPolicyService adminPolicyService,
            AdminActionGuard adminActionGuard,
            AuditLogService auditLogService
    ) {
        this.adminPolicyService = adminPolicyService;
        this.adminActionGuard = adminActionGuard;
        this.auditLogService = auditLogService;
    }

    @GetMapping
    @Operation(summary = "Effective security policy")
    public ResponseEntity<DataResponse<PolicyResponse>> getPolicy() {
        return ResponseEntity.ok(DataResponse.of(PolicyResponse.from(adminPolicyService.current())));
    }

    @PutMapping
    @Operation(summary = "Replace the security policy", description = "Admin only; requires a step-up token")
    public ResponseEntity<?> updatePolicy(@Valid @RequestBody UpdatePolicyRequest request, HttpServletRequest http) {
        ActorContext actor = SecurityUtils.currentActor();
        GuardedResult<PolicyResponse> result = adminActionGuard.run(
                GuardedRequests.gateRequest(http, actor, GuardedAction.UPDATE_POLICIES, "policy:security", null,
                        request.toPayload(), null),
                PolicyResponse.class,
                execution -> {
                    PolicyResponse updated = PolicyResponse.from(
                            adminPolicyService.update(request.toCommand(), actor.userId()));
                    auditLogService.record(new AuditEntry("update_policies", "admin_policy", "security", null,
                            actor.userId(), null, execution.auditMetadataWith(request.toPayload())));
                    return updated;
                }
        );
        return GuardedRequests.toResponse(result, HttpStatus.OK);
    }
}
