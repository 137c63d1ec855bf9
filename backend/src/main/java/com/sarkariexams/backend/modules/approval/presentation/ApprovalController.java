package com.sarkariexams.backend.modules.approval.presentation;

import java.util.Locale;
import java.util.UUID;

import com.sarkariexams.backend.global.error.ErrorCodes;
import com.sarkariexams.backend.global.error.ProblemException;
import com.sarkariexams.backend.global.security.ActorContext;
import com.sarkariexams.backend.global.security.SecurityUtils;
import com.sarkariexams.backend.global.web.Paging;
import com.sarkariexams.backend.modules.admin.application.AdminActionGuard;
import com.sarkariexams.backend.modules.admin.application.GuardedResult;
import com.sarkariexams.backend.modules.admin.domain.GuardedAction;
import com.sarkariexams.backend.modules.admin.presentation.GuardedRequests;
import com.sarkariexams.backend.modules.approval.application.ApprovalLedgerService;
import com.sarkariexams.backend.modules.approval.domain.ApprovalOutcome;
import com.sarkariexams.backend.modules.approval.domain.ApprovalRequest;
import com.sarkariexams.backend.modules.approval.domain.ApprovalStatus;
import com.sarkariexams.backend.modules.approval.presentation.dto.ApprovalDecisionRequest;
import com.sarkariexams.backend.modules.approval.presentation.dto.ApprovalListResponse;
import com.sarkariexams.backend.modules.approval.presentation.dto.ApprovalResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/approvals")
@Tag(name = "Approvals", description = "Dual-approval review queue")
public class ApprovalController {

    private final ApprovalLedgerService approvalLedgerService;
    private final AdminActionGuard adminActionGuard;

    public ApprovalController(ApprovalLedgerService approvalLedgerService, AdminActionGuard adminActionGuard) {
        this.approvalLedgerService = approvalLedgerService;
        this.adminActionGuard = adminActionGuard;
    }

    @GetMapping
    @Operation(summary = "List approval requests, newest first")
    public ResponseEntity<ApprovalListResponse> list(
            @RequestParam(name = "status", required = false, defaultValue = "pending") String status,
            @RequestParam(name = "limit", required = false) Integer limit,
            @RequestParam(name = "offset", required = false) Integer offset
    ) {
        PageRequest pageable = Paging.of(limit, offset);
        Page<ApprovalRequest> page = approvalLedgerService.list(parseStatus(status), pageable);
        return ResponseEntity.ok(new ApprovalListResponse(
                page.getContent().stream().map(ApprovalResponse::from).toList(),
                new ApprovalListResponse.Meta(page.getTotalElements(), pageable.getPageSize(),
                        (int) pageable.getOffset())
        ));
    }

    @PostMapping("/{approvalId}/approve")
    @Operation(summary = "Approve a pending request", description = "Reviewer must differ from the requester")
    public ResponseEntity<?> approve(
            @PathVariable UUID approvalId,
            @Valid @RequestBody(required = false) ApprovalDecisionRequest request,
            HttpServletRequest http
    ) {
        return decide(approvalId, ApprovalOutcome.APPROVE, request, http);
    }

    @PostMapping("/{approvalId}/reject")
    @Operation(summary = "Reject a pending request")
    public ResponseEntity<?> reject(
            @PathVariable UUID approvalId,
            @Valid @RequestBody(required = false) ApprovalDecisionRequest request,
            HttpServletRequest http
    ) {
        return decide(approvalId, ApprovalOutcome.REJECT, request, http);
    }

    private ResponseEntity<?> decide(UUID approvalId, ApprovalOutcome outcome, ApprovalDecisionRequest request,
                                     HttpServletRequest http) {
        ActorContext actor = SecurityUtils.currentActor();
        String note = request == null ? null : request.effectiveNote();
        GuardedResult<ApprovalResponse> result = adminActionGuard.run(
                GuardedRequests.gateRequest(http, actor, GuardedAction.DECIDE_APPROVAL,
                        "approval:" + approvalId, null, null, note),
                ApprovalResponse.class,
                execution -> ApprovalResponse.from(
                        approvalLedgerService.decide(approvalId, actor.userId(), outcome, note))
        );
        return GuardedRequests.toResponse(result, HttpStatus.OK);
    }

    private static ApprovalStatus parseStatus(String raw) {
        if (raw == null || raw.isBlank() || "all".equalsIgnoreCase(raw.trim())) {
            return null;
        }
        try {
            return ApprovalStatus.fromCode(raw.toLowerCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, ErrorCodes.VALIDATION_ERROR,
                    "Unknown approval status: " + raw);
        }
    }
}
