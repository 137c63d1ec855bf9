package com.sarkariexams.backend.modules.audit.presentation;

import java.util.UUID;

import com.sarkariexams.backend.global.web.Paging;
import com.sarkariexams.backend.modules.audit.application.AuditLogService;
import com.sarkariexams.backend.modules.audit.domain.AuditLog;
import com.sarkariexams.backend.modules.audit.presentation.dto.AuditLogListResponse;
import com.sarkariexams.backend.modules.audit.presentation.dto.AuditLogResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Audit", description = "Admin audit trail")
public class AuditController {

    private final AuditLogService auditLogService;

    public AuditController(AuditLogService auditLogService) {
        this.auditLogService = auditLogService;
    }

    @GetMapping("/admin/audit")
    @Operation(summary = "List audit entries, newest first")
    public ResponseEntity<AuditLogListResponse> list(
            @RequestParam(name = "announcementId", required = false) UUID announcementId,
            @RequestParam(name = "action", required = false) String action,
            @RequestParam(name = "limit", required = false) Integer limit,
            @RequestParam(name = "offset", required = false) Integer offset
    ) {
        PageRequest pageable = Paging.of(limit, offset);
        Page<AuditLog> page = auditLogService.search(announcementId, action, pageable);
        return ResponseEntity.ok(new AuditLogListResponse(
                page.getContent().stream().map(AuditLogResponse::from).toList(),
                new AuditLogListResponse.Meta(page.getTotalElements(), pageable.getPageSize(), (int) pageable.getOffset())
        ));
    }
}
