package com.sarkariexams.backend.modules.audit.presentation.dto;

import java.util.List;

public record AuditLogListResponse(List<AuditLogResponse> data, Meta meta) {

    public record Meta(long total, int limit, int offset) {
    }
}
