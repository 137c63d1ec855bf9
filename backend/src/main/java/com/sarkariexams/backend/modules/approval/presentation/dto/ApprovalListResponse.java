package com.sarkariexams.backend.modules.approval.presentation.dto;

import java.util.List;

public record ApprovalListResponse(List<ApprovalResponse> data, Meta meta) {

    public record Meta(long total, int limit, int offset) {
    }
}
