package com.sarkariexams.backend.modules.approval.presentation.dto;

import jakarta.validation.constraints.Size;

public record ApprovalDecisionRequest(
        @Size(max = 1000) String note,
        @Size(max = 1000) String reason
) {

    public String effectiveNote() {
        if (reason != null && !reason.isBlank()) {
            return reason.trim();
        }
        return note == null || note.isBlank() ? null : note.trim();
    }
}
