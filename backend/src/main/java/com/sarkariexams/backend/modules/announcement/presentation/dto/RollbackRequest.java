package com.sarkariexams.backend.modules.announcement.presentation.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record RollbackRequest(
        @NotNull @Min(1) Integer version,
        Boolean dryRun,
        @Size(max = 1000) String note
) {

    public boolean isDryRun() {
        return Boolean.TRUE.equals(dryRun);
    }

    public String trimmedNote() {
        return note == null || note.isBlank() ? null : note.trim();
    }
}
