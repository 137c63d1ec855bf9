package com.sarkariexams.backend.modules.announcement.presentation.dto;

import jakarta.validation.constraints.Size;

public record AnnouncementNoteRequest(@Size(max = 1000) String note) {

    public String trimmedNote() {
        return note == null || note.isBlank() ? null : note.trim();
    }
}
