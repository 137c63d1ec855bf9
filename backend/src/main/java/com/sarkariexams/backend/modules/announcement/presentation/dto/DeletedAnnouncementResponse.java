package com.sarkariexams.backend.modules.announcement.presentation.dto;

import java.util.UUID;

public record DeletedAnnouncementResponse(UUID id, boolean deleted, String message) {

    public static DeletedAnnouncementResponse of(UUID id) {
        return new DeletedAnnouncementResponse(id, true, "Announcement deleted");
    }
}
