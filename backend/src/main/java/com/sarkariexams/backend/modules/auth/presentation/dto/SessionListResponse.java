package com.sarkariexams.backend.modules.auth.presentation.dto;

import java.util.List;

import com.sarkariexams.backend.modules.auth.application.AdminSessionService.SessionView;

public record SessionListResponse(List<SessionView> data, Meta meta) {

    public record Meta(int total) {
    }
}
