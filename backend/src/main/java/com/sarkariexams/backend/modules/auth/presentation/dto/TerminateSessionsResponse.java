package com.sarkariexams.backend.modules.auth.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TerminateSessionsResponse(boolean success, Integer removed) {
}
