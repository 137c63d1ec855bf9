package com.sarkariexams.backend.modules.announcement.presentation.dto;

import java.util.Map;

public record RollbackPreviewResponse(
        boolean dryRun,
        int targetVersion,
        int currentVersion,
        String snapshotStatus,
        Map<String, Object> snapshot
) {
}
