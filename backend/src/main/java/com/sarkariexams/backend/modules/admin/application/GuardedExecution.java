package com.sarkariexams.backend.modules.admin.application;

import java.util.LinkedHashMap;
import java.util.Map;

import com.sarkariexams.backend.global.security.ActorContext;
import com.sarkariexams.backend.modules.approval.domain.ApprovalRequest;

public record GuardedExecution(
        ActorContext actor,
        Map<String, Object> payload,
        Map<String, Object> auditMetadata,
        ApprovalRequest approval
) {

    public boolean breakGlassUsed() {
        return Boolean.TRUE.equals(auditMetadata.get("breakGlassUsed"));
    }

    public Map<String, Object> auditMetadataWith(Map<String, Object> extra) {
        Map<String, Object> merged = new LinkedHashMap<>(extra);
        merged.putAll(auditMetadata);
        return merged;
    }
}
