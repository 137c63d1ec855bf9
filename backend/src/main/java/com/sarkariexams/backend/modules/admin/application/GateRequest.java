package com.sarkariexams.backend.modules.admin.application;

import java.util.Map;
import java.util.UUID;

import com.sarkariexams.backend.global.security.ActorContext;
import com.sarkariexams.backend.modules.admin.domain.GuardedAction;
import com.sarkariexams.backend.modules.admin.domain.RequestIntent;

/**
 * Everything the gate needs about one guarded call.
 *
 * @param targetKey      stable key of the thing being changed; approvals are unique per
 *                       (targetKey, approval class)
 * @param announcementId announcement the action touches, if any, for audit rows
 * @param payload        the mutation input as it would be stored on an approval request
 */
public record GateRequest(
        ActorContext actor,
        GuardedAction action,
        String targetKey,
        UUID announcementId,
        RequestIntent intent,
        String stepUpToken,
        Map<String, Object> payload,
        String method,
        String endpoint,
        String note
) {

    public GateRequest {
        if (actor == null || action == null || targetKey == null) {
            throw new IllegalArgumentException("actor, action and targetKey are required");
        }
        intent = intent == null ? RequestIntent.plain() : intent;
        payload = payload == null ? Map.of() : payload;
    }
}
