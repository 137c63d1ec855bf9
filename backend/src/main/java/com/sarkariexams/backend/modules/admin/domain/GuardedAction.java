package com.sarkariexams.backend.modules.admin.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Admin actions the policy gate knows about. Sensitive actions need a step-up token; those with
 * an approval class additionally go through dual approval while that policy is on. Actions that
 * share an approval class share the single-pending slot for a target.
 */
public enum GuardedAction {

    CREATE_DRAFT("create-announcement", null, false),
    UPDATE_DRAFT("update-announcement", null, false),
    CREATE_PUBLISH("create-publish", "announcement_publish", true),
    UPDATE_TO_PUBLISHED("update-to-published", "announcement_publish", true),
    APPROVE_ANNOUNCEMENT("approve-announcement", "announcement_publish", true),
    ROLLBACK_TO_PUBLISHED("rollback-to-published", "announcement_publish", true),
    UNPUBLISH_ANNOUNCEMENT("unpublish-announcement", "announcement_unpublish", true),
    DELETE_ANNOUNCEMENT("delete-announcement", "announcement_delete", true),
    REJECT_ANNOUNCEMENT("reject-announcement", null, true),
    ROLLBACK_ANNOUNCEMENT("rollback-announcement", null, true),
    DECIDE_APPROVAL("decide-approval", null, true),
    TERMINATE_SESSIONS("terminate-sessions", null, true),
    UPDATE_POLICIES("update-policies", null, true);

    private final String code;
    private final String approvalClass;
    private final boolean sensitive;

    GuardedAction(String code, String approvalClass, boolean sensitive) {
        this.code = code;
        this.approvalClass = approvalClass;
        this.sensitive = sensitive;
    }

    public String code() {
        return code;
    }

    public String approvalClass() {
        return approvalClass;
    }

    public boolean isSensitive() {
        return sensitive;
    }

    public boolean requiresDualApproval() {
        return approvalClass != null;
    }

    public static Optional<GuardedAction> fromCode(String code) {
        return Arrays.stream(values()).filter(action -> action.code.equals(code)).findFirst();
    }
}
