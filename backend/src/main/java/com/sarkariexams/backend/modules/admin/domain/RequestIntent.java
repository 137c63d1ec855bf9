package com.sarkariexams.backend.modules.admin.domain;

/**
 * What the caller asked for beyond the plain action, parsed once from the request headers.
 * A break-glass reason takes precedence over an approval id when both are sent.
 */
public record RequestIntent(Kind kind, String approvalId, String breakGlassReason) {

    public enum Kind {
        PLAIN,
        WITH_APPROVAL_ID,
        WITH_BREAK_GLASS
    }

    private static final RequestIntent PLAIN_INTENT = new RequestIntent(Kind.PLAIN, null, null);

    public static RequestIntent plain() {
        return PLAIN_INTENT;
    }

    public static RequestIntent withApprovalId(String approvalId) {
        return new RequestIntent(Kind.WITH_APPROVAL_ID, approvalId.trim(), null);
    }

    public static RequestIntent withBreakGlass(String reason) {
        return new RequestIntent(Kind.WITH_BREAK_GLASS, null, reason);
    }

    public static RequestIntent fromHeaders(String approvalIdHeader, String breakGlassReasonHeader) {
        if (breakGlassReasonHeader != null && !breakGlassReasonHeader.isBlank()) {
            return withBreakGlass(breakGlassReasonHeader);
        }
        if (approvalIdHeader != null && !approvalIdHeader.isBlank()) {
            return withApprovalId(approvalIdHeader);
        }
        return plain();
    }
}
