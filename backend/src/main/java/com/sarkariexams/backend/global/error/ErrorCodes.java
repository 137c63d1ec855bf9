package com.sarkariexams.backend.global.error;

public final class ErrorCodes {

    public static final String CSRF_INVALID = "csrf_invalid";
    public static final String STEP_UP_REQUIRED = "step_up_required";
    public static final String STEP_UP_RATE_LIMITED = "step_up_rate_limited";
    public static final String APPROVAL_REQUIRED = "approval_required";
    public static final String APPROVAL_INVALID = "approval_invalid";
    public static final String SELF_APPROVAL_FORBIDDEN = "self_approval_forbidden";
    public static final String BREAK_GLASS_DISABLED = "break_glass_disabled";
    public static final String BREAK_GLASS_REASON_TOO_SHORT = "break_glass_reason_too_short";
    public static final String INVALID_CREDENTIALS = "invalid_credentials";
    public static final String NOT_ENROLLED_MISMATCH = "not_enrolled_mismatch";
    public static final String SESSION_EXPIRED = "session_expired";
    public static final String UNAUTHORIZED = "unauthorized";
    public static final String FORBIDDEN = "forbidden";
    public static final String LOGIN_RATE_LIMITED = "login_rate_limited";
    public static final String ACCOUNT_DISABLED = "account_disabled";
    public static final String CANNOT_TERMINATE_CURRENT_SESSION = "cannot_terminate_current_session";
    public static final String SESSION_NOT_FOUND = "session_not_found";
    public static final String NOT_FOUND = "not_found";
    public static final String VALIDATION_ERROR = "validation_error";
    public static final String INVALID_STATUS_TRANSITION = "invalid_status_transition";

    private ErrorCodes() {
    }
}
