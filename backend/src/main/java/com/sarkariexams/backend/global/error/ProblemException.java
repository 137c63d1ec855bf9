package com.sarkariexams.backend.global.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Error carrying a machine-readable code that is surfaced verbatim to the admin client.
 * {@code reason} refines the code (e.g. {@code invalid_status:pending}) and {@code approvalId}
 * points at the approval record the client should poll or stop retrying.
 */
public class ProblemException extends ResponseStatusException {

    private final String code;
    private final String detail;
    private final String reason;
    private final String approvalId;

    public ProblemException(HttpStatus status, String code) {
        this(status, code, null, null, null);
    }

    public ProblemException(HttpStatus status, String code, String detail) {
        this(status, code, detail, null, null);
    }

    public ProblemException(HttpStatus status, String code, String detail, String reason) {
        this(status, code, detail, reason, null);
    }

    public ProblemException(HttpStatus status, String code, String detail, String reason, String approvalId) {
        super(status, code);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
        this.reason = (reason != null && !reason.isBlank()) ? reason : null;
        this.approvalId = approvalId;
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    public String getProblemReason() {
        return reason;
    }

    public String getApprovalId() {
        return approvalId;
    }
}
