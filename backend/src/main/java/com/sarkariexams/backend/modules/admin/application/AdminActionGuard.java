package com.sarkariexams.backend.modules.admin.application;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sarkariexams.backend.global.error.ProblemException;
import com.sarkariexams.backend.global.security.SecurityEventLogger;
import com.sarkariexams.backend.modules.admin.domain.GuardedAction;
import com.sarkariexams.backend.modules.admin.domain.RequestIntent;
import com.sarkariexams.backend.modules.admin.domain.SecurityPolicy;
import com.sarkariexams.backend.modules.approval.application.ApprovalLedgerService;
import com.sarkariexams.backend.modules.approval.domain.ApprovalRequest;
import com.sarkariexams.backend.modules.audit.application.AuditLogService;
import com.sarkariexams.backend.modules.audit.application.AuditLogService.AuditEntry;
import com.sarkariexams.backend.modules.stepup.application.StepUpService;

import io.micrometer.core.instrument.MeterRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Runs a guarded admin mutation through the {@link PolicyGate}. The mutation, the approval
 * status change and the success audit entry commit together; denials are audited in their own
 * transaction and rethrown.
 */
@Service
public class AdminActionGuard {

    private static final Logger log = LoggerFactory.getLogger(AdminActionGuard.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final PolicyGate policyGate;
    private final AdminPolicyService adminPolicyService;
    private final ApprovalLedgerService approvalLedgerService;
    private final StepUpService stepUpService;
    private final AuditLogService auditLogService;
    private final SecurityEventLogger securityEvents;
    private final MeterRegistry meterRegistry;
    private final ObjectMapper objectMapper;

    public AdminActionGuard(
            PolicyGate policyGate,
            AdminPolicyService adminPolicyService,
            ApprovalLedgerService approvalLedgerService,
            StepUpService stepUpService,
            AuditLogService auditLogService,
            SecurityEventLogger securityEvents,
            MeterRegistry meterRegistry,
            ObjectMapper objectMapper
    ) {
        this.policyGate = policyGate;
        this.adminPolicyService = adminPolicyService;
        this.approvalLedgerService = approvalLedgerService;
        this.stepUpService = stepUpService;
        this.auditLogService = auditLogService;
        this.securityEvents = securityEvents;
        this.meterRegistry = meterRegistry;
        this.objectMapper = objectMapper;
    }

    /**
     * A replay runs under the action it was queued as, even when the target's status has moved
     * on since the approval executed. Anything else keeps the action the caller derived.
     */
    public GuardedAction actionFor(RequestIntent intent, String targetKey, String method, String endpoint,
                                   GuardedAction derived) {
        if (intent.kind() != RequestIntent.Kind.WITH_APPROVAL_ID) {
            return derived;
        }
        return approvalLedgerService.queuedActionType(intent.approvalId(), targetKey, method, endpoint)
                .flatMap(GuardedAction::fromCode)
                .orElse(derived);
    }

    @Transactional
    public <T> GuardedResult<T> run(GateRequest request, Class<T> resultType, Function<GuardedExecution, T> mutation) {
        return run(request, adminPolicyService.current(), resultType, mutation);
    }

    @Transactional
    public <T> GuardedResult<T> run(GateRequest request, SecurityPolicy policy, Class<T> resultType,
                                    Function<GuardedExecution, T> mutation) {
        GateDecision decision = policyGate.decide(request, policy);
        meterRegistry.counter("admin.gate.decisions",
                "action", request.action().code(),
                "outcome", decision.outcome().name().toLowerCase(Locale.ROOT)).increment();

        switch (decision.outcome()) {
            case REQUIRE_STEP_UP, DENY -> throw denied(request, decision);
            case REQUIRE_APPROVAL -> {
                log.info("admin action queued action={} target={} approvalId={}",
                        request.action().code(), request.targetKey(), decision.approval().getId());
                return GuardedResult.queued(decision.approval());
            }
            case REPLAY_EXECUTED -> {
                return replay(decision.approval(), resultType);
            }
            case EXECUTE_APPROVED -> {
                return executeApproved(request, decision, resultType, mutation);
            }
            default -> {
                stepUpService.consume(decision.stepUp());
                GuardedExecution execution = new GuardedExecution(request.actor(), request.payload(),
                        decision.auditMetadata(), null);
                if (execution.breakGlassUsed()) {
                    securityEvents.warn("admin_break_glass_used", Map.of(
                            "userId", request.actor().userId(),
                            "action", request.action().code(),
                            "target", request.targetKey(),
                            "reason", decision.auditMetadata().get("breakGlassReason")
                    ));
                }
                return GuardedResult.executed(mutation.apply(execution), null, false);
            }
        }
    }

    private <T> GuardedResult<T> executeApproved(GateRequest request, GateDecision decision, Class<T> resultType,
                                                 Function<GuardedExecution, T> mutation) {
        ApprovalRequest approval = decision.approval();
        if (!approvalLedgerService.claimForExecution(approval.getId(), request.actor().userId())) {
            return replay(approvalLedgerService.load(approval.getId()), resultType);
        }
        stepUpService.consume(decision.stepUp());

        Map<String, Object> metadata = new LinkedHashMap<>(decision.auditMetadata());
        Optional.ofNullable(approval.getReviewerUserId())
                .ifPresent(reviewer -> metadata.put("approvedBy", reviewer.toString()));
        Map<String, Object> payload = approval.getPayload() != null ? approval.getPayload() : Map.of();

        T result = mutation.apply(new GuardedExecution(request.actor(), payload, metadata, approval));
        approvalLedgerService.storeResult(approval.getId(), toMap(result));
        return GuardedResult.executed(result, approval, false);
    }

    private <T> GuardedResult<T> replay(ApprovalRequest approval, Class<T> resultType) {
        log.debug("approval {} already executed, returning stored result", approval.getId());
        T stored = approval.getResult() == null ? null : objectMapper.convertValue(approval.getResult(), resultType);
        return GuardedResult.executed(stored, approval, true);
    }

    private ProblemException denied(GateRequest request, GateDecision decision) {
        ProblemException problem = decision.denial();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("actionType", request.action().code());
        metadata.put("targetKey", request.targetKey());
        metadata.put("error", problem.getCode());
        Optional.ofNullable(problem.getProblemReason()).ifPresent(reason -> metadata.put("reason", reason));
        Optional.ofNullable(problem.getApprovalId()).ifPresent(id -> metadata.put("approvalId", id));
        if (request.intent().breakGlassReason() != null) {
            metadata.put("breakGlassReason", request.intent().breakGlassReason());
        }
        auditLogService.recordDetached(new AuditEntry("admin_action_denied", "admin_action", request.targetKey(),
                request.announcementId(), request.actor().userId(), null, metadata));
        securityEvents.warn(eventFor(problem.getCode()), Map.of(
                "userId", request.actor().userId(),
                "action", request.action().code(),
                "error", problem.getCode()
        ));
        return problem;
    }

    private static String eventFor(String code) {
        if (code.startsWith("step_up")) {
            return "admin_step_up_failed";
        }
        if (code.startsWith("break_glass")) {
            return "admin_break_glass_denied";
        }
        return "admin_action_denied";
    }

    private Map<String, Object> toMap(Object result) {
        if (result == null) {
            return null;
        }
        return objectMapper.convertValue(result, MAP_TYPE);
    }
}
