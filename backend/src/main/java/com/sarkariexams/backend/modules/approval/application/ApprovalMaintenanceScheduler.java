package com.sarkariexams.backend.modules.approval.application;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class ApprovalMaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(ApprovalMaintenanceScheduler.class);

    private final ApprovalLedgerService approvalLedgerService;
    private final Duration retention;

    public ApprovalMaintenanceScheduler(
            ApprovalLedgerService approvalLedgerService,
            @Value("${admin.approval.retention-days:30}") int retentionDays
    ) {
        this.approvalLedgerService = approvalLedgerService;
        this.retention = Duration.ofDays(Math.max(1, retentionDays));
    }

    @Scheduled(fixedDelayString = "${admin.approval.cleanup-interval-ms:3600000}",
            initialDelayString = "${admin.approval.cleanup-interval-ms:3600000}")
    public void sweep() {
        int expired = approvalLedgerService.expireStale();
        int purged = approvalLedgerService.purgeInactiveOlderThan(retention);
        if (expired > 0 || purged > 0) {
            log.info("Approval sweep expired {} pending and purged {} inactive requests", expired, purged);
        }
    }
}
