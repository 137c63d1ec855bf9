package com.sarkariexams.backend.modules.stepup.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class StepUpMaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(StepUpMaintenanceScheduler.class);
    private static final Duration GRACE = Duration.ofHours(1);

    private final StepUpService stepUpService;
    private final Clock clock;

    public StepUpMaintenanceScheduler(StepUpService stepUpService, Clock clock) {
        this.stepUpService = stepUpService;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${admin.step-up.cleanup-interval:PT30M}",
            initialDelayString = "${admin.step-up.cleanup-interval:PT30M}")
    public void purgeExpiredGrants() {
        int removed = stepUpService.purgeExpired(OffsetDateTime.now(clock).minus(GRACE));
        if (removed > 0) {
            log.info("Purged {} expired step-up grants", removed);
        }
    }
}
