package com.sarkariexams.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.sarkariexams.backend.global.error.ErrorCodes;
import com.sarkariexams.backend.global.error.RetryableProblemException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * Counts failed password/code checks per (purpose, subject) within a fixed window opened by the
 * first failure. Login and step-up share the same limits but keep separate counters. Windows live
 * in a Caffeine cache that drops them once the window has passed and caps how many are tracked.
 */
@Component
public class AuthAttemptLimiter {

    private static final Logger log = LoggerFactory.getLogger(AuthAttemptLimiter.class);

    public static final String LOGIN = "login";
    public static final String STEP_UP = "step_up";

    static final long MAX_TRACKED_SUBJECTS = 100_000;

    private final Cache<String, Window> windows;
    private final int maxFailures;
    private final Duration window;
    private final Clock clock;

    public AuthAttemptLimiter(
            @Value("${admin.step-up.max-failures:5}") int maxFailures,
            @Value("${admin.step-up.failure-window-seconds:900}") long windowSeconds,
            Clock clock
    ) {
        this.maxFailures = Math.max(1, maxFailures);
        this.window = Duration.ofSeconds(Math.max(1, windowSeconds));
        this.clock = clock;
        this.windows = Caffeine.newBuilder()
                .expireAfterWrite(this.window)
                .maximumSize(MAX_TRACKED_SUBJECTS)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
    }

    public void assertAllowed(String purpose, String subject) {
        Instant now = clock.instant();
        Window current = windows.getIfPresent(key(purpose, subject));
        if (current == null || current.isOver(now, window)) {
            return;
        }
        if (current.failures() >= maxFailures) {
            long retryAfter = Math.max(1, Duration.between(now, current.startedAt().plus(window)).toSeconds());
            log.warn("auth attempts throttled purpose={} subject={} failures={}", purpose, subject, current.failures());
            String code = STEP_UP.equals(purpose) ? ErrorCodes.STEP_UP_RATE_LIMITED : ErrorCodes.LOGIN_RATE_LIMITED;
            throw new RetryableProblemException(HttpStatus.TOO_MANY_REQUESTS, code, "Too many failed attempts", retryAfter);
        }
    }

    public void recordFailure(String purpose, String subject) {
        Instant now = clock.instant();
        windows.asMap().compute(key(purpose, subject), (k, existing) -> {
            if (existing == null || existing.isOver(now, window)) {
                return new Window(now, 1);
            }
            return new Window(existing.startedAt(), existing.failures() + 1);
        });
    }

    public void clearFailures(String purpose, String subject) {
        windows.invalidate(key(purpose, subject));
    }

    long trackedWindows() {
        windows.cleanUp();
        return windows.estimatedSize();
    }

    private static String key(String purpose, String subject) {
        String normalized = subject == null || subject.isBlank() ? "unknown" : subject.trim().toLowerCase(Locale.ROOT);
        return purpose + ":" + normalized;
    }

    private record Window(Instant startedAt, int failures) {

        boolean isOver(Instant now, Duration length) {
            return !startedAt.plus(length).isAfter(now);
        }
    }
}
