package com.sarkariexams.backend.global.config;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when required settings are missing or the signing secret is unsafe.
 */
@Component
public class EnvironmentValidator implements InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String INSECURE_DEFAULT_SECRET = "dev-admin-secret-change-me-before-deploying-anywhere";
    private static final int MIN_SECRET_BYTES = 32;
    private static final Set<String> RELAXED_PROFILES = Set.of("test", "local");
    private static final String[] REQUIRED = {
            "spring.datasource.url",
            "jwt.secret",
            "app.cors.allowed-origins"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @Override
    public void afterPropertiesSet() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED) {
            String value = environment.getProperty(key);
            if (value == null || value.isBlank()) {
                problems.add(key + " is missing");
            }
        }

        String secret = environment.getProperty("jwt.secret");
        if (secret != null && !secret.isBlank()) {
            if (secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
                problems.add("jwt.secret must be at least " + MIN_SECRET_BYTES + " bytes");
            }
            boolean relaxed = Arrays.stream(environment.getActiveProfiles()).anyMatch(RELAXED_PROFILES::contains);
            if (!relaxed && INSECURE_DEFAULT_SECRET.equals(secret)) {
                problems.add("jwt.secret still has the development default");
            }
        }

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("configuration check failed: {}", problem));
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
        log.info("configuration check passed");
    }
}
