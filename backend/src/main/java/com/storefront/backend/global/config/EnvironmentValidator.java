package com.storefront.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;

/**
 * Fails startup when required settings are missing or out of range.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEFAULT_DEV_SECRET = "storefront-dev-secret-change-me-in-production-0000";
    private static final long MIN_ACCESS_TTL_MILLIS = 60_000L;
    private static final long MAX_ACCESS_TTL_MILLIS = 86_400_000L;
    private static final int MIN_SECRET_BYTES = 32;

    private static final String[] REQUIRED_KEYS = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration",
            "jwt.refresh-expiration"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration: {}", problem));
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
        if (environment.acceptsProfiles(Profiles.of("prod"))
                && DEFAULT_DEV_SECRET.equals(environment.getProperty("jwt.secret"))) {
            throw new IllegalStateException("jwt.secret must be replaced in the prod profile");
        }
        log.info("Configuration validated");
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED_KEYS) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(key));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(key + " is missing");
            }
        }

        Optional.ofNullable(environment.getProperty("jwt.secret"))
                .filter(secret -> !secret.isBlank() && secret.length() < MIN_SECRET_BYTES)
                .ifPresent(secret -> problems.add("jwt.secret must be at least " + MIN_SECRET_BYTES + " characters"));

        Optional.ofNullable(environment.getProperty("jwt.expiration"))
                .filter(value -> !value.isBlank())
                .ifPresent(value -> {
                    try {
                        long ttl = Long.parseLong(value.trim());
                        if (ttl < MIN_ACCESS_TTL_MILLIS || ttl > MAX_ACCESS_TTL_MILLIS) {
                            problems.add("jwt.expiration must be between " + MIN_ACCESS_TTL_MILLIS
                                    + " and " + MAX_ACCESS_TTL_MILLIS + " ms");
                        }
                    } catch (NumberFormatException e) {
                        problems.add("jwt.expiration must be a number");
                    }
                });

        return problems;
    }
}
