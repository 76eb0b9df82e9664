package com.travelbooking.backend.global.config;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Refuses to serve traffic with missing or unsafe settings.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEV_JWT_SECRET = "dev-only-jwt-secret-change-me-before-deploying-anywhere";
    private static final long MIN_EXPIRATION_MS = 300_000L;
    private static final long MAX_EXPIRATION_MS = 86_400_000L;

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration: {}", problem));
            throw new IllegalStateException("Environment validation failed: " + String.join("; ", problems));
        }
        if (DEV_JWT_SECRET.equals(environment.getProperty("jwt.secret"))) {
            log.warn("jwt.secret is the development default; set JWT_SECRET before deploying");
        }
        log.info("Environment validation passed");
    }

    List<String> validate() {
        List<String> problems = new ArrayList<>();

        String[] requiredKeys = {
                "spring.datasource.url",
                "jwt.secret",
                "jwt.expiration",
                "app.frontend-url",
                "app.mail.from"
        };
        for (String key : requiredKeys) {
            if (property(key).isEmpty()) {
                problems.add(key + " is missing");
            }
        }

        property("jwt.secret")
                .filter(secret -> secret.getBytes(StandardCharsets.UTF_8).length < 32)
                .ifPresent(secret -> problems.add("jwt.secret must be at least 32 bytes"));

        property("jwt.expiration").ifPresent(raw -> {
            try {
                long expiration = Long.parseLong(raw);
                if (expiration < MIN_EXPIRATION_MS || expiration > MAX_EXPIRATION_MS) {
                    problems.add("jwt.expiration must be between " + MIN_EXPIRATION_MS + " and " + MAX_EXPIRATION_MS + " ms");
                }
            } catch (NumberFormatException e) {
                problems.add("jwt.expiration must be a number of milliseconds");
            }
        });

        property("app.auth.revocation.store")
                .filter(store -> !store.equals("memory") && !store.equals("redis"))
                .ifPresent(store -> problems.add("app.auth.revocation.store must be 'memory' or 'redis'"));

        return problems;
    }

    private Optional<String> property(String key) {
        return Optional.ofNullable(environment.getProperty(key))
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }
}
