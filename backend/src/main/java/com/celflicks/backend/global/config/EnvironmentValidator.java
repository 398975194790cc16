package com.celflicks.backend.global.config;

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
 * 애플리케이션 시작 시 필수 설정값을 검증한다. 누락되거나 잘못된 값이 있으면 기동을 중단한다.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEFAULT_JWT_SECRET = "dev-celflicks-jwt-secret-change-me-0123456789";

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration",
            "celflicks.onboarding.max-attempts"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = new ArrayList<>();

        for (String property : REQUIRED_PROPERTIES) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(property));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(property + ": missing");
            }
        }

        Optional.ofNullable(environment.getProperty("jwt.expiration")).ifPresent(raw -> {
            try {
                long expiration = Long.parseLong(raw.trim());
                if (expiration < 60_000 || expiration > 86_400_000) {
                    problems.add("jwt.expiration: must be between 60000 and 86400000 ms");
                }
            } catch (NumberFormatException ex) {
                problems.add("jwt.expiration: must be numeric");
            }
        });

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration - {}", problem));
            throw new IllegalStateException("Configuration validation failed: " + String.join(", ", problems));
        }

        if (DEFAULT_JWT_SECRET.equals(environment.getProperty("jwt.secret"))) {
            log.warn("jwt.secret uses the development default; set JWT_SECRET outside local runs");
        }
        log.info("Configuration validated");
    }
}
