package com.celflicks.backend.modules.onboarding.config;

import java.math.BigDecimal;
import java.time.Duration;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Bound from {@code celflicks.onboarding.*}.
 *
 * @param maxAttempts         total provisioning attempts, counting the first one
 * @param backoffBase         wait before the first retry; doubles for every further retry
 * @param retryAfterSeconds   {@code Retry-After} hint returned once attempts are exhausted
 * @param welcomeBonusAmount  opening balance and welcome ledger amount
 */
@ConfigurationProperties(prefix = "celflicks.onboarding")
@Validated
public record OnboardingProperties(
        @Min(1) @Max(10) int maxAttempts,
        Duration backoffBase,
        int retryAfterSeconds,
        BigDecimal welcomeBonusAmount,
        String welcomeTransactionDescription,
        String welcomeNotificationTitle,
        String welcomeNotificationBody
) {

    public OnboardingProperties {
        if (maxAttempts <= 0) {
            maxAttempts = 3;
        }
        if (backoffBase == null || backoffBase.isNegative()) {
            backoffBase = Duration.ofSeconds(1);
        }
        if (retryAfterSeconds <= 0) {
            retryAfterSeconds = 5;
        }
        if (welcomeBonusAmount == null) {
            welcomeBonusAmount = new BigDecimal("5.00");
        }
        if (welcomeTransactionDescription == null || welcomeTransactionDescription.isBlank()) {
            welcomeTransactionDescription = "Welcome bonus for new user";
        }
        if (welcomeNotificationTitle == null || welcomeNotificationTitle.isBlank()) {
            welcomeNotificationTitle = "Welcome to Celflicks!";
        }
        if (welcomeNotificationBody == null || welcomeNotificationBody.isBlank()) {
            welcomeNotificationBody = "Thanks for joining! You've received 5 XCE as a welcome bonus.";
        }
    }

    public static OnboardingProperties defaults() {
        return new OnboardingProperties(0, null, 0, null, null, null, null);
    }
}
