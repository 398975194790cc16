package com.celflicks.backend.modules.onboarding.domain;

import com.celflicks.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * Every attempt lost a username race. The caller may retry later.
 */
public class ProvisioningFailedException extends ProblemException {

    public static final String RETRIES_EXHAUSTED = "PROVISIONING_RETRIES_EXHAUSTED";

    private final int attempts;

    public ProvisioningFailedException(int attempts, int retryAfterSeconds) {
        super(HttpStatus.SERVICE_UNAVAILABLE, RETRIES_EXHAUSTED,
                "exhausted retries after " + attempts + " attempts", retryAfterSeconds);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
