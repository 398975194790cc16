package com.celflicks.backend.modules.onboarding.application;

import java.time.Duration;

@FunctionalInterface
public interface BackoffSleeper {

    void sleep(Duration delay) throws InterruptedException;
}
