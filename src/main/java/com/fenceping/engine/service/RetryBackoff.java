package com.fenceping.engine.service;

import com.fenceping.engine.config.EngineProperties;

import java.time.Duration;

/**
 * Exponential backoff with a cap and an attempt budget.
 *
 * Attempts are 1-based: {@code delayFor(1)} is the wait after the first failure.
 */
public record RetryBackoff(Duration initialDelay, double multiplier, Duration maxDelay, int maxAttempts) {

    public static RetryBackoff from(EngineProperties.Backoff backoff) {
        return new RetryBackoff(backoff.getInitialDelay(), backoff.getMultiplier(),
            backoff.getMaxDelay(), backoff.getMaxAttempts());
    }

    public Duration delayFor(int attempt) {
        double factor = Math.pow(multiplier, Math.max(0, attempt - 1));
        double millis = initialDelay.toMillis() * factor;
        return Duration.ofMillis((long) Math.min(millis, maxDelay.toMillis()));
    }

    public boolean exhausted(int attempt) {
        return attempt >= maxAttempts;
    }
}
