package io.servicekit.restclient.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Result of {@link RetryPolicy#decide}: whether to issue another attempt and how long to pause before it.
 */
public record RetryDecision(boolean retry, Duration delay) {

    private static final RetryDecision STOP = new RetryDecision(false, Duration.ZERO);

    public RetryDecision {
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay cannot be negative");
        }
    }

    public static RetryDecision stop() {
        return STOP;
    }

    public static RetryDecision retryAfter(Duration delay) {
        return new RetryDecision(true, delay);
    }
}
