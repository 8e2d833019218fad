package io.servicekit.restclient.retry;

import io.servicekit.restclient.transport.AttemptOutcome;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.function.IntPredicate;

/**
 * Stateless retry decision with capped exponential backoff.
 *
 * <p>Only transport failures and HTTP errors whose status is retryable (by default 429 and 5xx) are retried. After
 * the failed attempt with zero-based index {@code i} the policy waits {@code min(backoffBase * 2^i, backoffCap)};
 * no further attempt is made once {@code i >= maxRetries}, which bounds a call to {@code maxRetries + 1} attempts.</p>
 */
public final class RetryPolicy {

    public static final Duration DEFAULT_BACKOFF_BASE = Duration.ofMillis(500);
    public static final Duration DEFAULT_BACKOFF_CAP = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_RETRIES = 3;

    private static final IntPredicate DEFAULT_RETRYABLE = status -> status == 429 || (status >= 500 && status <= 599);

    private final int maxRetries;
    private final Duration backoffBase;
    private final Duration backoffCap;
    private final IntPredicate retryableStatus;

    public RetryPolicy(int maxRetries, Duration backoffBase, Duration backoffCap, IntPredicate retryableStatus) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries cannot be negative");
        }
        Objects.requireNonNull(backoffBase, "backoffBase");
        Objects.requireNonNull(backoffCap, "backoffCap");
        if (backoffBase.isNegative() || backoffCap.isNegative()) {
            throw new IllegalArgumentException("backoff durations cannot be negative");
        }
        this.maxRetries = maxRetries;
        this.backoffBase = backoffBase;
        this.backoffCap = backoffCap;
        this.retryableStatus = Objects.requireNonNull(retryableStatus, "retryableStatus");
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_RETRIES, DEFAULT_BACKOFF_BASE, DEFAULT_BACKOFF_CAP, DEFAULT_RETRYABLE);
    }

    public static RetryPolicy of(int maxRetries, Duration backoffBase, Duration backoffCap, Set<Integer> statuses) {
        if (statuses == null) {
            return new RetryPolicy(maxRetries, backoffBase, backoffCap, DEFAULT_RETRYABLE);
        }
        Set<Integer> retryable = Set.copyOf(statuses);
        return new RetryPolicy(maxRetries, backoffBase, backoffCap, status -> retryable.contains(status));
    }

    /**
     * Decides what to do after the attempt with zero-based index {@code attemptIndex} produced {@code outcome}.
     */
    public RetryDecision decide(AttemptOutcome outcome, int attemptIndex) {
        Objects.requireNonNull(outcome, "outcome");
        if (attemptIndex < 0) {
            throw new IllegalArgumentException("attemptIndex cannot be negative");
        }
        if (!isRetryable(outcome) || attemptIndex >= maxRetries) {
            return RetryDecision.stop();
        }
        return RetryDecision.retryAfter(backoff(attemptIndex));
    }

    public boolean isRetryable(AttemptOutcome outcome) {
        switch (outcome.kind()) {
            case TRANSPORT_FAILURE:
                return true;
            case HTTP_ERROR:
                return retryableStatus.test(outcome.status());
            default:
                return false;
        }
    }

    /**
     * Wait applied after the attempt with index {@code attemptIndex}; saturates at the cap instead of overflowing.
     */
    public Duration backoff(int attemptIndex) {
        if (backoffBase.isZero()) {
            return Duration.ZERO;
        }
        if (attemptIndex >= 62) {
            return backoffCap;
        }
        long factor = 1L << attemptIndex;
        Duration wait;
        try {
            wait = backoffBase.multipliedBy(factor);
        } catch (ArithmeticException ex) {
            return backoffCap;
        }
        return wait.compareTo(backoffCap) > 0 ? backoffCap : wait;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public Duration backoffBase() {
        return backoffBase;
    }

    public Duration backoffCap() {
        return backoffCap;
    }
}
