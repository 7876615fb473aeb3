package com.pricehistory.common.retry;

import java.time.Duration;
import java.util.Set;

/**
 * Exponential backoff without jitter for upstream HTTP calls.
 *
 * <p>Pure decision logic, no sleeping and no I/O:
 * <ul>
 *   <li>{@link #classifyStatus(int)} maps an HTTP status to an {@link AttemptOutcome}</li>
 *   <li>{@link #delayAfter(int)} is {@code backoffFactor * 2^attempt}</li>
 * </ul>
 *
 * <p>Attempts are zero-based. At most {@code maxRetries} attempts are made in total, so at most
 * {@code maxRetries - 1} waits happen; none follows the last attempt.
 */
public final class RetryPolicy {

    public static final Set<Integer> RETRYABLE_STATUSES = Set.of(429, 500, 502, 503, 504);

    private final int maxRetries;
    private final Duration backoffFactor;

    public RetryPolicy(int maxRetries, Duration backoffFactor) {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1");
        }
        if (backoffFactor == null || backoffFactor.isNegative()) {
            throw new IllegalArgumentException("backoffFactor must be zero or positive");
        }
        this.maxRetries = maxRetries;
        this.backoffFactor = backoffFactor;
    }

    public AttemptOutcome classifyStatus(int statusCode) {
        if (statusCode >= 200 && statusCode < 300) {
            return AttemptOutcome.SUCCESS;
        }
        if (RETRYABLE_STATUSES.contains(statusCode)) {
            return AttemptOutcome.RETRYABLE_STATUS;
        }
        return AttemptOutcome.NON_RETRYABLE;
    }

    /**
     * Retries allowed after the first attempt.
     */
    public int getRetriesAfterFirst() {
        return maxRetries - 1;
    }

    /**
     * Wait between failed attempt {@code attempt} (zero-based) and the next one.
     */
    public Duration delayAfter(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0");
        }
        return backoffFactor.multipliedBy(1L << Math.min(attempt, 30));
    }

    // sum of delayAfter(i) for i in [0, attempts)
    Duration totalDelayBefore(int attempts) {
        Duration total = Duration.ZERO;
        for (int i = 0; i < attempts; i++) {
            total = total.plus(delayAfter(i));
        }
        return total;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getBackoffFactor() {
        return backoffFactor;
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxRetries=" + maxRetries + ", backoffFactor=" + backoffFactor + "}";
    }
}
