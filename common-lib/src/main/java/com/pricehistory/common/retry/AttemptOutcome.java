package com.pricehistory.common.retry;

/**
 * Classification of a single HTTP attempt.
 */
public enum AttemptOutcome {
    SUCCESS,
    RETRYABLE_STATUS,
    RETRYABLE_TRANSPORT,
    NON_RETRYABLE;

    public boolean isRetryable() {
        return this == RETRYABLE_STATUS || this == RETRYABLE_TRANSPORT;
    }
}
