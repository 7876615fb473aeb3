package com.pricehistory.common.exception;

import java.util.OptionalInt;

/**
 * Terminal failure after every allowed attempt hit a retryable status or transport error.
 *
 * <p>Carries the last observed HTTP status (absent when the last attempt failed at the
 * transport level) and the last transport error, if any, as the cause.
 */
public class RetryExhaustedException extends MarketDataException {

    private final int attempts;
    private final Integer lastStatus;

    public RetryExhaustedException(int attempts, Integer lastStatus, Throwable lastError) {
        super(FailureKind.RETRY_EXHAUSTED, describe(attempts, lastStatus, lastError), lastError);
        this.attempts = attempts;
        this.lastStatus = lastStatus;
    }

    public int getAttempts() {
        return attempts;
    }

    public OptionalInt getLastStatus() {
        return lastStatus == null ? OptionalInt.empty() : OptionalInt.of(lastStatus);
    }

    private static String describe(int attempts, Integer lastStatus, Throwable lastError) {
        String last = lastStatus != null
            ? "status " + lastStatus
            : (lastError != null ? lastError.getClass().getSimpleName() + ": " + lastError.getMessage() : "unknown");
        return "All " + attempts + " attempts failed. last=" + last;
    }
}
