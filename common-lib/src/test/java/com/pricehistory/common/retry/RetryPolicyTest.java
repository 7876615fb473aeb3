package com.pricehistory.common.retry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(5, Duration.ofMillis(500));

    @Nested
    @DisplayName("classifyStatus()")
    class Classify {

        @ParameterizedTest
        @ValueSource(ints = {429, 500, 502, 503, 504})
        @DisplayName("transient statuses are retryable")
        void transientStatuses(int status) {
            assertEquals(AttemptOutcome.RETRYABLE_STATUS, policy.classifyStatus(status));
        }

        @ParameterizedTest
        @ValueSource(ints = {400, 401, 403, 404, 501})
        @DisplayName("other error statuses are not retried")
        void permanentStatuses(int status) {
            assertEquals(AttemptOutcome.NON_RETRYABLE, policy.classifyStatus(status));
        }

        @Test
        @DisplayName("2xx → SUCCESS")
        void success() {
            assertEquals(AttemptOutcome.SUCCESS, policy.classifyStatus(200));
            assertEquals(AttemptOutcome.SUCCESS, policy.classifyStatus(204));
        }
    }

    @Nested
    @DisplayName("backoff schedule")
    class Schedule {

        @Test
        @DisplayName("delay after attempt k is 0.5s × 2^k")
        void delayDoubles() {
            assertEquals(Duration.ofMillis(500), policy.delayAfter(0));
            assertEquals(Duration.ofMillis(1000), policy.delayAfter(1));
            assertEquals(Duration.ofMillis(2000), policy.delayAfter(2));
            assertEquals(Duration.ofMillis(4000), policy.delayAfter(3));
        }

        @Test
        @DisplayName("two failures then success → 1.5s waited in total")
        void twoFailures_sumOfDelays() {
            assertEquals(Duration.ofMillis(1500), policy.totalDelayBefore(2));
        }

        @Test
        @DisplayName("five attempts exhausted → four waits, 7.5s, none after the last")
        void exhaustion_noWaitAfterLastAttempt() {
            assertEquals(4, policy.getRetriesAfterFirst());
            assertEquals(Duration.ofMillis(7500), policy.totalDelayBefore(policy.getRetriesAfterFirst()));
        }

        @Test
        @DisplayName("only transient outcomes are retryable")
        void retryableOutcomes() {
            assertFalse(AttemptOutcome.NON_RETRYABLE.isRetryable());
            assertFalse(AttemptOutcome.SUCCESS.isRetryable());
            assertTrue(AttemptOutcome.RETRYABLE_STATUS.isRetryable());
            assertTrue(AttemptOutcome.RETRYABLE_TRANSPORT.isRetryable());
        }

        @Test
        @DisplayName("a single-attempt policy never waits")
        void singleAttempt_noRetries() {
            RetryPolicy once = new RetryPolicy(1, Duration.ofMillis(500));
            assertEquals(0, once.getRetriesAfterFirst());
            assertEquals(Duration.ZERO, once.totalDelayBefore(once.getRetriesAfterFirst()));
        }
    }

    @Test
    @DisplayName("invalid configuration is rejected")
    void invalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, Duration.ofMillis(500)));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(3, Duration.ofMillis(-1)));
        assertThrows(IllegalArgumentException.class, () -> policy.delayAfter(-1));
    }
}
