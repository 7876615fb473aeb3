package com.pricehistory.common.exception;

/**
 * Discriminates the failure paths of the retrieval pipeline.
 */
public enum FailureKind {
    /** Bad caller input. Never worth retrying. */
    INVALID_ARGUMENT,
    /** Upstream answered with a non-retryable HTTP status. */
    UPSTREAM_REJECTED,
    /** Transient upstream errors outlasted the retry budget. */
    RETRY_EXHAUSTED,
    /** Payload shape did not match what the normalizer understands. */
    MALFORMED_RESPONSE,
    /** One symbol of a multi-symbol request failed. */
    AGGREGATE_FAILURE
}
