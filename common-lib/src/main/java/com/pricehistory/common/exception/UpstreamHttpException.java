package com.pricehistory.common.exception;

/**
 * Upstream returned an HTTP status outside the retryable set (e.g. 400, 401, 404).
 */
public class UpstreamHttpException extends MarketDataException {

    private final int statusCode;

    public UpstreamHttpException(int statusCode, String message) {
        super(FailureKind.UPSTREAM_REJECTED, "HTTP " + statusCode + ": " + message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
