package com.pricehistory.common.exception;

/**
 * Root of every failure raised while fetching or shaping price data.
 *
 * <p>The {@link FailureKind} lets callers decide on higher-level retries without
 * matching on concrete subclasses.
 */
public abstract class MarketDataException extends RuntimeException {

    private final FailureKind kind;

    protected MarketDataException(FailureKind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    protected MarketDataException(FailureKind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }
}
