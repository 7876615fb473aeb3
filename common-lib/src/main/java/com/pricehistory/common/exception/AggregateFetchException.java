package com.pricehistory.common.exception;

/**
 * A multi-symbol table request failed because one constituent symbol failed.
 * The original failure is kept as the cause.
 */
public class AggregateFetchException extends MarketDataException {

    private final String symbol;

    public AggregateFetchException(String symbol, Throwable cause) {
        super(FailureKind.AGGREGATE_FAILURE,
              "Fetch failed for symbol=" + symbol + ": " + cause.getMessage(), cause);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Kind of the underlying symbol failure, or {@link FailureKind#AGGREGATE_FAILURE}
     * when the cause is not a {@link MarketDataException}.
     */
    public FailureKind getCauseKind() {
        if (getCause() instanceof MarketDataException mde) {
            return mde.getKind();
        }
        return FailureKind.AGGREGATE_FAILURE;
    }
}
