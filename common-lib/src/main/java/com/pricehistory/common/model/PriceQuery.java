package com.pricehistory.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pricehistory.common.exception.InvalidArgumentException;

/**
 * Abstract, provider-independent request for one symbol's price history.
 *
 * <p>{@code interval} is mandatory for {@link Period#INTRADAY} and dropped for every other
 * period. {@code adjusted} only matters for equity, non-intraday series.
 */
public record PriceQuery(
    @JsonProperty("symbol")   String   symbol,
    @JsonProperty("period")   Period   period,
    @JsonProperty("interval") Interval interval,
    @JsonProperty("adjusted") boolean  adjusted
) {
    public PriceQuery {
        if (symbol == null || symbol.isBlank()) {
            throw new InvalidArgumentException("symbol must not be blank");
        }
        if (period == null) {
            throw new InvalidArgumentException("period must be specified");
        }
        if (period == Period.INTRADAY && interval == null) {
            throw new InvalidArgumentException("Interval must be specified for intraday data");
        }
        symbol = symbol.strip();
        if (period != Period.INTRADAY) {
            interval = null;
        }
    }

    public static PriceQuery of(String symbol, Period period, Interval interval, boolean adjusted) {
        return new PriceQuery(symbol, period, interval, adjusted);
    }

    public static PriceQuery daily(String symbol, boolean adjusted) {
        return new PriceQuery(symbol, Period.DAILY, null, adjusted);
    }

    public static PriceQuery intraday(String symbol, Interval interval) {
        return new PriceQuery(symbol, Period.INTRADAY, interval, false);
    }
}
