package com.pricehistory.common.request;

import com.pricehistory.common.exception.InvalidArgumentException;
import com.pricehistory.common.model.AssetClass;
import com.pricehistory.common.model.Period;
import com.pricehistory.common.model.PriceQuery;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Pure stateless mapping from a {@link PriceQuery} to the Alpha Vantage {@code /query}
 * function and parameter set.
 *
 * <p>Function naming:
 * <ul>
 *   <li>CRYPTO + INTRADAY                  → {@code CRYPTO_INTRADAY}</li>
 *   <li>CRYPTO + DAILY/WEEKLY/MONTHLY      → {@code DIGITAL_CURRENCY_{PERIOD}}</li>
 *   <li>EQUITY + INTRADAY                  → {@code TIME_SERIES_INTRADAY}</li>
 *   <li>EQUITY + non-intraday, adjusted    → {@code TIME_SERIES_{PERIOD}_ADJUSTED}</li>
 *   <li>EQUITY + non-intraday, unadjusted  → {@code TIME_SERIES_{PERIOD}}</li>
 * </ul>
 *
 * <p>Only equity non-intraday requests carry {@code adjusted}; only crypto requests carry
 * {@code market}. Output size is always {@code full}.
 */
public final class AlphaVantageRequestBuilder {

    public static final String MARKET_USD  = "USD";
    public static final String OUTPUT_FULL = "full";

    private AlphaVantageRequestBuilder() {}

    /**
     * Relies on {@link PriceQuery}'s own validation: an intraday query always carries an interval.
     *
     * @throws InvalidArgumentException when {@code query} or {@code assetClass} is null
     */
    public static ProviderRequest build(PriceQuery query, AssetClass assetClass) {
        if (query == null || assetClass == null) {
            throw new InvalidArgumentException("query and assetClass must be provided");
        }
        Period period = query.period();

        String function = functionId(assetClass, period, query.adjusted());

        Map<String, String> params = new LinkedHashMap<>();
        params.put("function", function);
        params.put("symbol", query.symbol());
        if (assetClass == AssetClass.CRYPTO) {
            params.put("market", MARKET_USD);
        }
        params.put("outputsize", OUTPUT_FULL);
        if (period == Period.INTRADAY) {
            params.put("interval", query.interval().value());
        } else if (assetClass == AssetClass.EQUITY) {
            params.put("adjusted", Boolean.toString(query.adjusted()));
        }
        return new ProviderRequest(function, params);
    }

    static String functionId(AssetClass assetClass, Period period, boolean adjusted) {
        String suffix = period.name().toUpperCase(Locale.ROOT);
        if (assetClass == AssetClass.CRYPTO) {
            return period == Period.INTRADAY ? "CRYPTO_INTRADAY" : "DIGITAL_CURRENCY_" + suffix;
        }
        if (period != Period.INTRADAY && adjusted) {
            return "TIME_SERIES_" + suffix + "_ADJUSTED";
        }
        return "TIME_SERIES_" + suffix;
    }
}
