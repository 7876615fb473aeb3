package com.pricehistory.common.request;

import com.pricehistory.common.exception.InvalidArgumentException;
import com.pricehistory.common.model.AssetClass;
import com.pricehistory.common.model.Interval;
import com.pricehistory.common.model.Period;
import com.pricehistory.common.model.PriceQuery;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Covers the full function decision table plus parameter shaping.
 */
class AlphaVantageRequestBuilderTest {

    // ── functionId decision table ─────────────────────────────────────────

    @ParameterizedTest(name = "{0} {1} adjusted={2} → {3}")
    @CsvSource({
        "CRYPTO, INTRADAY, true,  CRYPTO_INTRADAY",
        "CRYPTO, INTRADAY, false, CRYPTO_INTRADAY",
        "CRYPTO, DAILY,    true,  DIGITAL_CURRENCY_DAILY",
        "CRYPTO, DAILY,    false, DIGITAL_CURRENCY_DAILY",
        "CRYPTO, WEEKLY,   true,  DIGITAL_CURRENCY_WEEKLY",
        "CRYPTO, WEEKLY,   false, DIGITAL_CURRENCY_WEEKLY",
        "CRYPTO, MONTHLY,  true,  DIGITAL_CURRENCY_MONTHLY",
        "CRYPTO, MONTHLY,  false, DIGITAL_CURRENCY_MONTHLY",
        "EQUITY, INTRADAY, true,  TIME_SERIES_INTRADAY",
        "EQUITY, INTRADAY, false, TIME_SERIES_INTRADAY",
        "EQUITY, DAILY,    true,  TIME_SERIES_DAILY_ADJUSTED",
        "EQUITY, DAILY,    false, TIME_SERIES_DAILY",
        "EQUITY, WEEKLY,   true,  TIME_SERIES_WEEKLY_ADJUSTED",
        "EQUITY, WEEKLY,   false, TIME_SERIES_WEEKLY",
        "EQUITY, MONTHLY,  true,  TIME_SERIES_MONTHLY_ADJUSTED",
        "EQUITY, MONTHLY,  false, TIME_SERIES_MONTHLY"
    })
    void functionDecisionTable(AssetClass assetClass, Period period, boolean adjusted, String expected) {
        String symbol = assetClass == AssetClass.CRYPTO ? "ETH" : "IBM";
        PriceQuery query = PriceQuery.of(symbol, period, Interval.FIVE_MIN, adjusted);

        ProviderRequest request = AlphaVantageRequestBuilder.build(query, assetClass);

        assertEquals(expected, request.functionId());
        assertEquals(expected, request.param("function"));
    }

    // ── parameter shaping ─────────────────────────────────────────────────

    @Nested
    @DisplayName("params")
    class Params {

        @Test
        @DisplayName("crypto daily → market=USD, no adjusted, no interval")
        void cryptoDaily() {
            ProviderRequest r = AlphaVantageRequestBuilder.build(PriceQuery.daily("BTC", true), AssetClass.CRYPTO);

            assertEquals(List.of("function", "symbol", "market", "outputsize"), List.copyOf(r.params().keySet()));
            assertEquals("BTC", r.param("symbol"));
            assertEquals("USD", r.param("market"));
            assertEquals("full", r.param("outputsize"));
        }

        @Test
        @DisplayName("equity daily unadjusted → adjusted=false, no market")
        void equityDailyUnadjusted() {
            ProviderRequest r = AlphaVantageRequestBuilder.build(PriceQuery.daily("IBM", false), AssetClass.EQUITY);

            assertEquals(List.of("function", "symbol", "outputsize", "adjusted"), List.copyOf(r.params().keySet()));
            assertEquals("false", r.param("adjusted"));
            assertNull(r.param("market"));
        }

        @Test
        @DisplayName("equity intraday → interval, no adjusted")
        void equityIntraday() {
            ProviderRequest r = AlphaVantageRequestBuilder.build(
                PriceQuery.intraday("IBM", Interval.SIXTY_MIN), AssetClass.EQUITY);

            assertEquals("TIME_SERIES_INTRADAY", r.functionId());
            assertEquals("60min", r.param("interval"));
            assertNull(r.param("adjusted"));
        }

        @Test
        @DisplayName("crypto intraday → market and interval")
        void cryptoIntraday() {
            ProviderRequest r = AlphaVantageRequestBuilder.build(
                PriceQuery.intraday("DOGE", Interval.ONE_MIN), AssetClass.CRYPTO);

            assertEquals(List.of("function", "symbol", "market", "outputsize", "interval"),
                List.copyOf(r.params().keySet()));
            assertEquals("1min", r.param("interval"));
        }

        @Test
        @DisplayName("API key is never part of the built params")
        void noApiKey() {
            ProviderRequest r = AlphaVantageRequestBuilder.build(PriceQuery.daily("IBM", true), AssetClass.EQUITY);
            assertFalse(r.params().containsKey("apikey"));
        }

        @Test
        @DisplayName("built params are unmodifiable")
        void paramsUnmodifiable() {
            ProviderRequest r = AlphaVantageRequestBuilder.build(PriceQuery.daily("IBM", true), AssetClass.EQUITY);
            assertThrows(UnsupportedOperationException.class, () -> r.params().put("x", "y"));
        }
    }

    @Test
    @DisplayName("missing query or asset class → InvalidArgument")
    void missingInputs_rejected() {
        assertThrows(InvalidArgumentException.class,
            () -> AlphaVantageRequestBuilder.build(null, AssetClass.EQUITY));
        assertThrows(InvalidArgumentException.class,
            () -> AlphaVantageRequestBuilder.build(PriceQuery.daily("IBM", true), null));
    }
}
