package com.pricehistory.common.classifier;

import com.pricehistory.common.model.AssetClass;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AssetClassifierTest {

    @ParameterizedTest
    @ValueSource(strings = {"BTC", "ETH", "DOGE", "AVAX", "SHIB", "LINK", "BCH", "LTC", "ETC", "AAVE"})
    @DisplayName("every listed coin → CRYPTO")
    void listedCoins_areCrypto(String symbol) {
        assertEquals(AssetClass.CRYPTO, AssetClassifier.classify(symbol));
    }

    @ParameterizedTest
    @ValueSource(strings = {"IBM", "AAPL", "MSFT", "SOL", "XRP"})
    @DisplayName("anything outside the coin list → EQUITY")
    void otherSymbols_areEquity(String symbol) {
        assertEquals(AssetClass.EQUITY, AssetClassifier.classify(symbol));
    }

    @Test
    @DisplayName("matching is case-sensitive")
    void lowerCaseCoin_isEquity() {
        assertEquals(AssetClass.EQUITY, AssetClassifier.classify("btc"));
    }

    @Test
    @DisplayName("null symbol → EQUITY")
    void nullSymbol_isEquity() {
        assertEquals(AssetClass.EQUITY, AssetClassifier.classify(null));
    }

    @Test
    @DisplayName("coinNames() keeps canonical order and is unmodifiable")
    void coinNames() {
        List<String> coins = AssetClassifier.coinNames();
        assertEquals(10, coins.size());
        assertEquals("BTC", coins.get(0));
        assertEquals("AAVE", coins.get(9));
        assertThrows(UnsupportedOperationException.class, () -> coins.add("SOL"));
    }
}
