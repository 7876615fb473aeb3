package com.pricehistory.common.classifier;

import com.pricehistory.common.model.AssetClass;

import java.util.List;
import java.util.Set;

/**
 * Pure stateless classifier mapping a ticker to its {@link AssetClass}.
 *
 * <p>Crypto is recognised only through the static coin list below; every other symbol
 * is treated as an equity. Matching is exact and case-sensitive. No external lookup.
 */
public final class AssetClassifier {

    private static final List<String> COIN_NAMES =
        List.of("BTC", "ETH", "DOGE", "AVAX", "SHIB", "LINK", "BCH", "LTC", "ETC", "AAVE");

    private static final Set<String> COIN_SET = Set.copyOf(COIN_NAMES);

    private AssetClassifier() {}

    public static AssetClass classify(String symbol) {
        return symbol != null && COIN_SET.contains(symbol) ? AssetClass.CRYPTO : AssetClass.EQUITY;
    }

    /** Supported cryptocurrency tickers, in their canonical order. */
    public static List<String> coinNames() {
        return COIN_NAMES;
    }
}
