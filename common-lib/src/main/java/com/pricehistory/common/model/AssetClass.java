package com.pricehistory.common.model;

/**
 * Instrument family. Drives function naming and price-column selection,
 * see {@link com.pricehistory.common.classifier.AssetClassifier}.
 */
public enum AssetClass {
    EQUITY,
    CRYPTO
}
