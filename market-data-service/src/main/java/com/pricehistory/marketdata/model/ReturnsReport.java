package com.pricehistory.marketdata.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pricehistory.common.returns.ReturnsTable;

import java.util.Map;

/**
 * Returns over an aligned price table, with the observation length in years and the
 * per-symbol mean return annualised by it.
 */
public record ReturnsReport(
    @JsonProperty("timeStep")         double              timeStep,
    @JsonProperty("annualizedMean")   Map<String, Double> annualizedMean,
    @JsonProperty("returns")          ReturnsTable        returns
) {}
