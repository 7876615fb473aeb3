package com.pricehistory.marketdata.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pricehistory.common.exception.FailureKind;

/**
 * Error body returned by the REST surface.
 */
public record ErrorResponse(
    @JsonProperty("kind")    FailureKind kind,
    @JsonProperty("message") String      message
) {}
