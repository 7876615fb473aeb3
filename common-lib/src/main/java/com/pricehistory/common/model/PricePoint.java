package com.pricehistory.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

public record PricePoint(
    @JsonProperty("timestamp") LocalDateTime timestamp,
    @JsonProperty("value")     double        value
) {}
