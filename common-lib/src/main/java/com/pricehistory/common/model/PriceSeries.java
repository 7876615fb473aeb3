package com.pricehistory.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Canonical price series for one symbol: strictly ascending, unique timestamps, immutable.
 *
 * <p>{@code zone} is {@code UTC} for crypto series (the provider stamps them in UTC) and
 * {@code null} for equities, whose timestamps are exchange-local wall-clock times.
 */
public record PriceSeries(
    @JsonProperty("symbol")     String           symbol,
    @JsonProperty("assetClass") AssetClass       assetClass,
    @JsonProperty("zone")       ZoneId           zone,
    @JsonProperty("points")     List<PricePoint> points
) {
    public PriceSeries {
        points = List.copyOf(points);
        for (int i = 1; i < points.size(); i++) {
            if (!points.get(i).timestamp().isAfter(points.get(i - 1).timestamp())) {
                throw new IllegalArgumentException(
                    "Series timestamps must be strictly ascending. symbol=" + symbol
                        + " at=" + points.get(i).timestamp());
            }
        }
    }

    public int size() {
        return points.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return points.isEmpty();
    }

    @JsonIgnore
    public List<LocalDateTime> timestamps() {
        List<LocalDateTime> out = new ArrayList<>(points.size());
        points.forEach(p -> out.add(p.timestamp()));
        return out;
    }
}
