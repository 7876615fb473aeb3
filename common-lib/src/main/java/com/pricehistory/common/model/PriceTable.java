package com.pricehistory.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Multi-symbol price table.
 *
 * <p>{@code series} keeps every constituent series untouched; {@code rows} is the
 * timestamp-aligned matrix holding only timestamps present in every series, one value per
 * symbol column in {@code symbols} order. Built by
 * {@link com.pricehistory.common.align.SeriesAligner}.
 */
public record PriceTable(
    @JsonProperty("symbols") List<String>             symbols,
    @JsonProperty("series")  Map<String, PriceSeries> series,
    @JsonProperty("rows")    List<Row>                rows
) {
    public PriceTable {
        symbols = List.copyOf(symbols);
        series = Collections.unmodifiableMap(new LinkedHashMap<>(series));
        rows = List.copyOf(rows);
        for (Row row : rows) {
            if (row.values().size() != symbols.size()) {
                throw new IllegalArgumentException(
                    "Row at " + row.timestamp() + " has " + row.values().size()
                        + " values for " + symbols.size() + " symbols");
            }
        }
    }

    public record Row(
        @JsonProperty("timestamp") LocalDateTime timestamp,
        @JsonProperty("values")    List<Double>  values
    ) {
        public Row {
            values = List.copyOf(values);
        }

        public double value(int column) {
            return values.get(column);
        }
    }

    @JsonIgnore
    public int rowCount() {
        return rows.size();
    }

    @JsonIgnore
    public List<LocalDateTime> timestamps() {
        List<LocalDateTime> out = new ArrayList<>(rows.size());
        rows.forEach(r -> out.add(r.timestamp()));
        return out;
    }

    /** Aligned values of one symbol column, oldest first. */
    public List<Double> column(String symbol) {
        int idx = symbols.indexOf(symbol);
        if (idx < 0) {
            throw new IllegalArgumentException("Unknown symbol column: " + symbol);
        }
        List<Double> out = new ArrayList<>(rows.size());
        rows.forEach(r -> out.add(r.value(idx)));
        return out;
    }
}
