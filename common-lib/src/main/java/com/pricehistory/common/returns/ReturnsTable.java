package com.pricehistory.common.returns;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pricehistory.common.model.PriceTable;

import java.util.List;

/**
 * Per-period returns aligned like the source {@link PriceTable}, minus its first row.
 * Each row's timestamp is the end of the period the return covers.
 */
public record ReturnsTable(
    @JsonProperty("kind")    ReturnKind           kind,
    @JsonProperty("symbols") List<String>         symbols,
    @JsonProperty("rows")    List<PriceTable.Row> rows
) {
    public ReturnsTable {
        symbols = List.copyOf(symbols);
        rows = List.copyOf(rows);
    }

    /** Arithmetic mean of one symbol column; NaN when there are no rows. */
    public double mean(String symbol) {
        int idx = symbols.indexOf(symbol);
        if (idx < 0) {
            throw new IllegalArgumentException("Unknown symbol column: " + symbol);
        }
        return rows.stream().mapToDouble(r -> r.value(idx)).average().orElse(Double.NaN);
    }
}
