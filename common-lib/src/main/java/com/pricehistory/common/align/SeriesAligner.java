package com.pricehistory.common.align;

import com.pricehistory.common.exception.InvalidArgumentException;
import com.pricehistory.common.model.PricePoint;
import com.pricehistory.common.model.PriceSeries;
import com.pricehistory.common.model.PriceTable;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure inner join of several {@link PriceSeries} on timestamp equality.
 *
 * <p>A timestamp becomes a table row only if every series has a point at it. Column order
 * follows the input order. No logging. No side-effects.
 *
 * <p>Timestamps are compared as wall-clock {@link LocalDateTime} values; {@link PriceSeries#zone()}
 * is not consulted. Crypto series are stamped in UTC while equity series carry exchange-local
 * time, so in a mixed intraday table a crypto 09:35 UTC point lines up with an equity 09:35
 * exchange-time point. Daily and coarser periods are unaffected since both sides use
 * start-of-day dates.
 */
public final class SeriesAligner {

    private SeriesAligner() {}

    public static PriceTable innerJoin(List<PriceSeries> seriesList) {
        if (seriesList == null || seriesList.isEmpty()) {
            throw new InvalidArgumentException("At least one series is required to build a table");
        }

        List<String> symbols = new ArrayList<>(seriesList.size());
        Map<String, PriceSeries> bySymbol = new LinkedHashMap<>();
        List<Map<LocalDateTime, Double>> lookups = new ArrayList<>(seriesList.size());
        for (PriceSeries s : seriesList) {
            if (bySymbol.putIfAbsent(s.symbol(), s) != null) {
                throw new InvalidArgumentException("Duplicate symbol column: " + s.symbol());
            }
            symbols.add(s.symbol());
            Map<LocalDateTime, Double> lookup = new HashMap<>(s.size() * 2);
            for (PricePoint p : s.points()) {
                lookup.put(p.timestamp(), p.value());
            }
            lookups.add(lookup);
        }

        // drive from the first series; its points are already ascending
        List<PriceTable.Row> rows = new ArrayList<>();
        for (PricePoint anchor : seriesList.get(0).points()) {
            List<Double> values = new ArrayList<>(symbols.size());
            for (Map<LocalDateTime, Double> lookup : lookups) {
                Double v = lookup.get(anchor.timestamp());
                if (v == null) {
                    break;
                }
                values.add(v);
            }
            if (values.size() == symbols.size()) {
                rows.add(new PriceTable.Row(anchor.timestamp(), values));
            }
        }
        return new PriceTable(symbols, bySymbol, rows);
    }
}
