package com.pricehistory.common.align;

import com.pricehistory.common.exception.InvalidArgumentException;
import com.pricehistory.common.model.AssetClass;
import com.pricehistory.common.model.PricePoint;
import com.pricehistory.common.model.PriceSeries;
import com.pricehistory.common.model.PriceTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SeriesAlignerTest {

    private static LocalDateTime day(int d) {
        return LocalDateTime.of(2024, 1, d, 0, 0);
    }

    private static PriceSeries series(String symbol, int... days) {
        List<PricePoint> points = new ArrayList<>();
        for (int d : days) {
            points.add(new PricePoint(day(d), d * 10.0));
        }
        return new PriceSeries(symbol, AssetClass.EQUITY, null, points);
    }

    @Test
    @DisplayName("{1,2,3} ∩ {2,3,4} → rows at 2 and 3")
    void innerJoin_keepsCommonTimestamps() {
        PriceTable table = SeriesAligner.innerJoin(List.of(series("A", 1, 2, 3), series("B", 2, 3, 4)));

        assertEquals(List.of(day(2), day(3)), table.timestamps());
        assertEquals(List.of("A", "B"), table.symbols());
        assertEquals(List.of(20.0, 30.0), table.column("B"));
    }

    @Test
    @DisplayName("column order follows input order and original series are kept")
    void columnOrder() {
        PriceTable table = SeriesAligner.innerJoin(List.of(series("Z", 1, 2), series("A", 1, 2)));

        assertEquals(List.of("Z", "A"), table.symbols());
        assertEquals(List.of("Z", "A"), List.copyOf(table.series().keySet()));
        assertEquals(2, table.series().get("A").size());
    }

    @Test
    @DisplayName("disjoint series → empty table, not an error")
    void disjoint_emptyRows() {
        PriceTable table = SeriesAligner.innerJoin(List.of(series("A", 1, 2), series("B", 3, 4)));
        assertEquals(0, table.rowCount());
    }

    @Test
    @DisplayName("single series → one column, every point")
    void singleSeries() {
        PriceTable table = SeriesAligner.innerJoin(List.of(series("A", 1, 2, 3)));
        assertEquals(3, table.rowCount());
        assertEquals(30.0, table.rows().get(2).value(0));
    }

    @Test
    @DisplayName("empty input or duplicate symbols → InvalidArgument")
    void invalidInput() {
        assertThrows(InvalidArgumentException.class, () -> SeriesAligner.innerJoin(List.of()));
        assertThrows(InvalidArgumentException.class,
            () -> SeriesAligner.innerJoin(List.of(series("A", 1), series("A", 1))));
    }

    @Test
    @DisplayName("UTC crypto and exchange-local equity points join on wall-clock time")
    void mixedZones_joinOnWallClock() {
        LocalDateTime t0935 = LocalDateTime.of(2024, 1, 2, 9, 35);
        LocalDateTime t0940 = LocalDateTime.of(2024, 1, 2, 9, 40);
        PriceSeries equity = new PriceSeries("IBM", AssetClass.EQUITY, null,
            List.of(new PricePoint(t0935, 160.0), new PricePoint(t0940, 161.0)));
        PriceSeries crypto = new PriceSeries("BTC", AssetClass.CRYPTO, ZoneOffset.UTC,
            List.of(new PricePoint(t0935, 42000.0)));

        PriceTable table = SeriesAligner.innerJoin(List.of(equity, crypto));

        assertEquals(List.of(t0935), table.timestamps());
        assertEquals(List.of(160.0, 42000.0), table.rows().get(0).values());
    }
}
