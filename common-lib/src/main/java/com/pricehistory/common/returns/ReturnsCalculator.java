package com.pricehistory.common.returns;

import com.pricehistory.common.exception.InvalidArgumentException;
import com.pricehistory.common.model.PriceTable;

import java.util.ArrayList;
import java.util.List;

/**
 * Pure stateless return transforms over an aligned {@link PriceTable}.
 *
 * <ul>
 *   <li>log return        r_t = ln(p_t / p_{t-1})</li>
 *   <li>arithmetic return R_t = exp(r_t) - 1</li>
 * </ul>
 *
 * <p>The first row has no predecessor and is dropped. Prices must be strictly positive.
 */
public final class ReturnsCalculator {

    private ReturnsCalculator() {}

    public static ReturnsTable compute(PriceTable prices, ReturnKind kind) {
        return kind == ReturnKind.ARITHMETIC ? arithmeticReturns(prices) : logReturns(prices);
    }

    public static ReturnsTable logReturns(PriceTable prices) {
        return new ReturnsTable(ReturnKind.LOG, prices.symbols(), logRows(prices));
    }

    public static ReturnsTable arithmeticReturns(PriceTable prices) {
        List<PriceTable.Row> rows = new ArrayList<>();
        for (PriceTable.Row logRow : logRows(prices)) {
            List<Double> values = new ArrayList<>(logRow.values().size());
            logRow.values().forEach(r -> values.add(Math.expm1(r)));
            rows.add(new PriceTable.Row(logRow.timestamp(), values));
        }
        return new ReturnsTable(ReturnKind.ARITHMETIC, prices.symbols(), rows);
    }

    private static List<PriceTable.Row> logRows(PriceTable prices) {
        List<PriceTable.Row> source = prices.rows();
        List<PriceTable.Row> out = new ArrayList<>(Math.max(0, source.size() - 1));
        for (int i = 1; i < source.size(); i++) {
            PriceTable.Row prev = source.get(i - 1);
            PriceTable.Row curr = source.get(i);
            List<Double> values = new ArrayList<>(curr.values().size());
            for (int c = 0; c < curr.values().size(); c++) {
                double p0 = prev.value(c);
                double p1 = curr.value(c);
                if (p0 <= 0.0 || p1 <= 0.0) {
                    throw new InvalidArgumentException("Non-positive price for symbol="
                        + prices.symbols().get(c) + " near " + curr.timestamp());
                }
                values.add(Math.log(p1 / p0));
            }
            out.add(new PriceTable.Row(curr.timestamp(), values));
        }
        return out;
    }
}
