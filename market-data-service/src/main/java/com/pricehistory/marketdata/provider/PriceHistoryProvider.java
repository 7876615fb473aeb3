package com.pricehistory.marketdata.provider;

import com.pricehistory.common.model.Interval;
import com.pricehistory.common.model.Period;
import com.pricehistory.common.model.PriceSeries;
import com.pricehistory.common.model.PriceTable;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Strategy interface for historical price retrieval. Failures are emitted as
 * {@link com.pricehistory.common.exception.MarketDataException} error signals.
 */
public interface PriceHistoryProvider {

    Mono<PriceSeries> fetchSeries(String symbol, Period period, Interval interval, boolean adjusted);

    Mono<PriceTable> fetchTable(List<String> symbols, Period period, Interval interval, boolean adjusted);
}
