package com.pricehistory.marketdata.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricehistory.common.align.SeriesAligner;
import com.pricehistory.common.classifier.AssetClassifier;
import com.pricehistory.common.exception.AggregateFetchException;
import com.pricehistory.common.exception.InvalidArgumentException;
import com.pricehistory.common.exception.MalformedResponseException;
import com.pricehistory.common.model.AssetClass;
import com.pricehistory.common.model.Interval;
import com.pricehistory.common.model.Period;
import com.pricehistory.common.model.PriceQuery;
import com.pricehistory.common.model.PriceSeries;
import com.pricehistory.common.model.PriceTable;
import com.pricehistory.common.normalize.TimeSeriesNormalizer;
import com.pricehistory.common.request.AlphaVantageRequestBuilder;
import com.pricehistory.common.request.ProviderRequest;
import com.pricehistory.marketdata.client.ResilientHttpClient;
import com.pricehistory.marketdata.provider.PriceHistoryProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Drives the retrieval pipeline for one or many symbols.
 *
 * <p><strong>Per symbol:</strong>
 * <ol>
 *   <li>{@link AssetClassifier} decides EQUITY vs CRYPTO.</li>
 *   <li>{@link AlphaVantageRequestBuilder} shapes the {@code /query} parameters.</li>
 *   <li>{@link ResilientHttpClient} executes them with retry/backoff.</li>
 *   <li>{@link TimeSeriesNormalizer} extracts the canonical series.</li>
 * </ol>
 *
 * <p><strong>Tables:</strong> symbols are fetched with {@code flatMapSequential}, at most
 * {@code fetchConcurrency} in flight (1 by default, i.e. strictly sequential). Results keep the
 * request order, so column order never depends on completion order. The first failing symbol
 * fails the whole table with {@link AggregateFetchException}; no partial table is produced.
 */
@Service
public class AssetAggregator implements PriceHistoryProvider {

    private static final Logger log = LoggerFactory.getLogger(AssetAggregator.class);

    static final String QUERY_PATH    = "/query";
    static final String API_KEY_PARAM = "apikey";

    private final ResilientHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final int fetchConcurrency;

    public AssetAggregator(ResilientHttpClient httpClient,
                           ObjectMapper objectMapper,
                           @Value("${alpha-vantage.api-key:demo}") String apiKey,
                           @Value("${alpha-vantage.fetch-concurrency:1}") int fetchConcurrency) {
        if (fetchConcurrency < 1) {
            throw new IllegalArgumentException("fetchConcurrency must be at least 1");
        }
        this.httpClient       = httpClient;
        this.objectMapper     = objectMapper;
        this.apiKey           = apiKey;
        this.fetchConcurrency = fetchConcurrency;
    }

    @Override
    public Mono<PriceSeries> fetchSeries(String symbol, Period period, Interval interval, boolean adjusted) {
        return Mono.fromCallable(() -> PriceQuery.of(symbol, period, interval, adjusted))
            .flatMap(query -> fetchSeries(query));
    }

    public Mono<PriceSeries> fetchSeries(PriceQuery query) {
        AssetClass assetClass = AssetClassifier.classify(query.symbol());
        return Mono.fromCallable(() -> AlphaVantageRequestBuilder.build(query, assetClass))
            .doOnNext(request -> log.info("Fetching price history. symbol={} assetClass={} function={}",
                                          query.symbol(), assetClass, request.functionId()))
            .flatMap(request -> httpClient.get(QUERY_PATH, withApiKey(request)))
            .map(body -> parse(body, query))
            .map(payload -> TimeSeriesNormalizer.normalize(payload, query, assetClass))
            .doOnSuccess(series -> {
                if (series != null) {
                    log.info("Price history fetched. symbol={} points={}", series.symbol(), series.size());
                }
            })
            .doOnError(e -> log.warn("Price history fetch failed. symbol={} reason={}",
                                     query.symbol(), e.getMessage()));
    }

    @Override
    public Mono<PriceTable> fetchTable(List<String> symbols, Period period, Interval interval, boolean adjusted) {
        return Mono.fromCallable(() -> queries(symbols, period, interval, adjusted))
            .flatMapMany(Flux::fromIterable)
            .flatMapSequential(query -> fetchSeries(query)
                    .onErrorMap(e -> new AggregateFetchException(query.symbol(), e)),
                fetchConcurrency)
            .collectList()
            .map(SeriesAligner::innerJoin)
            .doOnSuccess(table -> {
                if (table != null) {
                    log.info("Price table aligned. symbols={} rows={}", table.symbols(), table.rowCount());
                }
            });
    }

    /**
     * Validates the whole request before any network call is made.
     */
    private static List<PriceQuery> queries(List<String> symbols, Period period, Interval interval, boolean adjusted) {
        if (symbols == null || symbols.isEmpty()) {
            throw new InvalidArgumentException("Empty symbols input.");
        }
        Set<String> seen = new HashSet<>();
        List<PriceQuery> out = new ArrayList<>(symbols.size());
        for (String symbol : symbols) {
            PriceQuery query = PriceQuery.of(symbol, period, interval, adjusted);
            if (!seen.add(query.symbol())) {
                throw new InvalidArgumentException("Duplicate symbol in request: " + query.symbol());
            }
            out.add(query);
        }
        return out;
    }

    private Map<String, String> withApiKey(ProviderRequest request) {
        Map<String, String> params = new LinkedHashMap<>(request.params());
        params.put(API_KEY_PARAM, apiKey);
        return params;
    }

    private JsonNode parse(String body, PriceQuery query) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("Response is not valid JSON. symbol=" + query.symbol(), e);
        }
    }
}
